package com.waqiti.bridge.exception;

public class ValidationException extends BridgeException {
    public ValidationException(String message) {
        super(BridgeErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(BridgeErrorCode.VALIDATION_ERROR, message, cause);
    }
}
