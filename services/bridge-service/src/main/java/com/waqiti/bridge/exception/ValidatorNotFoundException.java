package com.waqiti.bridge.exception;

public class ValidatorNotFoundException extends BridgeException {
    public ValidatorNotFoundException(String message) {
        super(BridgeErrorCode.VALIDATOR_NOT_FOUND, message);
    }

    public ValidatorNotFoundException(String message, Throwable cause) {
        super(BridgeErrorCode.VALIDATOR_NOT_FOUND, message, cause);
    }
}
