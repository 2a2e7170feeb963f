package com.waqiti.bridge.exception;

public class InvalidTransferStateException extends BridgeException {
    public InvalidTransferStateException(String message) {
        super(BridgeErrorCode.INVALID_STATE_TRANSITION, message);
    }

    public InvalidTransferStateException(String message, Throwable cause) {
        super(BridgeErrorCode.INVALID_STATE_TRANSITION, message, cause);
    }
}
