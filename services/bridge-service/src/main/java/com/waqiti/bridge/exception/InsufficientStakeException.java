package com.waqiti.bridge.exception;

public class InsufficientStakeException extends BridgeException {
    public InsufficientStakeException(String message) {
        super(BridgeErrorCode.INSUFFICIENT_STAKE, message);
    }

    public InsufficientStakeException(String message, Throwable cause) {
        super(BridgeErrorCode.INSUFFICIENT_STAKE, message, cause);
    }
}
