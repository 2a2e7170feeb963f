package com.waqiti.bridge.exception;

public class TransferNotFoundException extends BridgeException {
    public TransferNotFoundException(String message) {
        super(BridgeErrorCode.TRANSFER_NOT_FOUND, message);
    }

    public TransferNotFoundException(String message, Throwable cause) {
        super(BridgeErrorCode.TRANSFER_NOT_FOUND, message, cause);
    }
}
