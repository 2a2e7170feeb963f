package com.waqiti.bridge.exception;

public class SlashDisputeException extends BridgeException {
    public SlashDisputeException(String message) {
        super(BridgeErrorCode.SLASH_DISPUTE, message);
    }

    public SlashDisputeException(String message, Throwable cause) {
        super(BridgeErrorCode.SLASH_DISPUTE, message, cause);
    }
}
