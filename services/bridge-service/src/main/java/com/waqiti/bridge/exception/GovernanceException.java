package com.waqiti.bridge.exception;

public class GovernanceException extends BridgeException {
    public GovernanceException(String message) {
        super(BridgeErrorCode.GOVERNANCE_REJECTED, message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(BridgeErrorCode.GOVERNANCE_REJECTED, message, cause);
    }
}
