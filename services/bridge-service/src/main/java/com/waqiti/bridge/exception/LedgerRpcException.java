package com.waqiti.bridge.exception;

/**
 * Transient ledger communication failure. Retried with backoff.
 */
public class LedgerRpcException extends BridgeException {
    public LedgerRpcException(String message) {
        super(BridgeErrorCode.CHAIN_SUBMISSION_ERROR, message);
    }

    public LedgerRpcException(String message, Throwable cause) {
        super(BridgeErrorCode.CHAIN_SUBMISSION_ERROR, message, cause);
    }
}
