package com.waqiti.bridge.exception;

import lombok.Getter;

/**
 * A mint or refund submission that failed after all retries.
 */
@Getter
public class ChainSubmissionException extends BridgeException {

    private final String chainId;
    private final String transferId;

    public ChainSubmissionException(String chainId, String transferId, String message, Throwable cause) {
        super(BridgeErrorCode.CHAIN_SUBMISSION_ERROR, message, cause);
        this.chainId = chainId;
        this.transferId = transferId;
    }
}
