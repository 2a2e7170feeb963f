package com.waqiti.bridge.exception;

/**
 * Error codes for the bridge service.
 * Format: BRIDGE_NNN
 */
public enum BridgeErrorCode {

    VALIDATION_ERROR("BRIDGE_001", "Attestation or request failed validation"),
    INSUFFICIENT_STAKE("BRIDGE_002", "Stake below the registration minimum"),
    VALIDATOR_NOT_FOUND("BRIDGE_003", "Validator not registered"),
    TRANSFER_NOT_FOUND("BRIDGE_004", "Transfer not found"),
    AMOUNT_OUT_OF_RANGE("BRIDGE_005", "Amount outside the chain's allowed range"),
    CHAIN_SUBMISSION_ERROR("BRIDGE_006", "Ledger submission failed"),
    SLASH_DISPUTE("BRIDGE_007", "Slash dispute rejected"),
    ORACLE_STALE("BRIDGE_008", "Oracle price is stale"),
    GOVERNANCE_REJECTED("BRIDGE_009", "Governance operation rejected"),
    BRIDGE_PAUSED("BRIDGE_010", "Bridge is paused"),
    INVALID_STATE_TRANSITION("BRIDGE_011", "Transfer cannot move to the requested status");

    private final String code;
    private final String defaultMessage;

    BridgeErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
