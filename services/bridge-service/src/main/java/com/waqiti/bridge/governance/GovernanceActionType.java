package com.waqiti.bridge.governance;

public enum GovernanceActionType {
    REGISTER_VALIDATOR,
    REMOVE_VALIDATOR,
    UPDATE_THRESHOLDS,
    PAUSE,
    UNPAUSE,
    ADJUDICATE_SLASH
}
