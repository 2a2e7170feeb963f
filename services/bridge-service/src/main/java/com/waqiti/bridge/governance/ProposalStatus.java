package com.waqiti.bridge.governance;

public enum ProposalStatus {
    PENDING,
    EXECUTED,
    FAILED,
    EXPIRED,
    CANCELLED;

    public boolean isOpen() {
        return this == PENDING;
    }
}
