package com.waqiti.bridge.domain;

public enum SlashStatus {
    /** Penalty already applied, dispute window still open. */
    APPLIED,
    /** Waiting for the dispute window to close. */
    PENDING,
    /** Contrary evidence submitted, waiting for adjudication. */
    CONTESTED,
    FINALIZED,
    OVERTURNED;

    public boolean isResolved() {
        return this == FINALIZED || this == OVERTURNED;
    }
}
