package com.waqiti.bridge.domain;

/**
 * Classes of validator misbehavior.
 */
public enum SlashReason {

    /**
     * Two conflicting signed attestations for the same transfer. Cryptographically provable.
     */
    EQUIVOCATION(true),

    /**
     * Repeated missed attestation windows.
     */
    NON_PARTICIPATION(false),

    /**
     * A signed attestation that does not match the confirmed lock event.
     */
    INVALID_ATTESTATION(false),

    /**
     * Direct slash requested through governance.
     */
    ADMINISTRATIVE(true);

    private final boolean appliedImmediately;

    SlashReason(boolean appliedImmediately) {
        this.appliedImmediately = appliedImmediately;
    }

    /**
     * Whether the penalty lands when the event is raised rather than when its dispute window closes.
     */
    public boolean isAppliedImmediately() {
        return appliedImmediately;
    }
}
