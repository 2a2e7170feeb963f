package com.waqiti.bridge.attestation;

/**
 * Result of submitting one attestation.
 */
public enum AttestationOutcome {

    /** Counted toward the threshold. */
    ACCEPTED(true),
    /** Counted, and this attestation completed the threshold. */
    THRESHOLD_REACHED(true),
    /** Verified and held until the transfer's round opens. */
    BUFFERED(false),
    /** Same validator already counted for this transfer. */
    DUPLICATE(false),
    /** Malformed payload or transfer id not derived from source chain and nonce. */
    MALFORMED(false),
    UNKNOWN_VALIDATOR(false),
    INVALID_SIGNATURE(false),
    INELIGIBLE_VALIDATOR(false),
    /** Validly signed but disagrees with the confirmed lock event. */
    PAYLOAD_MISMATCH(false),
    /** Validator signed two different payloads for the same transfer. */
    EQUIVOCATION(false),
    /** Transfer already finalized, expired or refunded. */
    REPLAY_IGNORED(false),
    /** Round closed without the transfer being recorded as closed, e.g. being torn down. */
    ROUND_CLOSED(false),
    /** Too many attestations buffered for a transfer that has not opened. */
    BUFFER_FULL(false);

    private final boolean counted;

    AttestationOutcome(boolean counted) {
        this.counted = counted;
    }

    public boolean isCounted() {
        return counted;
    }

    /**
     * Outcomes that are evidence of misbehavior rather than plain validation failures.
     */
    public boolean isMisbehavior() {
        return this == EQUIVOCATION || this == PAYLOAD_MISMATCH;
    }
}
