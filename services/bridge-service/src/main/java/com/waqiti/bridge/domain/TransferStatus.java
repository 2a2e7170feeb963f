package com.waqiti.bridge.domain;

/**
 * Lifecycle states of a cross-ledger transfer.
 *
 * <h3>Status Flow:</h3>
 * <pre>
 * INITIATED → CONFIRMED → ATTESTING → FINALIZED → COMPLETED
 *     ↓                      ↓  ↑  ↓
 *  DROPPED               DISPUTED  ↓
 *                            ↓     ↓
 *                           EXPIRED → REFUNDED
 * </pre>
 *
 * <h3>Terminal States:</h3>
 * <ul>
 *   <li>COMPLETED - mint confirmed on the destination ledger</li>
 *   <li>REFUNDED - value returned to the sender on the source ledger</li>
 *   <li>DROPPED - lock reorganised out of the source ledger or never confirmed</li>
 * </ul>
 *
 * <p>FINALIZED and EXPIRED are closed for attestations but not terminal:
 * each still has exactly one forward transition.</p>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
public enum TransferStatus {

    /**
     * Lock event sighted on the source ledger, not yet deep enough.
     * <p><b>Next States:</b> CONFIRMED, DROPPED</p>
     */
    INITIATED("Lock observed", false, false),

    /**
     * Lock event reached the source chain's confirmation depth.
     * <p><b>Next States:</b> ATTESTING</p>
     */
    CONFIRMED("Lock confirmed", false, false),

    /**
     * Collecting validator attestations.
     * <p><b>Next States:</b> FINALIZED, EXPIRED, DISPUTED</p>
     */
    ATTESTING("Collecting attestations", false, false),

    /**
     * A slash implicates an attestation already counted toward this transfer.
     * Finalization is halted until the slash is resolved.
     * <p><b>Next States:</b> ATTESTING, FINALIZED, EXPIRED</p>
     */
    DISPUTED("Halted pending slash resolution", false, false),

    /**
     * Threshold reached, proof bundle built and mint submitted (or held).
     * <p><b>Next States:</b> COMPLETED</p>
     */
    FINALIZED("Mint authorized", true, false),

    /**
     * Mint confirmed on the destination ledger.
     * <p><b>Terminal State:</b> No further transitions</p>
     */
    COMPLETED("Completed", true, true),

    /**
     * Validation timeout elapsed without threshold. Refund path is open after the grace period.
     * <p><b>Next States:</b> REFUNDED</p>
     */
    EXPIRED("Expired", true, false),

    /**
     * Refund executed on the source ledger.
     * <p><b>Terminal State:</b> No further transitions</p>
     */
    REFUNDED("Refunded", true, true),

    /**
     * The lock left the source ledger before reaching confirmation depth. Nothing was locked,
     * so there is nothing to refund.
     * <p><b>Terminal State:</b> No further transitions</p>
     */
    DROPPED("Lock dropped", true, true);

    private final String description;
    private final boolean closedForAttestation;
    private final boolean terminal;

    TransferStatus(String description, boolean closedForAttestation, boolean terminal) {
        this.description = description;
        this.closedForAttestation = closedForAttestation;
        this.terminal = terminal;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Whether attestations and duplicate mint submissions referencing a transfer in this
     * state are ignored.
     */
    public boolean isClosedForAttestation() {
        return closedForAttestation;
    }

    /**
     * Whether the transfer still waits on validator consensus.
     */
    public boolean isPendingConsensus() {
        return this == ATTESTING || this == DISPUTED;
    }

    /**
     * Validates if a transition from this status to the target status is allowed.
     *
     * <p><b>Valid Transitions:</b></p>
     * <ul>
     *   <li>INITIATED → CONFIRMED, DROPPED</li>
     *   <li>CONFIRMED → ATTESTING</li>
     *   <li>ATTESTING → FINALIZED, EXPIRED, DISPUTED</li>
     *   <li>DISPUTED → ATTESTING, FINALIZED, EXPIRED</li>
     *   <li>FINALIZED → COMPLETED</li>
     *   <li>EXPIRED → REFUNDED</li>
     * </ul>
     *
     * @param targetStatus the status to transition to
     * @return true if the transition is valid
     * @throws IllegalArgumentException if targetStatus is null
     */
    public boolean canTransitionTo(TransferStatus targetStatus) {
        if (targetStatus == null) {
            throw new IllegalArgumentException("Target status cannot be null");
        }

        if (this.isTerminal() || this == targetStatus) {
            return false;
        }

        switch (this) {
            case INITIATED:
                return targetStatus == CONFIRMED || targetStatus == DROPPED;

            case CONFIRMED:
                return targetStatus == ATTESTING;

            case ATTESTING:
                return targetStatus == FINALIZED ||
                       targetStatus == EXPIRED ||
                       targetStatus == DISPUTED;

            case DISPUTED:
                return targetStatus == ATTESTING ||
                       targetStatus == FINALIZED ||
                       targetStatus == EXPIRED;

            case FINALIZED:
                return targetStatus == COMPLETED;

            case EXPIRED:
                return targetStatus == REFUNDED;

            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
