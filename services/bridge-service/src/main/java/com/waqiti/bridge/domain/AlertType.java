package com.waqiti.bridge.domain;

/**
 * Closed set of alert categories emitted to the alerting sink.
 */
public enum AlertType {

    CHAIN_SUBMISSION_FAILED(AlertSeverity.CRITICAL, "Chain submission exhausted retries, operator intervention required"),
    CONSENSUS_TIMEOUT(AlertSeverity.WARNING, "Attestation threshold not reached before validation timeout"),
    EQUIVOCATION_DETECTED(AlertSeverity.CRITICAL, "Validator signed conflicting attestations"),
    VALIDATOR_SLASHED(AlertSeverity.HIGH, "Validator stake slashed"),
    SLASH_CONTESTED(AlertSeverity.HIGH, "Slash contested, awaiting adjudication"),
    TRANSFER_DISPUTED(AlertSeverity.HIGH, "Transfer halted pending slash resolution"),
    ORACLE_STALE(AlertSeverity.WARNING, "Oracle price is stale, fee quoting paused"),
    VALIDATOR_SET_BELOW_MINIMUM(AlertSeverity.CRITICAL, "Eligible validator count below minimum"),
    STUCK_TRANSFER(AlertSeverity.HIGH, "Transfer has not progressed within the expected time"),
    INVALID_LOCK_EVENT(AlertSeverity.HIGH, "Lock event rejected"),
    LOCK_DROPPED(AlertSeverity.HIGH, "Lock left the source ledger before confirmation"),
    BRIDGE_PAUSED(AlertSeverity.HIGH, "Bridge paused by governance"),
    BRIDGE_UNPAUSED(AlertSeverity.INFO, "Bridge unpaused by governance");

    private final AlertSeverity severity;
    private final String summary;

    AlertType(AlertSeverity severity, String summary) {
        this.severity = severity;
        this.summary = summary;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getSummary() {
        return summary;
    }
}
