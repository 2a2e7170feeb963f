package com.waqiti.bridge.attestation;

import com.waqiti.bridge.domain.Attestation;
import com.waqiti.bridge.domain.AttestationPayload;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregation state for a single transfer. Guarded by its own lock so unrelated transfers
 * never contend.
 */
@Getter
public class AttestationRound {

    private final String transferId;
    private final AttestationPayload expectedPayload;
    private final int threshold;
    private final BigDecimal mintAmount;
    private final Instant openedAt;
    private final Instant deadline;
    private final Set<String> eligibleAtOpen;

    /**
     * Counted attestations in arrival order. No two share a validator id.
     */
    @Getter(AccessLevel.NONE)
    final List<Attestation> accepted = new ArrayList<>();

    /**
     * First validly signed attestation seen per validator, counted or not.
     */
    @Getter(AccessLevel.NONE)
    final Map<String, Attestation> signedBy = new HashMap<>();

    @Getter(AccessLevel.NONE)
    final Set<String> excluded = new HashSet<>();

    private boolean closed;
    private boolean thresholdReached;
    private boolean held;

    @Getter(AccessLevel.NONE)
    final ReentrantLock lock = new ReentrantLock();

    AttestationRound(String transferId,
                     AttestationPayload expectedPayload,
                     int threshold,
                     BigDecimal mintAmount,
                     Instant openedAt,
                     Instant deadline,
                     Set<String> eligibleAtOpen) {
        this.transferId = transferId;
        this.expectedPayload = expectedPayload;
        this.threshold = threshold;
        this.mintAmount = mintAmount;
        this.openedAt = openedAt;
        this.deadline = deadline;
        this.eligibleAtOpen = Set.copyOf(eligibleAtOpen);
    }

    boolean hasCounted(String validatorId) {
        return accepted.stream().anyMatch(a -> a.getValidatorId().equals(validatorId));
    }

    boolean canEmitThreshold() {
        return !closed && !held && !thresholdReached && accepted.size() >= threshold;
    }

    void markThresholdReached() {
        thresholdReached = true;
    }

    void close() {
        closed = true;
    }

    void setHeld(boolean held) {
        this.held = held;
    }

    boolean exclude(String validatorId) {
        excluded.add(validatorId);
        return accepted.removeIf(a -> a.getValidatorId().equals(validatorId));
    }

    public int acceptedCount() {
        return accepted.size();
    }

    public Set<String> countedValidators() {
        lock.lock();
        try {
            Set<String> ids = new HashSet<>();
            accepted.forEach(a -> ids.add(a.getValidatorId()));
            return ids;
        } finally {
            lock.unlock();
        }
    }
}
