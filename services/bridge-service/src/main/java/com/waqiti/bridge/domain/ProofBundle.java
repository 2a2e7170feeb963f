package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * The ordered attestations submitted to a destination ledger to authorize a mint.
 *
 * <p>Contains exactly the first {@code threshold} valid unique attestations in arrival order,
 * re-sorted by validator id so every node builds the same bundle from the same round.</p>
 */
@Value
@Builder
public class ProofBundle {

    String transferId;

    AttestationPayload payload;

    @Singular
    List<Attestation> attestations;

    int threshold;

    BigDecimal mintAmount;

    Instant createdAt;

    public static ProofBundle fromArrivalOrder(AttestationPayload payload,
                                               List<Attestation> arrivalOrder,
                                               int threshold,
                                               BigDecimal mintAmount,
                                               Instant createdAt) {
        if (arrivalOrder.size() < threshold) {
            throw new IllegalArgumentException("Need " + threshold + " attestations, have " + arrivalOrder.size());
        }
        List<Attestation> ordered = arrivalOrder.subList(0, threshold).stream()
                .sorted(Comparator.comparing(Attestation::getValidatorId))
                .toList();
        return ProofBundle.builder()
                .transferId(payload.getTransferId())
                .payload(payload)
                .attestations(ordered)
                .threshold(threshold)
                .mintAmount(mintAmount)
                .createdAt(createdAt)
                .build();
    }
}
