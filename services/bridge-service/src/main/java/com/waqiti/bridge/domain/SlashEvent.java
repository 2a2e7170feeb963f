package com.waqiti.bridge.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SlashEvent {

    private String slashId;
    private String validatorId;
    private SlashReason reason;
    private int basisPoints;

    /**
     * Stake removed. Zero until the penalty is applied.
     */
    @Builder.Default
    private BigDecimal amountSlashed = BigDecimal.ZERO;

    private Instant timestamp;
    private Instant disputeDeadline;
    private SlashStatus status;

    /**
     * Transfer whose attestation triggered the slash, if any.
     */
    private String transferId;

    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    private Instant resolvedAt;

    private boolean penaltyApplied;
}
