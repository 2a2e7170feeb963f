package com.waqiti.bridge.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A staked bridge validator.
 *
 * <p>Mutable; the registry owns every instance and hands out copies to readers.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Validator {

    private String validatorId;

    /**
     * Base64 X.509 encoding of the validator's ECDSA public key.
     */
    private String publicKey;

    private BigDecimal stakeAmount;

    /**
     * Always within [0, 100].
     */
    private int reputationScore;

    private boolean active;

    private Instant registeredAt;

    private Instant lastActivityAt;

    private Instant lastDecayAt;

    private Instant exitRequestedAt;

    @Builder.Default
    private long validatedTransfers = 0;

    /**
     * Consecutive attestation windows missed on transfers that expired.
     */
    @Builder.Default
    private int missedWindows = 0;

    @Builder.Default
    private BigDecimal totalSlashed = BigDecimal.ZERO;

    public Validator copy() {
        return toBuilder().build();
    }

    public boolean isExiting() {
        return exitRequestedAt != null;
    }
}
