package com.waqiti.bridge.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A cross-ledger transfer from lock on the source ledger to mint or refund.
 *
 * <p>Mutated only by the transfer state machine while it holds the per-transfer lock.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Transfer {

    private String transferId;
    private String sourceChain;
    private String destChain;
    private String sender;
    private String recipient;
    private BigDecimal amount;
    private long nonce;

    private TransferStatus status;

    /**
     * Attestations counted toward the threshold, in arrival order.
     */
    @Builder.Default
    private List<Attestation> attestations = new ArrayList<>();

    private BigDecimal fee;
    private BigDecimal mintAmount;

    private ChainConfig sourceConfig;
    private ChainConfig destConfig;

    private String sourceTxHash;
    private String mintTxHash;
    private String refundTxHash;

    private ProofBundle proofBundle;

    private Instant createdAt;
    private Instant confirmedAt;
    private Instant expiresAt;
    private Instant finalizedAt;
    private Instant completedAt;
    private Instant expiredAt;
    private Instant refundedAt;
    private Instant updatedAt;

    /**
     * Slash events currently holding this transfer in {@link TransferStatus#DISPUTED}.
     */
    @Builder.Default
    private Set<String> openDisputes = new LinkedHashSet<>();

    /**
     * Set when a mint or refund submission exhausted its retries.
     */
    private boolean requiresOperatorIntervention;

    /**
     * Set when a mint or refund is waiting for the bridge to be unpaused.
     */
    private boolean submissionHeld;

    private String lastError;

    public int requiredAttestations() {
        return destConfig.getAttestationThreshold();
    }

    public Transfer snapshot() {
        return toBuilder()
                .attestations(new ArrayList<>(attestations))
                .openDisputes(new LinkedHashSet<>(openDisputes))
                .build();
    }
}
