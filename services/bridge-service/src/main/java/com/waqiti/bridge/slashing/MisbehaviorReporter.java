package com.waqiti.bridge.slashing;

import com.waqiti.bridge.domain.Attestation;

/**
 * Receives misbehavior detected while processing transfers.
 */
public interface MisbehaviorReporter {

    /**
     * Two validly signed, conflicting attestations for the same transfer.
     */
    void reportEquivocation(String validatorId, Attestation first, Attestation second);

    /**
     * A validly signed attestation whose payload does not match the confirmed lock event.
     */
    void reportInvalidAttestation(String validatorId, String transferId, Attestation attestation);

    /**
     * The validator missed {@code consecutiveMisses} attestation windows in a row.
     */
    void reportNonParticipation(String validatorId, String transferId, int consecutiveMisses);
}
