package com.waqiti.bridge.attestation;

import com.waqiti.bridge.domain.Attestation;
import com.waqiti.bridge.domain.ProofBundle;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class AttestationResult {

    AttestationOutcome outcome;
    String transferId;
    String validatorId;
    int attestationCount;
    int threshold;
    Attestation attestation;

    /**
     * Present only for {@link AttestationOutcome#THRESHOLD_REACHED}.
     */
    ProofBundle proofBundle;

    /**
     * The earlier attestation that conflicts with this one, for {@link AttestationOutcome#EQUIVOCATION}.
     */
    Attestation conflictingAttestation;

    public Optional<ProofBundle> proofBundle() {
        return Optional.ofNullable(proofBundle);
    }

    static AttestationResult of(AttestationOutcome outcome, Attestation attestation) {
        return AttestationResult.builder()
                .outcome(outcome)
                .attestation(attestation)
                .transferId(attestation != null && attestation.getPayload() != null ? attestation.getTransferId() : null)
                .validatorId(attestation != null ? attestation.getValidatorId() : null)
                .build();
    }
}
