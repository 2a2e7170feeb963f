package com.waqiti.bridge.attestation;

import com.waqiti.bridge.domain.AttestationPayload;

/**
 * External key management. Signs attestation payloads on behalf of a validator identity.
 */
public interface AttestationSigner {

    /**
     * @return base64 signature over {@link AttestationPayload#toSigningBytes()}
     */
    String signAttestation(String validatorId, AttestationPayload payload);
}
