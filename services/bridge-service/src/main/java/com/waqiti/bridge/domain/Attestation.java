package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A validator's signed claim that a lock event occurred. Immutable once recorded.
 */
@Value
@Builder
public class Attestation {

    String validatorId;

    AttestationPayload payload;

    /**
     * Base64 signature over {@link AttestationPayload#toSigningBytes()}.
     */
    String signature;

    Instant timestamp;

    public String getTransferId() {
        return payload.getTransferId();
    }
}
