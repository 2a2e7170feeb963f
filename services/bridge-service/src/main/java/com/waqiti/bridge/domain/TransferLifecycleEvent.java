package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published on every status change and every counted validator signature.
 */
@Value
@Builder
public class TransferLifecycleEvent {

    public enum EventType {
        STATUS_CHANGED,
        VALIDATOR_SIGNED
    }

    String eventId;
    EventType eventType;
    String transferId;
    String sourceChain;
    String destChain;
    BigDecimal amount;
    BigDecimal fee;
    TransferStatus status;
    TransferStatus previousStatus;
    String validatorId;
    int attestationCount;
    int requiredAttestations;
    String txHash;
    Instant timestamp;
}
