package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * The tuple a validator signs when attesting to a lock event.
 */
@Value
@Builder(toBuilder = true)
public class AttestationPayload {

    String transferId;
    String sourceChain;
    String destChain;
    String recipient;
    BigDecimal amount;
    long nonce;

    public static AttestationPayload of(LockEvent event) {
        return AttestationPayload.builder()
                .transferId(event.transferId())
                .sourceChain(event.getSourceChain())
                .destChain(event.getDestChain())
                .recipient(event.getRecipient())
                .amount(event.getAmount())
                .nonce(event.getNonce())
                .build();
    }

    /**
     * Canonical encoding covered by the signature. Amounts are normalised so that
     * {@code 500} and {@code 500.00} sign identically.
     */
    public byte[] toSigningBytes() {
        return canonical().getBytes(StandardCharsets.UTF_8);
    }

    public String canonical() {
        return String.join("|",
                transferId,
                sourceChain,
                destChain,
                recipient,
                amount.stripTrailingZeros().toPlainString(),
                Long.toString(nonce));
    }

    /**
     * Payload equality on the canonical form, insensitive to amount scale.
     */
    public boolean matches(AttestationPayload other) {
        return other != null && canonical().equals(other.canonical());
    }
}
