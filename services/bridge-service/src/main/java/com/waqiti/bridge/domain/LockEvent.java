package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A lock of value on a source ledger, as reported by that ledger's bridge contract.
 */
@Value
@Builder(toBuilder = true)
public class LockEvent {

    String sourceChain;
    String destChain;
    long nonce;
    String sender;
    String recipient;
    BigDecimal amount;
    String txHash;
    long blockNumber;
    Instant observedAt;

    public String transferId() {
        return TransferIds.derive(sourceChain, nonce);
    }
}
