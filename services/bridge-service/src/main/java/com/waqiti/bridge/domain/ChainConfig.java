package com.waqiti.bridge.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-ledger bridge parameters.
 *
 * <p>Instances are immutable. A threshold update replaces the registered config with a new
 * instance carrying a higher {@code version}; transfers keep the instance they were created
 * with, so a config never changes underneath a transfer that references it.</p>
 */
@Value
@Builder(toBuilder = true)
public class ChainConfig {

    @NonNull
    String chainId;

    String name;

    @NonNull
    ChainRole role;

    String tokenAddress;

    @NonNull
    BigDecimal minAmount;

    @NonNull
    BigDecimal maxAmount;

    int feeBasisPoints;

    int confirmationsRequired;

    int attestationThreshold;

    /**
     * Trading pair used to price the bridged token for fiat fee bounds, e.g. {@code LDAO/USD}.
     */
    String priceFeedPair;

    @Builder.Default
    long version = 1;

    public boolean acceptsAmount(BigDecimal amount) {
        return amount != null
                && amount.compareTo(minAmount) >= 0
                && amount.compareTo(maxAmount) <= 0;
    }
}
