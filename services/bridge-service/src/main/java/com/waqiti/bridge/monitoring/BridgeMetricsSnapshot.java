package com.waqiti.bridge.monitoring;

import com.waqiti.bridge.domain.TransferStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Totals over all retained transfers.
 */
@Value
@Builder
public class BridgeMetricsSnapshot {

    long totalTransactions;
    BigDecimal totalVolume;
    BigDecimal totalFees;

    /**
     * Completed transfers over all transfers, 0 when there are none.
     */
    BigDecimal successRate;

    /**
     * Mean lock-to-mint time of completed transfers, {@link Duration#ZERO} when there are none.
     */
    Duration averageCompletionTime;

    int activeValidators;
    Map<TransferStatus, Long> transfersByStatus;
    Map<String, ChainTotals> chains;
    Instant generatedAt;

    @Value
    @Builder
    public static class ChainTotals {
        long transactions;
        BigDecimal volume;
        BigDecimal fees;
    }
}
