package com.waqiti.bridge.monitoring;

import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferStatus;
import com.waqiti.bridge.transfer.TransferRepository;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate transfer statistics: volume, fees, success rate and per-chain totals.
 */
@Service
@RequiredArgsConstructor
public class BridgeStatisticsService {

    private final TransferRepository transferRepository;
    private final ValidatorRegistry validatorRegistry;
    private final Clock clock;

    public BridgeMetricsSnapshot snapshot() {
        List<Transfer> transfers = transferRepository.findAll();

        BigDecimal volume = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        long completed = 0;
        Duration completionTotal = Duration.ZERO;
        Map<TransferStatus, Long> byStatus = new EnumMap<>(TransferStatus.class);
        Map<String, ChainAccumulator> perChain = new TreeMap<>();

        for (Transfer transfer : transfers) {
            BigDecimal fee = transfer.getFee() != null ? transfer.getFee() : BigDecimal.ZERO;
            volume = volume.add(transfer.getAmount());
            fees = fees.add(fee);
            byStatus.merge(transfer.getStatus(), 1L, Long::sum);

            if (transfer.getStatus() == TransferStatus.COMPLETED && transfer.getCompletedAt() != null) {
                completed++;
                completionTotal = completionTotal.plus(Duration.between(transfer.getCreatedAt(), transfer.getCompletedAt()));
            }

            perChain.computeIfAbsent(transfer.getSourceChain(), c -> new ChainAccumulator()).add(transfer.getAmount(), fee);
        }

        Map<String, BridgeMetricsSnapshot.ChainTotals> chains = new TreeMap<>();
        perChain.forEach((chainId, acc) -> chains.put(chainId, BridgeMetricsSnapshot.ChainTotals.builder()
                .transactions(acc.transactions)
                .volume(acc.volume)
                .fees(acc.fees)
                .build()));

        long total = transfers.size();
        return BridgeMetricsSnapshot.builder()
                .totalTransactions(total)
                .totalVolume(volume)
                .totalFees(fees)
                .successRate(total == 0 ? BigDecimal.ZERO
                        : BigDecimal.valueOf(completed).divide(BigDecimal.valueOf(total), 4, RoundingMode.HALF_UP))
                .averageCompletionTime(completed == 0 ? Duration.ZERO : completionTotal.dividedBy(completed))
                .activeValidators(validatorRegistry.eligibleCount())
                .transfersByStatus(byStatus)
                .chains(chains)
                .generatedAt(clock.instant())
                .build();
    }

    private static final class ChainAccumulator {
        private long transactions;
        private BigDecimal volume = BigDecimal.ZERO;
        private BigDecimal fees = BigDecimal.ZERO;

        private void add(BigDecimal amount, BigDecimal fee) {
            transactions++;
            volume = volume.add(amount);
            fees = fees.add(fee);
        }
    }
}
