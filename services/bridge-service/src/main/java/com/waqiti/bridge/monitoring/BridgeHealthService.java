package com.waqiti.bridge.monitoring;

import com.waqiti.bridge.alert.BridgeEventPublisher;
import com.waqiti.bridge.chain.ChainConfigRegistry;
import com.waqiti.bridge.chain.ChainWatchService;
import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.fee.FeeCalculator;
import com.waqiti.bridge.governance.BridgePauseState;
import com.waqiti.bridge.transfer.TransferRepository;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridge health: ledger reachability, stuck transfers, validator set size and oracle freshness.
 * Stuck transfers and stale price feeds raise one alert each until they recover.
 */
@Slf4j
@Service
public class BridgeHealthService {

    private final ChainWatchService chainWatchService;
    private final ChainConfigRegistry chainConfigs;
    private final TransferRepository transferRepository;
    private final ValidatorRegistry validatorRegistry;
    private final FeeCalculator feeCalculator;
    private final BridgePauseState pauseState;
    private final BridgeEventPublisher events;
    private final BridgeProperties properties;
    private final Clock clock;

    private final Set<String> alertedStuckTransfers = ConcurrentHashMap.newKeySet();
    private final Set<String> alertedStalePairs = ConcurrentHashMap.newKeySet();

    public BridgeHealthService(ChainWatchService chainWatchService,
                               ChainConfigRegistry chainConfigs,
                               TransferRepository transferRepository,
                               ValidatorRegistry validatorRegistry,
                               FeeCalculator feeCalculator,
                               BridgePauseState pauseState,
                               BridgeEventPublisher events,
                               BridgeProperties properties,
                               Clock clock) {
        this.chainWatchService = chainWatchService;
        this.chainConfigs = chainConfigs;
        this.transferRepository = transferRepository;
        this.validatorRegistry = validatorRegistry;
        this.feeCalculator = feeCalculator;
        this.pauseState = pauseState;
        this.events = events;
        this.properties = properties;
        this.clock = clock;
    }

    public BridgeHealthReport checkHealth() {
        Instant now = clock.instant();
        BridgeHealthReport.BridgeHealthReportBuilder report = BridgeHealthReport.builder().checkedAt(now);
        boolean healthy = true;

        Map<String, ChainWatchService.ChainStatus> statuses = chainWatchService.chainStatus();
        for (ChainConfig chain : chainConfigs.all()) {
            ChainWatchService.ChainStatus status = statuses.get(chain.getChainId());
            boolean responsive = status != null && status.responsive();
            report.chainStatus(chain.getChainId(), responsive);
            if (!responsive) {
                healthy = false;
                report.issue("Chain " + chain.getChainId() + " is not responding"
                        + (status != null && status.lastError() != null ? ": " + status.lastError() : ""));
            }
        }

        int stuck = 0;
        Duration threshold = properties.getChain().getStuckTransferThreshold();
        for (Transfer transfer : transferRepository.findAll().stream()
                .sorted(Comparator.comparing(Transfer::getCreatedAt)).toList()) {
            if (isStuck(transfer, now, threshold)) {
                stuck++;
                report.stuckTransfer(transfer.getTransferId());
                if (alertedStuckTransfers.add(transfer.getTransferId())) {
                    events.transferAlert(AlertType.STUCK_TRANSFER, transfer, String.format(
                            "Transfer %s in %s since %s%s", transfer.getTransferId(), transfer.getStatus(),
                            transfer.getCreatedAt(), transfer.isRequiresOperatorIntervention()
                                    ? ", requires operator intervention: " + transfer.getLastError() : ""));
                }
            } else {
                alertedStuckTransfers.remove(transfer.getTransferId());
            }
        }
        if (stuck > 0) {
            healthy = false;
            report.issue(stuck + " transfers stuck or awaiting operator intervention");
        }

        int eligible = validatorRegistry.eligibleCount();
        report.eligibleValidators(eligible);
        if (eligible < properties.getValidator().getMinActiveValidators()) {
            healthy = false;
            report.issue(String.format("Only %d eligible validators, minimum is %d",
                    eligible, properties.getValidator().getMinActiveValidators()));
        }

        if (hasFiatBounds()) {
            for (ChainConfig chain : chainConfigs.all()) {
                String pair = chain.getPriceFeedPair();
                if (pair == null) {
                    continue;
                }
                if (feeCalculator.isOracleStale(pair)) {
                    report.issue("Oracle price for " + pair + " is stale; fee quotes paused");
                    if (alertedStalePairs.add(pair)) {
                        events.chainAlert(AlertType.ORACLE_STALE, chain.getChainId(),
                                "Price feed " + pair + " older than " + properties.getFee().getStalenessCutoff());
                    }
                } else {
                    alertedStalePairs.remove(pair);
                }
            }
        }

        if (pauseState.isPaused()) {
            report.paused(true);
            report.issue("Bridge paused since " + pauseState.pausedAt());
        }

        BridgeHealthReport result = report.healthy(healthy).build();
        if (!healthy) {
            log.warn("Bridge unhealthy: {}", result.getIssues());
        }
        return result;
    }

    private static boolean isStuck(Transfer transfer, Instant now, Duration threshold) {
        if (transfer.isRequiresOperatorIntervention()) {
            return true;
        }
        if (transfer.getStatus() == null || transfer.getStatus().isTerminal()) {
            return false;
        }
        return Duration.between(transfer.getCreatedAt(), now).compareTo(threshold) > 0;
    }

    private boolean hasFiatBounds() {
        return properties.getFee().getFiatMinimum() != null || properties.getFee().getFiatMaximum() != null;
    }
}
