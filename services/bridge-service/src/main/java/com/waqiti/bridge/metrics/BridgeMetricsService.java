package com.waqiti.bridge.metrics;

import com.waqiti.bridge.attestation.AttestationOutcome;
import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.SlashReason;
import com.waqiti.bridge.domain.TransferStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bridge Metrics Service
 * Tracks transfer, attestation and slashing metrics for monitoring
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BridgeMetricsService {

    private final MeterRegistry meterRegistry;

    public void recordTransferStatus(TransferStatus status, String sourceChain, String destChain) {
        Counter.builder("bridge.transfers")
                .tag("status", status.name())
                .tag("source", sourceChain)
                .tag("destination", destChain)
                .description("Transfers entering each lifecycle status")
                .register(meterRegistry)
                .increment();
    }

    public void recordAttestation(AttestationOutcome outcome) {
        Counter.builder("bridge.attestations")
                .tag("outcome", outcome.name())
                .description("Attestation submissions by outcome")
                .register(meterRegistry)
                .increment();
    }

    public void recordSlash(SlashReason reason, BigDecimal amount) {
        log.debug("Recording slash metric: reason={}, amount={}", reason, amount);

        Counter.builder("bridge.slashes")
                .tag("reason", reason.name())
                .description("Slash events by reason")
                .register(meterRegistry)
                .increment();

        DistributionSummary.builder("bridge.slashed.stake")
                .tag("reason", reason.name())
                .description("Stake removed by slashing")
                .register(meterRegistry)
                .record(amount.doubleValue());
    }

    public void recordSubmissionFailure(String chainId, String operation) {
        Counter.builder("bridge.submission.failures")
                .tag("chain", chainId)
                .tag("operation", operation)
                .description("Ledger submissions that exhausted retries")
                .register(meterRegistry)
                .increment();
    }

    public void recordVolume(String sourceChain, BigDecimal amount, BigDecimal fee) {
        DistributionSummary.builder("bridge.volume")
                .tag("source", sourceChain)
                .baseUnit("tokens")
                .description("Locked amount per transfer")
                .register(meterRegistry)
                .record(amount.doubleValue());

        DistributionSummary.builder("bridge.fees")
                .tag("source", sourceChain)
                .baseUnit("tokens")
                .description("Fee charged per transfer")
                .register(meterRegistry)
                .record(fee.doubleValue());
    }

    public void recordCompletionTime(Duration elapsed) {
        Timer.builder("bridge.completion.time")
                .description("Time from lock sighting to confirmed mint")
                .register(meterRegistry)
                .record(elapsed);
    }

    public void recordAlert(AlertType type) {
        Counter.builder("bridge.alerts")
                .tag("type", type.name())
                .tag("severity", type.getSeverity().name())
                .description("Alerts raised by type")
                .register(meterRegistry)
                .increment();
    }

    public void registerEligibleValidatorGauge(Supplier<Number> eligibleCount) {
        Gauge.builder("bridge.validators.eligible", eligibleCount)
                .description("Validators currently counting toward thresholds")
                .register(meterRegistry);
    }
}
