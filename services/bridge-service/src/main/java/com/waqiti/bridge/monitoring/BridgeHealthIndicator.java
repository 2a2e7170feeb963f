package com.waqiti.bridge.monitoring;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("bridge")
@RequiredArgsConstructor
public class BridgeHealthIndicator implements HealthIndicator {

    private final BridgeHealthService healthService;

    @Override
    public Health health() {
        BridgeHealthReport report = healthService.checkHealth();
        Health.Builder builder = report.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("chains", report.getChainStatuses())
                .withDetail("eligibleValidators", report.getEligibleValidators())
                .withDetail("stuckTransfers", report.getStuckTransfers().size())
                .withDetail("paused", report.isPaused())
                .withDetail("issues", report.getIssues())
                .withDetail("checkedAt", report.getCheckedAt().toString())
                .build();
    }
}
