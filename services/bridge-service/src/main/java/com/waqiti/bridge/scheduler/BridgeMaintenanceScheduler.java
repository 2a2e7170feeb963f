package com.waqiti.bridge.scheduler;

import com.waqiti.bridge.governance.GovernanceService;
import com.waqiti.bridge.monitoring.BridgeHealthService;
import com.waqiti.bridge.slashing.SlashingEngine;
import com.waqiti.bridge.transfer.TransferStateMachine;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs for the bridge engine
 * Sweeps expired transfers, refunds, slash finalization, reputation decay, stale attestation
 * state and health checks
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BridgeMaintenanceScheduler {

    private final TransferStateMachine stateMachine;
    private final SlashingEngine slashingEngine;
    private final ValidatorRegistry validatorRegistry;
    private final GovernanceService governanceService;
    private final BridgeHealthService healthService;

    /**
     * Expire transfers whose deadline timer was missed
     * Runs every minute
     */
    @Scheduled(cron = "${waqiti.bridge.schedule.expiry:0 * * * * *}")
    public void expireOverdueTransfers() {
        try {
            int expired = stateMachine.expireOverdueTransfers();
            if (expired > 0) {
                log.info("=== Scheduled Job: Expired {} overdue transfers ===", expired);
            }
        } catch (Exception e) {
            log.error("Error expiring overdue transfers", e);
        }
    }

    /**
     * Refund expired transfers past their grace period
     * Runs every 5 minutes
     */
    @Scheduled(cron = "${waqiti.bridge.schedule.refunds:0 */5 * * * *}")
    public void refundExpiredTransfers() {
        log.info("=== Scheduled Job: Refund Expired Transfers ===");
        try {
            stateMachine.refundEligibleTransfers();
        } catch (Exception e) {
            log.error("Error refunding expired transfers", e);
        }
    }

    /**
     * Finalize slashes whose dispute window closed
     * Runs every 10 minutes
     */
    @Scheduled(cron = "${waqiti.bridge.schedule.slashes:0 */10 * * * *}")
    public void finalizeSlashes() {
        log.info("=== Scheduled Job: Finalize Slashes ===");
        try {
            slashingEngine.finalizeDueSlashes();
        } catch (Exception e) {
            log.error("Error finalizing slashes", e);
        }
    }

    /**
     * Decay reputation of inactive validators
     * Runs hourly
     */
    @Scheduled(cron = "${waqiti.bridge.schedule.reputation-decay:0 0 * * * *}")
    public void decayReputation() {
        log.info("=== Scheduled Job: Reputation Decay ===");
        try {
            validatorRegistry.decayInactive();
        } catch (Exception e) {
            log.error("Error applying reputation decay", e);
        }
    }

    /**
     * Expire stale governance proposals
     * Runs every 15 minutes
     */
    @Scheduled(cron = "${waqiti.bridge.schedule.governance:0 */15 * * * *}")
    public void expireProposals() {
        try {
            governanceService.expireStaleProposals();
        } catch (Exception e) {
            log.error("Error expiring governance proposals", e);
        }
    }

    /**
     * Forget attestation state left by rounds that closed or never opened
     * Runs every 30 minutes
     */
    @Scheduled(cron = "${waqiti.bridge.schedule.attestation-cleanup:0 */30 * * * *}")
    public void evictStaleAttestationState() {
        try {
            int evicted = stateMachine.evictStaleAttestationState();
            if (evicted > 0) {
                log.info("=== Scheduled Job: Evicted {} stale attestation entries ===", evicted);
            }
        } catch (Exception e) {
            log.error("Error evicting stale attestation state", e);
        }
    }

    /**
     * Health check with stuck-transfer detection
     * Runs every 5 minutes
     */
    @Scheduled(cron = "${waqiti.bridge.schedule.health:30 */5 * * * *}")
    public void checkHealth() {
        try {
            healthService.checkHealth();
        } catch (Exception e) {
            log.error("Error running bridge health check", e);
        }
    }
}
