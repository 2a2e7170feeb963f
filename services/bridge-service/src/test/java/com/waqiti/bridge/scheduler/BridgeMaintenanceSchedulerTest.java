package com.waqiti.bridge.scheduler;

import com.waqiti.bridge.governance.GovernanceService;
import com.waqiti.bridge.monitoring.BridgeHealthService;
import com.waqiti.bridge.slashing.SlashingEngine;
import com.waqiti.bridge.transfer.TransferStateMachine;
import com.waqiti.bridge.validator.ValidatorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BridgeMaintenanceScheduler
 *
 * @author Waqiti Platform Team
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("BridgeMaintenanceScheduler Tests")
class BridgeMaintenanceSchedulerTest {

    @Mock
    private TransferStateMachine stateMachine;

    @Mock
    private SlashingEngine slashingEngine;

    @Mock
    private ValidatorRegistry validatorRegistry;

    @Mock
    private GovernanceService governanceService;

    @Mock
    private BridgeHealthService healthService;

    @InjectMocks
    private BridgeMaintenanceScheduler scheduler;

    @Test
    @DisplayName("Should delegate each job to its service")
    void shouldDelegateJobs() {
        when(stateMachine.expireOverdueTransfers()).thenReturn(2);
        when(stateMachine.evictStaleAttestationState()).thenReturn(3);

        scheduler.expireOverdueTransfers();
        scheduler.refundExpiredTransfers();
        scheduler.finalizeSlashes();
        scheduler.decayReputation();
        scheduler.expireProposals();
        scheduler.evictStaleAttestationState();
        scheduler.checkHealth();

        verify(stateMachine).expireOverdueTransfers();
        verify(stateMachine).refundEligibleTransfers();
        verify(slashingEngine).finalizeDueSlashes();
        verify(validatorRegistry).decayInactive();
        verify(governanceService).expireStaleProposals();
        verify(stateMachine).evictStaleAttestationState();
        verify(healthService).checkHealth();
    }

    @Test
    @DisplayName("Should keep the scheduler alive when a job fails")
    void shouldContainJobFailures() {
        when(stateMachine.expireOverdueTransfers()).thenThrow(new IllegalStateException("repository down"));
        when(slashingEngine.finalizeDueSlashes()).thenThrow(new IllegalStateException("registry locked"));

        assertDoesNotThrow(() -> scheduler.expireOverdueTransfers());
        assertDoesNotThrow(() -> scheduler.finalizeSlashes());
    }
}
