package com.waqiti.bridge.monitoring;

import com.waqiti.bridge.domain.TransferStatus;
import com.waqiti.bridge.support.BridgeTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static com.waqiti.bridge.support.BridgeTestFixture.CHAIN_A;
import static com.waqiti.bridge.support.BridgeTestFixture.CHAIN_B;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BridgeStatisticsService Tests")
class BridgeStatisticsServiceTest {

    private BridgeTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new BridgeTestFixture();
        fixture.registerValidators(3);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("Should return zeros with no transfers")
    void shouldHandleEmptyRepository() {
        BridgeMetricsSnapshot snapshot = fixture.statistics.snapshot();

        assertThat(snapshot.getTotalTransactions()).isZero();
        assertThat(snapshot.getSuccessRate()).isEqualByComparingTo("0");
        assertThat(snapshot.getAverageCompletionTime()).isEqualTo(Duration.ZERO);
        assertThat(snapshot.getActiveValidators()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should aggregate volume, fees, success rate and per-chain totals")
    void shouldAggregateTransfers() {
        // Given
        String completed = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 1, new BigDecimal("500"));
        fixture.lockAndConfirm(CHAIN_B, CHAIN_A, 2, new BigDecimal("100"));
        fixture.attest("validator-1", completed);
        fixture.attest("validator-2", completed);
        fixture.attest("validator-3", completed);
        fixture.clock.advance(Duration.ofMinutes(10));
        fixture.confirmMints();

        // When
        BridgeMetricsSnapshot snapshot = fixture.statistics.snapshot();

        // Then
        assertThat(snapshot.getTotalTransactions()).isEqualTo(2);
        assertThat(snapshot.getTotalVolume()).isEqualByComparingTo("600");
        assertThat(snapshot.getTotalFees()).isEqualByComparingTo("3.8");
        assertThat(snapshot.getSuccessRate()).isEqualByComparingTo("0.5");
        assertThat(snapshot.getAverageCompletionTime()).isEqualTo(Duration.ofMinutes(10));
        assertThat(snapshot.getTransfersByStatus())
                .containsEntry(TransferStatus.COMPLETED, 1L)
                .containsEntry(TransferStatus.ATTESTING, 1L);
        assertThat(snapshot.getChains()).containsOnlyKeys(CHAIN_A, CHAIN_B);
        assertThat(snapshot.getChains().get(CHAIN_A).getVolume()).isEqualByComparingTo("500");
        assertThat(snapshot.getChains().get(CHAIN_B).getFees()).isEqualByComparingTo("1.3");
    }
}
