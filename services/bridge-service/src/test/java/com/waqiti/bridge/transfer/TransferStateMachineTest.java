package com.waqiti.bridge.transfer;

import com.waqiti.bridge.attestation.AttestationOutcome;
import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.Attestation;
import com.waqiti.bridge.domain.LockEvent;
import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferIds;
import com.waqiti.bridge.domain.TransferStatus;
import com.waqiti.bridge.exception.BridgeException;
import com.waqiti.bridge.exception.InvalidTransferStateException;
import com.waqiti.bridge.support.BridgeTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.waqiti.bridge.support.BridgeTestFixture.CHAIN_A;
import static com.waqiti.bridge.support.BridgeTestFixture.CHAIN_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for TransferStateMachine
 *
 * Drives transfers end to end across two in-memory ledgers.
 *
 * @author Waqiti Platform Team
 */
@DisplayName("TransferStateMachine Tests")
class TransferStateMachineTest {

    private static final BigDecimal AMOUNT = new BigDecimal("500");

    private BridgeTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new BridgeTestFixture();
        fixture.registerValidators(5);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private void attestThreshold(String transferId) {
        fixture.attest("validator-1", transferId);
        fixture.attest("validator-2", transferId);
        fixture.attest("validator-3", transferId);
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        @DisplayName("Should move a confirmed lock through attestation to a completed mint")
        void shouldCompleteTransfer() {
            // Given
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 1, AMOUNT);
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.ATTESTING);

            // When
            fixture.attest("validator-1", transferId);
            fixture.attest("validator-2", transferId);
            assertThat(fixture.attest("validator-3", transferId).getOutcome())
                    .isEqualTo(AttestationOutcome.THRESHOLD_REACHED);
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.FINALIZED);
            fixture.confirmMints();

            // Then
            Transfer transfer = fixture.transfer(transferId);
            assertThat(transfer.getStatus()).isEqualTo(TransferStatus.COMPLETED);
            assertThat(transfer.getFee()).isEqualByComparingTo("2.5");
            assertThat(transfer.getMintAmount()).isEqualByComparingTo("497.5");
            assertThat(transfer.getAttestations()).hasSize(3);
            assertThat(transfer.getMintTxHash()).isNotNull();
            assertThat(fixture.ledgerB.mintCalls()).isEqualTo(1);
            assertThat(fixture.ledgerB.mintedProof(transferId)).get()
                    .satisfies(bundle -> assertThat(bundle.getAttestations()).hasSize(3));
        }

        @Test
        @DisplayName("Should ignore attestations arriving after finalization")
        void shouldIgnoreLateAttestation() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 2, AMOUNT);
            attestThreshold(transferId);

            assertThat(fixture.attest("validator-4", transferId).getOutcome())
                    .isEqualTo(AttestationOutcome.REPLAY_IGNORED);
            assertThat(fixture.transfer(transferId).getAttestations()).hasSize(3);
            assertThat(fixture.ledgerB.mintCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not start attestation before the lock reaches its confirmation depth")
        void shouldWaitForConfirmations() {
            String transferId = fixture.lock(CHAIN_A, CHAIN_B, 3, AMOUNT).transferId();
            fixture.pollAll();

            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.INITIATED);

            fixture.ledgerA.mineBlocks(2);
            fixture.pollAll();
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.ATTESTING);
            assertThat(fixture.transfer(transferId).getExpiresAt())
                    .isEqualTo(BridgeTestFixture.START.plus(Duration.ofHours(24)));
        }

        @Test
        @DisplayName("Should replay attestations that arrived before the lock was confirmed")
        void shouldReplayEarlyAttestations() {
            String transferId = fixture.lock(CHAIN_A, CHAIN_B, 4, AMOUNT).transferId();

            assertThat(fixture.attest("validator-1", transferId).getOutcome()).isEqualTo(AttestationOutcome.BUFFERED);
            assertThat(fixture.attest("validator-2", transferId).getOutcome()).isEqualTo(AttestationOutcome.BUFFERED);
            assertThat(fixture.attest("validator-3", transferId).getOutcome()).isEqualTo(AttestationOutcome.BUFFERED);

            fixture.ledgerA.mineBlocks(2);
            fixture.pollAll();

            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.FINALIZED);
            assertThat(fixture.ledgerB.mintCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should process each lock once however often ledgers are polled")
        void shouldBeIdempotentAcrossPolls() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 5, AMOUNT);
            int events = fixture.sink.transferEvents().size();

            fixture.pollAll();
            fixture.pollAll();

            assertThat(fixture.repository.count()).isEqualTo(1);
            assertThat(fixture.sink.transferEvents()).hasSize(events);
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.ATTESTING);
        }

        @Test
        @DisplayName("Should submit exactly one mint under concurrent attestations")
        void shouldMintOnceUnderConcurrency() throws Exception {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 6, AMOUNT);
            ExecutorService pool = Executors.newFixedThreadPool(5);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 1; i <= 5; i++) {
                    String validatorId = "validator-" + i;
                    Attestation attestation = fixture.signed(validatorId, transferId);
                    futures.add(pool.submit(() -> {
                        start.await();
                        return fixture.stateMachine.submitAttestation(attestation);
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            fixture.confirmMints();
            assertThat(fixture.ledgerB.mintCalls()).isEqualTo(1);
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.COMPLETED);
            assertThat(fixture.ledgerB.mintedProof(transferId)).get()
                    .satisfies(bundle -> assertThat(bundle.getAttestations()).hasSize(3));
        }
    }

    @Nested
    @DisplayName("Invalid locks")
    class InvalidLocks {

        @Test
        @DisplayName("Should alert and create no transfer for an amount below the chain minimum")
        void shouldRejectAmountOutOfRange() {
            String transferId = fixture.lock(CHAIN_A, CHAIN_B, 10, new BigDecimal("0.5")).transferId();

            fixture.pollAll();

            assertThat(fixture.repository.findById(transferId)).isEmpty();
            assertThat(fixture.sink.alerts(AlertType.INVALID_LOCK_EVENT)).hasSize(1);
        }

        @Test
        @DisplayName("Should alert for a lock targeting an unknown chain")
        void shouldRejectUnknownDestination() {
            String transferId = fixture.lock(CHAIN_A, "chain-z", 11, AMOUNT).transferId();

            fixture.pollAll();

            assertThat(fixture.repository.findById(transferId)).isEmpty();
            assertThat(fixture.sink.alerts(AlertType.INVALID_LOCK_EVENT)).hasSize(1);
        }

        @Test
        @DisplayName("Should alert once for an invalid lock that goes on to confirm")
        void shouldAlertOnceThroughConfirmation() {
            // Given
            String transferId = fixture.lock(CHAIN_A, CHAIN_B, 12, new BigDecimal("0.5")).transferId();
            fixture.pollAll();

            // When
            fixture.ledgerA.mineBlocks(2);
            fixture.pollAll();
            fixture.pollAll();

            // Then
            assertThat(fixture.repository.findById(transferId)).isEmpty();
            assertThat(fixture.sink.alerts(AlertType.INVALID_LOCK_EVENT)).hasSize(1);
            assertThat(fixture.attest("validator-1", transferId).getOutcome()).isEqualTo(AttestationOutcome.ROUND_CLOSED);
            assertThat(fixture.aggregator.bufferedTransferCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Dropped locks")
    class DroppedLocks {

        @Test
        @DisplayName("Should drop a transfer whose lock was reorganised out before confirmation")
        void shouldDropReorganisedLock() {
            // Given
            LockEvent event = fixture.lock(CHAIN_A, CHAIN_B, 30, AMOUNT);
            fixture.pollAll();
            assertThat(fixture.transfer(event.transferId()).getStatus()).isEqualTo(TransferStatus.INITIATED);
            assertThat(fixture.attest("validator-1", event.transferId()).getOutcome())
                    .isEqualTo(AttestationOutcome.BUFFERED);

            // When
            fixture.ledgerA.reorgOut(event);
            fixture.ledgerA.mineBlocks(2);
            fixture.pollAll();
            fixture.pollAll();

            // Then
            assertThat(fixture.transfer(event.transferId()).getStatus()).isEqualTo(TransferStatus.DROPPED);
            assertThat(fixture.sink.alerts(AlertType.LOCK_DROPPED)).hasSize(1);
            assertThat(fixture.aggregator.bufferedTransferCount()).isZero();
            assertThat(fixture.attest("validator-2", event.transferId()).getOutcome())
                    .isEqualTo(AttestationOutcome.REPLAY_IGNORED);
            assertThat(fixture.ledgerA.refundCalls()).isZero();
        }

        @Test
        @DisplayName("Should drop a transfer whose lock never reaches the confirmation depth")
        void shouldDropUnconfirmedLockAfterTimeout() {
            // Given
            String transferId = fixture.lock(CHAIN_A, CHAIN_B, 31, AMOUNT).transferId();
            fixture.pollAll();

            // When
            fixture.clock.advance(fixture.properties.getChain().getLockConfirmationTimeout());
            fixture.pollAll();

            // Then
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.DROPPED);
            assertThat(fixture.sink.alerts(AlertType.LOCK_DROPPED)).hasSize(1);
        }

        @Test
        @DisplayName("Should leave a confirmed transfer alone when a stale drop arrives")
        void shouldIgnoreDropAfterConfirmation() {
            // Given
            LockEvent event = fixture.lock(CHAIN_A, CHAIN_B, 32, AMOUNT);
            fixture.ledgerA.mineBlocks(2);
            fixture.pollAll();
            assertThat(fixture.transfer(event.transferId()).getStatus()).isEqualTo(TransferStatus.ATTESTING);

            // When
            fixture.stateMachine.onLockDropped(event, "late reorg report");

            // Then
            assertThat(fixture.transfer(event.transferId()).getStatus()).isEqualTo(TransferStatus.ATTESTING);
            assertThat(fixture.aggregator.round(event.transferId())).isPresent();
            assertThat(fixture.sink.alerts(AlertType.LOCK_DROPPED)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Expiry and refund")
    class ExpiryAndRefund {

        @Test
        @DisplayName("Should expire without threshold and refund only after the grace period")
        void shouldExpireAndRefund() {
            // Given
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 20, AMOUNT);
            fixture.attest("validator-1", transferId);

            // When
            fixture.clock.advance(Duration.ofHours(24));
            assertThat(fixture.stateMachine.expire(transferId)).isTrue();

            // Then
            Transfer expired = fixture.transfer(transferId);
            assertThat(expired.getStatus()).isEqualTo(TransferStatus.EXPIRED);
            assertThat(fixture.sink.alerts(AlertType.CONSENSUS_TIMEOUT)).hasSize(1);
            assertThat(fixture.attest("validator-2", transferId).getOutcome())
                    .isEqualTo(AttestationOutcome.REPLAY_IGNORED);

            assertThrows(InvalidTransferStateException.class, () -> fixture.stateMachine.refund(transferId));

            fixture.clock.advance(Duration.ofHours(1));
            Transfer refunded = fixture.stateMachine.refund(transferId);
            assertThat(refunded.getStatus()).isEqualTo(TransferStatus.REFUNDED);
            assertThat(fixture.ledgerA.refunds()).containsKey(transferId);
            assertThat(fixture.ledgerB.mintCalls()).isZero();
        }

        @Test
        @DisplayName("Should not expire before the deadline")
        void shouldNotExpireEarly() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 21, AMOUNT);
            fixture.clock.advance(Duration.ofHours(23));

            assertThat(fixture.stateMachine.expire(transferId)).isFalse();
            assertThat(fixture.stateMachine.expireOverdueTransfers()).isZero();
        }

        @Test
        @DisplayName("Should sweep overdue transfers and refund them once")
        void shouldSweepOverdueTransfers() {
            fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 22, AMOUNT);
            fixture.lockAndConfirm(CHAIN_B, CHAIN_A, 23, AMOUNT);
            fixture.clock.advance(Duration.ofHours(25));

            assertThat(fixture.stateMachine.expireOverdueTransfers()).isEqualTo(2);
            assertThat(fixture.stateMachine.refundEligibleTransfers()).isZero();

            fixture.clock.advance(Duration.ofHours(1));
            assertThat(fixture.stateMachine.refundEligibleTransfers()).isEqualTo(2);
            assertThat(fixture.stateMachine.refundEligibleTransfers()).isZero();
            assertThat(fixture.ledgerA.refundCalls()).isEqualTo(1);
            assertThat(fixture.ledgerB.refundCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should record a missed window for eligible validators that did not attest")
        void shouldRecordMissedWindows() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 24, AMOUNT);
            fixture.attest("validator-1", transferId);
            fixture.clock.advance(Duration.ofHours(24));

            fixture.stateMachine.expire(transferId);

            assertThat(fixture.validators.get("validator-1").getMissedWindows()).isZero();
            assertThat(fixture.validators.get("validator-2").getMissedWindows()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("Should hold the mint while paused and send it on resume")
        void shouldHoldMintWhilePaused() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 30, AMOUNT);
            fixture.pauseState.pause(fixture.clock.instant());

            attestThreshold(transferId);

            Transfer held = fixture.transfer(transferId);
            assertThat(held.getStatus()).isEqualTo(TransferStatus.FINALIZED);
            assertThat(held.isSubmissionHeld()).isTrue();
            assertThat(fixture.ledgerB.mintCalls()).isZero();
            assertThrows(BridgeException.class, () -> fixture.stateMachine.retryMint(transferId));

            fixture.pauseState.unpause();
            assertThat(fixture.stateMachine.resumeHeldSubmissions()).isEqualTo(1);
            fixture.confirmMints();

            assertThat(fixture.ledgerB.mintCalls()).isEqualTo(1);
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.COMPLETED);
        }

        @Test
        @DisplayName("Should flag for an operator when retries are exhausted and recover on retry")
        void shouldFlagFailedMint() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 31, AMOUNT);
            fixture.ledgerB.failNextSubmissions(3);

            attestThreshold(transferId);

            Transfer failed = fixture.transfer(transferId);
            assertThat(failed.getStatus()).isEqualTo(TransferStatus.FINALIZED);
            assertThat(failed.isRequiresOperatorIntervention()).isTrue();
            assertThat(failed.getLastError()).contains("mint failed after 3 attempts");
            assertThat(fixture.sink.alerts(AlertType.CHAIN_SUBMISSION_FAILED)).hasSize(1);
            assertThat(fixture.queries.transfersRequiringIntervention()).hasSize(1);

            Transfer retried = fixture.stateMachine.retryMint(transferId);
            fixture.confirmMints();

            assertThat(retried.isRequiresOperatorIntervention()).isFalse();
            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.COMPLETED);
            assertThat(fixture.ledgerB.mintCalls()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should recover from transient RPC failures within the retry budget")
        void shouldRetryTransientFailures() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 32, AMOUNT);
            fixture.ledgerB.failNextSubmissions(2);

            attestThreshold(transferId);
            fixture.confirmMints();

            assertThat(fixture.transfer(transferId).getStatus()).isEqualTo(TransferStatus.COMPLETED);
            assertThat(fixture.ledgerB.mintCalls()).isEqualTo(3);
            assertThat(fixture.sink.alerts(AlertType.CHAIN_SUBMISSION_FAILED)).isEmpty();
        }

        @Test
        @DisplayName("Should reject a mint retry for a transfer that has no failed mint")
        void shouldRejectNeedlessRetry() {
            String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 33, AMOUNT);

            assertThrows(InvalidTransferStateException.class, () -> fixture.stateMachine.retryMint(transferId));
        }
    }

    @Test
    @DisplayName("Should derive the transfer id from source chain and nonce")
    void shouldDeriveTransferId() {
        String transferId = fixture.lockAndConfirm(CHAIN_A, CHAIN_B, 40, AMOUNT);

        assertThat(transferId).isEqualTo(TransferIds.derive(CHAIN_A, 40));
        assertThat(fixture.queries.findBySourceNonce(CHAIN_A, 40)).isPresent();
    }
}
