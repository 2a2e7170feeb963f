package com.waqiti.bridge.transfer;

import com.waqiti.bridge.alert.BridgeEventPublisher;
import com.waqiti.bridge.attestation.AttestationAggregator;
import com.waqiti.bridge.attestation.AttestationResult;
import com.waqiti.bridge.attestation.AttestationRound;
import com.waqiti.bridge.chain.ChainAdapter;
import com.waqiti.bridge.chain.ChainAdapterRouter;
import com.waqiti.bridge.chain.ChainConfigRegistry;
import com.waqiti.bridge.chain.LockEventListener;
import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.Attestation;
import com.waqiti.bridge.domain.AttestationPayload;
import com.waqiti.bridge.domain.ChainConfig;
import com.waqiti.bridge.domain.LockEvent;
import com.waqiti.bridge.domain.ProofBundle;
import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferStatus;
import com.waqiti.bridge.exception.BridgeErrorCode;
import com.waqiti.bridge.exception.BridgeException;
import com.waqiti.bridge.exception.ChainSubmissionException;
import com.waqiti.bridge.exception.InvalidTransferStateException;
import com.waqiti.bridge.exception.TransferNotFoundException;
import com.waqiti.bridge.fee.FeeCalculator;
import com.waqiti.bridge.governance.BridgePauseState;
import com.waqiti.bridge.metrics.BridgeMetricsService;
import com.waqiti.bridge.replay.ReplayGuard;
import com.waqiti.bridge.slashing.MisbehaviorReporter;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Transfer State Machine
 *
 * <p>Owns the lifecycle of every transfer:</p>
 * <pre>
 *   INITIATED -> CONFIRMED -> ATTESTING -> FINALIZED -> COMPLETED
 *                                |  ^
 *                                v  |
 *                             DISPUTED
 *                ATTESTING / DISPUTED -> EXPIRED -> REFUNDED
 * </pre>
 *
 * <p>Every transition is checked by the {@link ReplayGuard} before the status changes, and is
 * performed while holding the transfer's lock. Misbehavior is handed to the
 * {@link MisbehaviorReporter} only after the lock is released, so slashing may take other
 * transfers' locks without ordering problems.</p>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Slf4j
@Service
@Order(0)
public class TransferStateMachine implements LockEventListener {

    private static final Set<TransferStatus> AWAITING_CONSENSUS = EnumSet.of(TransferStatus.ATTESTING, TransferStatus.DISPUTED);

    private final TransferRepository repository;
    private final TransferLockManager lockManager;
    private final TransferDeadlineScheduler deadlineScheduler;
    private final ReplayGuard replayGuard;
    private final AttestationAggregator aggregator;
    private final ChainConfigRegistry chainConfigs;
    private final ChainAdapterRouter router;
    private final FeeCalculator feeCalculator;
    private final ValidatorRegistry validatorRegistry;
    private final BridgePauseState pauseState;
    private final BridgeEventPublisher events;
    private final BridgeMetricsService metricsService;
    private final MisbehaviorReporter misbehaviorReporter;
    private final Executor submissionExecutor;
    private final BridgeProperties properties;
    private final Clock clock;

    public TransferStateMachine(TransferRepository repository,
                                TransferLockManager lockManager,
                                TransferDeadlineScheduler deadlineScheduler,
                                ReplayGuard replayGuard,
                                AttestationAggregator aggregator,
                                ChainConfigRegistry chainConfigs,
                                ChainAdapterRouter router,
                                FeeCalculator feeCalculator,
                                ValidatorRegistry validatorRegistry,
                                BridgePauseState pauseState,
                                BridgeEventPublisher events,
                                BridgeMetricsService metricsService,
                                @Lazy MisbehaviorReporter misbehaviorReporter,
                                @Qualifier("bridgeSubmissionExecutor") Executor submissionExecutor,
                                BridgeProperties properties,
                                Clock clock) {
        this.repository = repository;
        this.lockManager = lockManager;
        this.deadlineScheduler = deadlineScheduler;
        this.replayGuard = replayGuard;
        this.aggregator = aggregator;
        this.chainConfigs = chainConfigs;
        this.router = router;
        this.feeCalculator = feeCalculator;
        this.validatorRegistry = validatorRegistry;
        this.pauseState = pauseState;
        this.events = events;
        this.metricsService = metricsService;
        this.misbehaviorReporter = misbehaviorReporter;
        this.submissionExecutor = submissionExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- lock events

    @Override
    public void onLockObserved(LockEvent event) {
        if (!isValidLock(event, true)) {
            return;
        }
        lockManager.executeWithLock(event.transferId(), () -> {
            if (repository.findById(event.transferId()).isEmpty()) {
                create(event);
            }
        });
    }

    @Override
    public void onLockConfirmed(LockEvent event) {
        if (!isValidLock(event, false)) {
            return;
        }
        String transferId = event.transferId();
        List<AttestationResult> replayed = lockManager.executeWithLock(transferId, () -> {
            Transfer transfer = repository.findById(transferId).orElseGet(() -> create(event));
            if (transfer.getStatus() != TransferStatus.INITIATED) {
                log.debug("Lock confirmation already processed: transferId={}, status={}", transferId, transfer.getStatus());
                return List.<AttestationResult>of();
            }

            Instant now = clock.instant();
            transfer.setConfirmedAt(now);
            transfer.setExpiresAt(now.plus(properties.getAttestation().getValidationTimeout()));
            if (!transition(transfer, TransferStatus.CONFIRMED, event.getTxHash())
                    || !transition(transfer, TransferStatus.ATTESTING, null)) {
                return List.<AttestationResult>of();
            }

            deadlineScheduler.schedule(transferId, transfer.getExpiresAt(), this::onDeadline);
            return aggregator.open(transfer, expectedPayload(transfer));
        });
        replayed.forEach(this::apply);
    }

    /**
     * A lock that left the source ledger, or never reached its confirmation depth, ends its
     * transfer in DROPPED. Nothing was minted, so nothing is refunded.
     */
    @Override
    public void onLockDropped(LockEvent event, String reason) {
        String transferId = event.transferId();
        lockManager.executeWithLock(transferId, () -> {
            Transfer transfer = repository.findById(transferId).orElse(null);
            if (transfer != null && transfer.getStatus() != TransferStatus.INITIATED) {
                log.debug("Drop ignored for transfer past INITIATED: transferId={}, status={}", transferId, transfer.getStatus());
                return;
            }
            aggregator.close(transferId);
            if (transfer != null && transition(transfer, TransferStatus.DROPPED, null)) {
                log.warn("Transfer dropped: transferId={}, reason={}", transferId, reason);
                events.transferAlert(AlertType.LOCK_DROPPED, transfer,
                        "Lock " + event.getTxHash() + " dropped: " + reason);
            }
        });
    }

    private Transfer create(LockEvent event) {
        ChainConfig source = chainConfigs.get(event.getSourceChain());
        ChainConfig dest = chainConfigs.get(event.getDestChain());
        BigDecimal fee = feeCalculator.feeForTransfer(event.getAmount(), source);
        Instant now = clock.instant();

        Transfer transfer = Transfer.builder()
                .transferId(event.transferId())
                .sourceChain(event.getSourceChain())
                .destChain(event.getDestChain())
                .sender(event.getSender())
                .recipient(event.getRecipient())
                .amount(event.getAmount())
                .nonce(event.getNonce())
                .fee(fee)
                .mintAmount(event.getAmount().subtract(fee))
                .sourceConfig(source)
                .destConfig(dest)
                .sourceTxHash(event.getTxHash())
                .createdAt(now)
                .updatedAt(now)
                .build();
        transition(transfer, TransferStatus.INITIATED, event.getTxHash());
        log.info("Transfer initiated: transferId={}, {} -> {}, amount={}, fee={}",
                transfer.getTransferId(), transfer.getSourceChain(), transfer.getDestChain(), transfer.getAmount(), fee);
        return transfer;
    }

    /**
     * Invalid locks are alerted on when first observed; the confirmation only logs.
     */
    private boolean isValidLock(LockEvent event, boolean observed) {
        String reason = null;
        Optional<ChainConfig> source = chainConfigs.find(event.getSourceChain());
        Optional<ChainConfig> dest = chainConfigs.find(event.getDestChain());
        if (source.isEmpty() || !source.get().getRole().canSend()) {
            reason = "unknown or receive-only source chain " + event.getSourceChain();
        } else if (dest.isEmpty() || !dest.get().getRole().canReceive()) {
            reason = "unknown or send-only destination chain " + event.getDestChain();
        } else if (event.getSourceChain().equals(event.getDestChain())) {
            reason = "source and destination are the same chain";
        } else if (!source.get().acceptsAmount(event.getAmount())) {
            reason = "amount " + event.getAmount() + " outside [" + source.get().getMinAmount()
                    + ", " + source.get().getMaxAmount() + "]";
        } else if (event.getRecipient() == null || event.getRecipient().isBlank()) {
            reason = "missing recipient";
        }
        if (reason == null) {
            return true;
        }
        if (!observed) {
            log.debug("Confirmation of invalid lock ignored: transferId={}, reason={}", event.transferId(), reason);
            return false;
        }
        log.warn("Invalid lock event ignored: chainId={}, nonce={}, txHash={}, reason={}",
                event.getSourceChain(), event.getNonce(), event.getTxHash(), reason);
        aggregator.close(event.transferId());
        events.alert(AlertType.INVALID_LOCK_EVENT, event.transferId(), event.getAmount(), reason);
        return false;
    }

    // ---------------------------------------------------------------- attestations

    /**
     * Entry point for validator attestations. Protocol rejections are returned, never thrown.
     */
    public AttestationResult submitAttestation(Attestation attestation) {
        AttestationResult result = aggregator.submit(attestation);
        apply(result);
        return result;
    }

    private void apply(AttestationResult result) {
        switch (result.getOutcome()) {
            case ACCEPTED, THRESHOLD_REACHED -> recordCounted(result);
            case EQUIVOCATION -> misbehaviorReporter.reportEquivocation(
                    result.getValidatorId(), result.getConflictingAttestation(), result.getAttestation());
            case PAYLOAD_MISMATCH -> misbehaviorReporter.reportInvalidAttestation(
                    result.getValidatorId(), result.getTransferId(), result.getAttestation());
            default -> {
                // rejected or buffered; nothing to record on the transfer
            }
        }
    }

    private void recordCounted(AttestationResult result) {
        lockManager.executeWithLock(result.getTransferId(), () -> {
            Transfer transfer = repository.findById(result.getTransferId()).orElse(null);
            if (transfer == null) {
                return;
            }
            boolean alreadyRecorded = transfer.getAttestations().stream()
                    .anyMatch(a -> a.getValidatorId().equals(result.getValidatorId()));
            if (!alreadyRecorded) {
                transfer.getAttestations().add(result.getAttestation());
                transfer.setUpdatedAt(clock.instant());
                repository.save(transfer);
                events.validatorSigned(transfer, result.getValidatorId());
            }
            result.proofBundle().ifPresent(bundle -> finalizeTransfer(transfer, bundle));
        });
    }

    // ---------------------------------------------------------------- finalize and mint

    private void finalizeTransfer(Transfer transfer, ProofBundle bundle) {
        if (transfer.getStatus() != TransferStatus.ATTESTING) {
            log.warn("Proof bundle ignored: transferId={}, status={}", transfer.getTransferId(), transfer.getStatus());
            return;
        }
        transfer.setProofBundle(bundle);
        transfer.setFinalizedAt(clock.instant());
        if (!transition(transfer, TransferStatus.FINALIZED, null)) {
            return;
        }
        aggregator.close(transfer.getTransferId());
        deadlineScheduler.cancel(transfer.getTransferId());
        log.info("Transfer finalized: transferId={}, signers={}, mintAmount={}",
                transfer.getTransferId(), bundle.getAttestations().size(), bundle.getMintAmount());

        if (pauseState.isPaused()) {
            holdSubmission(transfer);
        } else {
            dispatchMint(transfer.getTransferId());
        }
    }

    private void dispatchMint(String transferId) {
        submissionExecutor.execute(() -> {
            try {
                submitMint(transferId);
            } catch (ChainSubmissionException e) {
                log.error("Mint awaiting operator retry: transferId={}, error={}", transferId, e.getMessage());
            }
        });
    }

    private void submitMint(String transferId) {
        Transfer transfer = lockManager.executeWithLock(transferId, () -> repository.findById(transferId).orElse(null));
        if (transfer == null || !replayGuard.claimMint(transferId)) {
            return;
        }
        ChainAdapter destination = router.resolve(transfer.getDestChain());
        try {
            String txHash = destination.submitMint(transferId, transfer.getProofBundle());
            lockManager.executeWithLock(transferId, () -> {
                transfer.setMintTxHash(txHash);
                transfer.setRequiresOperatorIntervention(false);
                transfer.setLastError(null);
                transfer.setUpdatedAt(clock.instant());
                repository.save(transfer);
            });
            destination.trackMint(transferId, txHash, transfer.getDestConfig().getConfirmationsRequired(),
                    this::onMintConfirmed);
        } catch (ChainSubmissionException e) {
            replayGuard.releaseMintClaim(transferId);
            flagForOperator(transferId, e);
            throw e;
        }
    }

    private void onMintConfirmed(String transferId, String txHash) {
        lockManager.executeWithLock(transferId, () -> {
            Transfer transfer = repository.findById(transferId).orElseThrow(() -> new TransferNotFoundException("Transfer not found: " + transferId));
            if (transfer.getStatus() != TransferStatus.FINALIZED) {
                return;
            }
            transfer.setMintTxHash(txHash);
            transfer.setCompletedAt(clock.instant());
            if (transition(transfer, TransferStatus.COMPLETED, txHash)) {
                metricsService.recordVolume(transfer.getSourceChain(), transfer.getAmount(), transfer.getFee());
                metricsService.recordCompletionTime(Duration.between(transfer.getCreatedAt(), transfer.getCompletedAt()));
                log.info("Transfer completed: transferId={}, mintTx={}, minted={}",
                        transferId, txHash, transfer.getMintAmount());
            }
        });
    }

    /**
     * Operator retry of a mint whose submission exhausted its retries.
     */
    public Transfer retryMint(String transferId) {
        requireNotPaused();
        Transfer transfer = lockManager.executeWithLock(transferId, () -> {
            Transfer t = require(transferId);
            if (t.getStatus() != TransferStatus.FINALIZED || t.getMintTxHash() != null) {
                throw new InvalidTransferStateException(
                        "Transfer " + transferId + " has no failed mint to retry (status " + t.getStatus() + ")");
            }
            t.setSubmissionHeld(false);
            return t;
        });
        log.info("Retrying mint: transferId={}", transferId);
        submitMint(transferId);
        return transfer.snapshot();
    }

    // ---------------------------------------------------------------- expiry and refund

    /**
     * Deadline timer callback. Stops attestation acceptance; an attesting transfer expires, a
     * disputed one expires once its disputes resolve.
     */
    void onDeadline(String transferId) {
        expire(transferId);
    }

    /**
     * @return true if the transfer moved to EXPIRED
     */
    public boolean expire(String transferId) {
        List<String> nonParticipants = new ArrayList<>();
        boolean expired = lockManager.executeWithLock(transferId, () -> {
            Transfer transfer = repository.findById(transferId).orElse(null);
            if (transfer == null || !AWAITING_CONSENSUS.contains(transfer.getStatus())) {
                return false;
            }
            if (clock.instant().isBefore(transfer.getExpiresAt())) {
                return false;
            }
            Optional<AttestationRound> open = aggregator.round(transferId);
            if (open.isPresent() && open.get().isThresholdReached()) {
                log.debug("Deadline reached with finalization in flight: transferId={}", transferId);
                return false;
            }
            aggregator.close(transferId).ifPresent(round -> nonParticipants.addAll(missedWindows(round)));
            if (transfer.getStatus() == TransferStatus.DISPUTED) {
                log.info("Deadline passed while disputed, expiry deferred to resolution: transferId={}", transferId);
                return false;
            }
            return markExpired(transfer);
        });
        recordMisses(transferId, nonParticipants);
        return expired;
    }

    /**
     * Drops closed-round markers and unopened early buffers older than the validation timeout.
     */
    public int evictStaleAttestationState() {
        return aggregator.evictStale(properties.getAttestation().getValidationTimeout());
    }

    /**
     * Backstop for missed timers.
     */
    public int expireOverdueTransfers() {
        Instant now = clock.instant();
        int expired = 0;
        for (Transfer transfer : repository.findByStatusIn(AWAITING_CONSENSUS)) {
            if (transfer.getExpiresAt() != null && !now.isBefore(transfer.getExpiresAt()) && expire(transfer.getTransferId())) {
                expired++;
            }
        }
        return expired;
    }

    private boolean markExpired(Transfer transfer) {
        transfer.setExpiredAt(clock.instant());
        if (!transition(transfer, TransferStatus.EXPIRED, null)) {
            return false;
        }
        deadlineScheduler.cancel(transfer.getTransferId());
        events.transferAlert(AlertType.CONSENSUS_TIMEOUT, transfer, String.format(
                "Transfer %s expired with %d of %d attestations",
                transfer.getTransferId(), transfer.getAttestations().size(), transfer.requiredAttestations()));
        return true;
    }

    private List<String> missedWindows(AttestationRound round) {
        Set<String> counted = round.countedValidators();
        return round.getEligibleAtOpen().stream()
                .filter(id -> !counted.contains(id))
                .sorted()
                .toList();
    }

    private void recordMisses(String transferId, List<String> validatorIds) {
        int maxMisses = properties.getSlashing().getMaxConsecutiveMisses();
        for (String validatorId : validatorIds) {
            if (validatorRegistry.find(validatorId).isEmpty()) {
                continue;
            }
            int misses = validatorRegistry.recordMissedWindow(validatorId);
            if (misses >= maxMisses) {
                validatorRegistry.resetMissedWindows(validatorId);
                misbehaviorReporter.reportNonParticipation(validatorId, transferId, misses);
            }
        }
    }

    public boolean isRefundable(Transfer transfer) {
        return transfer.getStatus() == TransferStatus.EXPIRED
                && transfer.getExpiredAt() != null
                && !clock.instant().isBefore(transfer.getExpiredAt().plus(properties.getAttestation().getRefundGracePeriod()));
    }

    /**
     * Refunds an expired transfer on its source ledger once the grace period has passed.
     */
    public Transfer refund(String transferId) {
        requireNotPaused();
        Transfer transfer = lockManager.executeWithLock(transferId, () -> {
            Transfer t = require(transferId);
            if (!isRefundable(t)) {
                throw new InvalidTransferStateException("Transfer " + transferId + " is not refundable (status "
                        + t.getStatus() + ", expiredAt " + t.getExpiredAt() + ")");
            }
            return t;
        });
        if (!replayGuard.claimRefund(transferId)) {
            return transfer.snapshot();
        }

        String txHash;
        try {
            txHash = router.resolve(transfer.getSourceChain()).submitRefund(transferId);
        } catch (ChainSubmissionException e) {
            replayGuard.releaseRefundClaim(transferId);
            flagForOperator(transferId, e);
            throw e;
        }

        return lockManager.executeWithLock(transferId, () -> {
            transfer.setRefundTxHash(txHash);
            transfer.setRefundedAt(clock.instant());
            transfer.setRequiresOperatorIntervention(false);
            transfer.setSubmissionHeld(false);
            transfer.setLastError(null);
            transition(transfer, TransferStatus.REFUNDED, txHash);
            log.info("Transfer refunded: transferId={}, refundTx={}", transferId, txHash);
            return transfer.snapshot();
        });
    }

    /**
     * @return number of transfers refunded
     */
    public int refundEligibleTransfers() {
        if (pauseState.isPaused()) {
            log.info("Bridge paused, refund sweep skipped");
            return 0;
        }
        int refunded = 0;
        for (Transfer transfer : repository.findByStatusIn(EnumSet.of(TransferStatus.EXPIRED))) {
            if (!isRefundable(transfer)) {
                continue;
            }
            try {
                refund(transfer.getTransferId());
                refunded++;
            } catch (BridgeException e) {
                log.error("Refund failed: transferId={}, error={}", transfer.getTransferId(), e.getMessage());
            }
        }
        return refunded;
    }

    // ---------------------------------------------------------------- disputes

    /**
     * Holds a transfer whose counted attestations are implicated by a pending slash.
     *
     * @return true if the transfer is now disputed by this slash
     */
    public boolean markDisputed(String transferId, String slashId, String validatorId) {
        return lockManager.executeWithLock(transferId, () -> {
            Transfer transfer = repository.findById(transferId).orElse(null);
            if (transfer == null || !AWAITING_CONSENSUS.contains(transfer.getStatus())) {
                return false;
            }
            Optional<AttestationRound> round = aggregator.round(transferId);
            if (round.isEmpty() || round.get().isThresholdReached()) {
                return false;
            }
            aggregator.hold(transferId);
            transfer.getOpenDisputes().add(slashId);
            if (transfer.getStatus() == TransferStatus.ATTESTING) {
                transition(transfer, TransferStatus.DISPUTED, null);
                events.validatorAlert(AlertType.TRANSFER_DISPUTED, validatorId, transferId,
                        "Attestation from " + validatorId + " is under dispute by slash " + slashId);
            } else {
                repository.save(transfer);
            }
            return true;
        });
    }

    /**
     * Releases a dispute. When {@code excludeValidator} is set the validator's attestation no
     * longer counts toward the transfer.
     */
    public void resolveDispute(String transferId, String slashId, String validatorId, boolean excludeValidator) {
        List<String> nonParticipants = new ArrayList<>();
        lockManager.executeWithLock(transferId, () -> {
            Transfer transfer = repository.findById(transferId).orElse(null);
            if (transfer == null || !transfer.getOpenDisputes().remove(slashId)) {
                return;
            }
            if (excludeValidator) {
                removeAttestation(transfer, validatorId);
            }
            if (!transfer.getOpenDisputes().isEmpty() || transfer.getStatus() != TransferStatus.DISPUTED) {
                repository.save(transfer);
                return;
            }
            if (!clock.instant().isBefore(transfer.getExpiresAt())) {
                aggregator.close(transferId).ifPresent(round -> nonParticipants.addAll(missedWindows(round)));
                markExpired(transfer);
                return;
            }
            transition(transfer, TransferStatus.ATTESTING, null);
            aggregator.release(transferId).ifPresent(bundle -> finalizeTransfer(transfer, bundle));
        });
        recordMisses(transferId, nonParticipants);
    }

    /**
     * Drops a proven misbehaving validator's attestation from a transfer still awaiting consensus.
     */
    public void excludeAttestation(String transferId, String validatorId) {
        lockManager.executeWithLock(transferId, () -> repository.findById(transferId)
                .filter(t -> AWAITING_CONSENSUS.contains(t.getStatus()))
                .ifPresent(t -> removeAttestation(t, validatorId)));
    }

    private void removeAttestation(Transfer transfer, String validatorId) {
        aggregator.exclude(transfer.getTransferId(), validatorId);
        if (transfer.getAttestations().removeIf(a -> a.getValidatorId().equals(validatorId))) {
            transfer.setUpdatedAt(clock.instant());
            repository.save(transfer);
            log.warn("Attestation removed from transfer: transferId={}, validatorId={}", transfer.getTransferId(), validatorId);
        }
    }

    /**
     * Transfers whose current attestation set counts the validator.
     */
    public List<String> pendingTransfersCounting(String validatorId) {
        return aggregator.roundsCounting(validatorId);
    }

    // ---------------------------------------------------------------- pause

    /**
     * Sends mints held while the bridge was paused.
     *
     * @return number of submissions released
     */
    public int resumeHeldSubmissions() {
        int released = 0;
        for (Transfer transfer : repository.findByStatusIn(EnumSet.of(TransferStatus.FINALIZED))) {
            if (!transfer.isSubmissionHeld()) {
                continue;
            }
            String transferId = transfer.getTransferId();
            lockManager.executeWithLock(transferId, () -> transfer.setSubmissionHeld(false));
            dispatchMint(transferId);
            released++;
        }
        if (released > 0) {
            log.info("Released {} held mint submissions", released);
        }
        return released;
    }

    private void holdSubmission(Transfer transfer) {
        transfer.setSubmissionHeld(true);
        repository.save(transfer);
        log.warn("Bridge paused, mint held: transferId={}", transfer.getTransferId());
    }

    // ---------------------------------------------------------------- helpers

    private boolean transition(Transfer transfer, TransferStatus target, String txHash) {
        TransferStatus previous = transfer.getStatus();
        if (previous != null && !previous.canTransitionTo(target)) {
            log.warn("Illegal transition ignored: transferId={}, {} -> {}", transfer.getTransferId(), previous, target);
            return false;
        }
        if (!replayGuard.admitTransition(transfer.getTransferId(), target)) {
            return false;
        }
        transfer.setStatus(target);
        transfer.setUpdatedAt(clock.instant());
        repository.save(transfer);

        metricsService.recordTransferStatus(target, transfer.getSourceChain(), transfer.getDestChain());
        events.statusChanged(transfer, previous, txHash);
        log.info("Transfer status changed: transferId={}, {} -> {}", transfer.getTransferId(), previous, target);
        return true;
    }

    private void flagForOperator(String transferId, ChainSubmissionException e) {
        lockManager.executeWithLock(transferId, () -> repository.findById(transferId).ifPresent(transfer -> {
            transfer.setRequiresOperatorIntervention(true);
            transfer.setLastError(e.getMessage());
            transfer.setUpdatedAt(clock.instant());
            repository.save(transfer);
            events.transferAlert(AlertType.CHAIN_SUBMISSION_FAILED, transfer, String.format(
                    "%s on %s: %s", transferId, e.getChainId(), e.getMessage()));
        }));
    }

    private void requireNotPaused() {
        if (pauseState.isPaused()) {
            throw new BridgeException(BridgeErrorCode.BRIDGE_PAUSED, "Bridge is paused; submissions are held");
        }
    }

    private Transfer require(String transferId) {
        return repository.findById(transferId).orElseThrow(() -> new TransferNotFoundException("Transfer not found: " + transferId));
    }

    private static AttestationPayload expectedPayload(Transfer transfer) {
        return AttestationPayload.builder()
                .transferId(transfer.getTransferId())
                .sourceChain(transfer.getSourceChain())
                .destChain(transfer.getDestChain())
                .recipient(transfer.getRecipient())
                .amount(transfer.getAmount())
                .nonce(transfer.getNonce())
                .build();
    }
}
