package com.waqiti.bridge.attestation;

import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.Attestation;
import com.waqiti.bridge.domain.AttestationPayload;
import com.waqiti.bridge.domain.ProofBundle;
import com.waqiti.bridge.domain.Transfer;
import com.waqiti.bridge.domain.TransferIds;
import com.waqiti.bridge.metrics.BridgeMetricsService;
import com.waqiti.bridge.replay.ReplayGuard;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Attestation Aggregator
 *
 * <p>Collects, verifies and deduplicates validator attestations per transfer until the
 * destination chain's threshold is met, then emits a deterministic {@link ProofBundle}.</p>
 *
 * <h3>Checks, in order:</h3>
 * <ol>
 *   <li>Replay: transfers closed for attestation are ignored</li>
 *   <li>Structure: transfer id must derive from the payload's source chain and nonce</li>
 *   <li>Signature: verified against the validator's registered key</li>
 *   <li>Equivocation: a second, different payload from the same validator</li>
 *   <li>Payload: must match the confirmed lock event</li>
 *   <li>Eligibility: evaluated now, at acceptance time</li>
 *   <li>Duplicates: one counted attestation per validator</li>
 * </ol>
 *
 * <p>Attestations for transfers whose round is not yet open are verified and buffered, then
 * replayed in arrival order when the round opens. Closed rounds are remembered until
 * {@link #evictStale} so late attestations are refused rather than buffered.</p>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Slf4j
@Service
public class AttestationAggregator {

    private final Map<String, AttestationRound> rounds = new ConcurrentHashMap<>();
    private final Map<String, EarlyBuffer> early = new ConcurrentHashMap<>();
    private final Map<String, Instant> closedRounds = new ConcurrentHashMap<>();

    private final ValidatorRegistry validatorRegistry;
    private final SignatureVerifier signatureVerifier;
    private final ReplayGuard replayGuard;
    private final BridgeMetricsService metricsService;
    private final BridgeProperties.AttestationSettings settings;
    private final Clock clock;

    public AttestationAggregator(ValidatorRegistry validatorRegistry,
                                 SignatureVerifier signatureVerifier,
                                 ReplayGuard replayGuard,
                                 BridgeMetricsService metricsService,
                                 BridgeProperties properties,
                                 Clock clock) {
        this.validatorRegistry = validatorRegistry;
        this.signatureVerifier = signatureVerifier;
        this.replayGuard = replayGuard;
        this.metricsService = metricsService;
        this.settings = properties.getAttestation();
        this.clock = clock;
    }

    /**
     * Opens the aggregation round for a confirmed transfer and replays buffered attestations.
     *
     * @return results of the replayed attestations, in arrival order
     */
    public List<AttestationResult> open(Transfer transfer, AttestationPayload expectedPayload) {
        AttestationRound round = new AttestationRound(
                transfer.getTransferId(),
                expectedPayload,
                transfer.requiredAttestations(),
                transfer.getMintAmount(),
                clock.instant(),
                transfer.getExpiresAt(),
                validatorRegistry.eligibleValidatorIds());

        AttestationRound existing = rounds.putIfAbsent(transfer.getTransferId(), round);
        if (existing != null) {
            log.debug("Round already open: transferId={}", transfer.getTransferId());
            return Collections.emptyList();
        }
        log.info("Attestation round opened: transferId={}, threshold={}, eligible={}, deadline={}",
                transfer.getTransferId(), round.getThreshold(), round.getEligibleAtOpen().size(), round.getDeadline());

        EarlyBuffer buffered = early.remove(transfer.getTransferId());
        if (buffered == null) {
            return Collections.emptyList();
        }
        List<Attestation> replay = buffered.attestations;
        log.info("Replaying {} buffered attestations: transferId={}", replay.size(), transfer.getTransferId());
        List<AttestationResult> results = new ArrayList<>(replay.size());
        for (Attestation attestation : replay) {
            results.add(submit(attestation));
        }
        return results;
    }

    public AttestationResult submit(Attestation attestation) {
        AttestationResult result = evaluate(attestation);
        metricsService.recordAttestation(result.getOutcome());
        if (!result.getOutcome().isCounted() && result.getOutcome() != AttestationOutcome.BUFFERED
                && result.getOutcome() != AttestationOutcome.REPLAY_IGNORED) {
            log.warn("Attestation rejected: outcome={}, transferId={}, validatorId={}",
                    result.getOutcome(), result.getTransferId(), result.getValidatorId());
        }
        return result;
    }

    private AttestationResult evaluate(Attestation attestation) {
        if (attestation == null || attestation.getPayload() == null || attestation.getValidatorId() == null) {
            return AttestationResult.of(AttestationOutcome.MALFORMED, attestation);
        }
        AttestationPayload payload = attestation.getPayload();
        String transferId = payload.getTransferId();

        if (!replayGuard.admitAttestation(transferId)) {
            return AttestationResult.of(AttestationOutcome.REPLAY_IGNORED, attestation);
        }
        if (!isWellFormed(payload)) {
            return AttestationResult.of(AttestationOutcome.MALFORMED, attestation);
        }

        Optional<String> publicKey = validatorRegistry.publicKey(attestation.getValidatorId());
        if (publicKey.isEmpty()) {
            return AttestationResult.of(AttestationOutcome.UNKNOWN_VALIDATOR, attestation);
        }
        if (!signatureVerifier.verify(publicKey.get(), payload.toSigningBytes(), attestation.getSignature())) {
            return AttestationResult.of(AttestationOutcome.INVALID_SIGNATURE, attestation);
        }

        AttestationRound round = rounds.get(transferId);
        if (round == null) {
            return buffer(attestation);
        }
        return acceptLocked(round, attestation);
    }

    private AttestationResult acceptLocked(AttestationRound round, Attestation attestation) {
        round.lock.lock();
        try {
            return accept(round, attestation);
        } finally {
            round.lock.unlock();
        }
    }

    private AttestationResult accept(AttestationRound round, Attestation attestation) {
        String validatorId = attestation.getValidatorId();

        if (round.isClosed()) {
            return AttestationResult.of(AttestationOutcome.ROUND_CLOSED, attestation);
        }

        Attestation prior = round.signedBy.get(validatorId);
        if (prior != null && !prior.getPayload().matches(attestation.getPayload())) {
            log.warn("Equivocation detected: validatorId={}, transferId={}", validatorId, round.getTransferId());
            return resultFor(round, AttestationOutcome.EQUIVOCATION, attestation).toBuilder()
                    .conflictingAttestation(prior)
                    .build();
        }
        if (prior == null) {
            round.signedBy.put(validatorId, attestation);
        }

        if (!attestation.getPayload().matches(round.getExpectedPayload())) {
            return resultFor(round, AttestationOutcome.PAYLOAD_MISMATCH, attestation);
        }
        if (round.hasCounted(validatorId)) {
            return resultFor(round, AttestationOutcome.DUPLICATE, attestation);
        }
        if (round.excluded.contains(validatorId) || !validatorRegistry.isEligible(validatorId)) {
            return resultFor(round, AttestationOutcome.INELIGIBLE_VALIDATOR, attestation);
        }

        round.accepted.add(attestation);
        Instant now = clock.instant();
        boolean timely = Duration.between(round.getOpenedAt(), now).compareTo(settings.getTimelyWindow()) <= 0;
        validatorRegistry.recordAttestation(validatorId, timely);

        log.info("Attestation accepted: transferId={}, validatorId={}, count={}/{}",
                round.getTransferId(), validatorId, round.acceptedCount(), round.getThreshold());

        if (round.canEmitThreshold()) {
            round.markThresholdReached();
            return resultFor(round, AttestationOutcome.THRESHOLD_REACHED, attestation).toBuilder()
                    .proofBundle(buildBundle(round))
                    .build();
        }
        return resultFor(round, AttestationOutcome.ACCEPTED, attestation);
    }

    /**
     * Buffers an attestation for a round that is not open yet. The decision is made inside
     * {@code early.compute}, which serializes with the drain in {@link #open} and the removal in
     * {@link #close}, so an attestation is either drained, handed to the open round or rejected.
     */
    private AttestationResult buffer(Attestation attestation) {
        String transferId = attestation.getTransferId();
        AtomicReference<AttestationOutcome> outcome = new AtomicReference<>();
        early.compute(transferId, (id, pending) -> {
            if (closedRounds.containsKey(id)) {
                outcome.set(AttestationOutcome.ROUND_CLOSED);
                return pending;
            }
            if (rounds.containsKey(id)) {
                return pending;
            }
            EarlyBuffer target = pending != null ? pending : new EarlyBuffer(clock.instant());
            if (target.attestations.size() >= settings.getMaxEarlyAttestationsPerTransfer()) {
                outcome.set(AttestationOutcome.BUFFER_FULL);
            } else {
                target.attestations.add(attestation);
                outcome.set(AttestationOutcome.BUFFERED);
            }
            return target;
        });

        if (outcome.get() == null) {
            AttestationRound round = rounds.get(transferId);
            return round != null
                    ? acceptLocked(round, attestation)
                    : AttestationResult.of(AttestationOutcome.ROUND_CLOSED, attestation);
        }
        if (outcome.get() == AttestationOutcome.BUFFERED) {
            log.debug("Attestation buffered ahead of round: transferId={}, validatorId={}",
                    transferId, attestation.getValidatorId());
        }
        return AttestationResult.of(outcome.get(), attestation);
    }

    /**
     * Halts threshold emission while a dispute is open.
     */
    public void hold(String transferId) {
        withRound(transferId, round -> {
            round.setHeld(true);
            return null;
        });
    }

    /**
     * Lifts a hold and re-evaluates the round.
     *
     * @return the proof bundle if the round now meets its threshold
     */
    public Optional<ProofBundle> release(String transferId) {
        return Optional.ofNullable(withRound(transferId, round -> {
            round.setHeld(false);
            if (round.canEmitThreshold()) {
                round.markThresholdReached();
                log.info("Threshold met after dispute resolution: transferId={}", transferId);
                return buildBundle(round);
            }
            return null;
        }));
    }

    /**
     * Removes a validator's counted attestation and bars it from the round.
     *
     * @return true if an attestation was removed
     */
    public boolean exclude(String transferId, String validatorId) {
        Boolean removed = withRound(transferId, round -> round.exclude(validatorId));
        if (Boolean.TRUE.equals(removed)) {
            log.warn("Attestation excluded: transferId={}, validatorId={}", transferId, validatorId);
        }
        return Boolean.TRUE.equals(removed);
    }

    /**
     * Stops accepting attestations for the transfer and forgets its round.
     */
    public Optional<AttestationRound> close(String transferId) {
        closedRounds.put(transferId, clock.instant());
        early.remove(transferId);
        AttestationRound round = rounds.remove(transferId);
        if (round == null) {
            return Optional.empty();
        }
        round.lock.lock();
        try {
            round.close();
        } finally {
            round.lock.unlock();
        }
        log.debug("Attestation round closed: transferId={}, counted={}", transferId, round.acceptedCount());
        return Optional.of(round);
    }

    /**
     * Forgets closed-round markers and early buffers older than {@code retention}. Buffers
     * that old belong to locks that never confirmed.
     *
     * @return number of entries evicted
     */
    public int evictStale(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (Map.Entry<String, Instant> entry : closedRounds.entrySet()) {
            if (entry.getValue().isBefore(cutoff) && closedRounds.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        for (Map.Entry<String, EarlyBuffer> entry : early.entrySet()) {
            if (entry.getValue().firstBufferedAt.isBefore(cutoff) && early.remove(entry.getKey(), entry.getValue())) {
                log.info("Evicted {} buffered attestations for unopened round: transferId={}",
                        entry.getValue().attestations.size(), entry.getKey());
                evicted++;
            }
        }
        return evicted;
    }

    public int bufferedTransferCount() {
        return early.size();
    }

    public Optional<AttestationRound> round(String transferId) {
        return Optional.ofNullable(rounds.get(transferId));
    }

    /**
     * @return open rounds in which the validator's attestation is currently counted
     */
    public List<String> roundsCounting(String validatorId) {
        List<String> transferIds = new ArrayList<>();
        rounds.forEach((id, round) -> {
            if (round.countedValidators().contains(validatorId)) {
                transferIds.add(id);
            }
        });
        return transferIds;
    }

    public int openRoundCount() {
        return rounds.size();
    }

    private <T> T withRound(String transferId, java.util.function.Function<AttestationRound, T> action) {
        AttestationRound round = rounds.get(transferId);
        if (round == null) {
            return null;
        }
        round.lock.lock();
        try {
            return action.apply(round);
        } finally {
            round.lock.unlock();
        }
    }

    private ProofBundle buildBundle(AttestationRound round) {
        return ProofBundle.fromArrivalOrder(
                round.getExpectedPayload(),
                round.accepted,
                round.getThreshold(),
                round.getMintAmount(),
                clock.instant());
    }

    private static AttestationResult resultFor(AttestationRound round, AttestationOutcome outcome, Attestation attestation) {
        return AttestationResult.builder()
                .outcome(outcome)
                .transferId(round.getTransferId())
                .validatorId(attestation.getValidatorId())
                .attestation(attestation)
                .attestationCount(round.acceptedCount())
                .threshold(round.getThreshold())
                .build();
    }

    private static boolean isWellFormed(AttestationPayload payload) {
        if (payload.getTransferId() == null || payload.getSourceChain() == null || payload.getSourceChain().isBlank()
                || payload.getDestChain() == null
                || payload.getRecipient() == null || payload.getAmount() == null) {
            return false;
        }
        return payload.getTransferId().equals(TransferIds.derive(payload.getSourceChain(), payload.getNonce()));
    }

    /**
     * Attestations received ahead of their round. Only mutated inside {@code early.compute}.
     */
    private static final class EarlyBuffer {
        private final Instant firstBufferedAt;
        private final List<Attestation> attestations = new ArrayList<>();

        private EarlyBuffer(Instant firstBufferedAt) {
            this.firstBufferedAt = firstBufferedAt;
        }
    }
}
