package com.waqiti.bridge.slashing;

import com.waqiti.bridge.alert.BridgeEventPublisher;
import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.Attestation;
import com.waqiti.bridge.domain.SlashEvent;
import com.waqiti.bridge.domain.SlashReason;
import com.waqiti.bridge.domain.SlashStatus;
import com.waqiti.bridge.domain.Validator;
import com.waqiti.bridge.exception.SlashDisputeException;
import com.waqiti.bridge.exception.ValidationException;
import com.waqiti.bridge.exception.ValidatorNotFoundException;
import com.waqiti.bridge.metrics.BridgeMetricsService;
import com.waqiti.bridge.transfer.TransferStateMachine;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Slashing Engine
 *
 * <p>Misbehavior classes and how they are handled:</p>
 * <ul>
 *   <li><b>Equivocation</b>: provable from the two signatures. Stake is slashed and reputation
 *   wiped at once; the validator's attestation is dropped from every pending transfer. When
 *   the dispute window closes the slash is finalized and the validator deactivated.</li>
 *   <li><b>Non-participation</b> and <b>invalid attestation</b>: the slash stays pending for the
 *   dispute window. Pending transfers counting the validator's attestation are held as
 *   DISPUTED. Any party may contest with contrary evidence before the deadline; contested
 *   slashes wait for adjudication.</li>
 * </ul>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Slf4j
@Service
public class SlashingEngine implements MisbehaviorReporter {

    private final Map<String, SlashEvent> slashes = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> implicatedTransfers = new ConcurrentHashMap<>();
    private final Set<String> reportedOffences = ConcurrentHashMap.newKeySet();

    private final ValidatorRegistry validatorRegistry;
    private final TransferStateMachine stateMachine;
    private final SlashPolicy slashPolicy;
    private final BridgeEventPublisher events;
    private final BridgeMetricsService metricsService;
    private final Duration disputeWindow;
    private final Clock clock;

    public SlashingEngine(ValidatorRegistry validatorRegistry,
                          TransferStateMachine stateMachine,
                          SlashPolicy slashPolicy,
                          BridgeEventPublisher events,
                          BridgeMetricsService metricsService,
                          BridgeProperties properties,
                          Clock clock) {
        this.validatorRegistry = validatorRegistry;
        this.stateMachine = stateMachine;
        this.slashPolicy = slashPolicy;
        this.events = events;
        this.metricsService = metricsService;
        this.disputeWindow = properties.getSlashing().getDisputeWindow();
        this.clock = clock;
    }

    @Override
    public void reportEquivocation(String validatorId, Attestation first, Attestation second) {
        slashForEquivocation(validatorId, first, second);
    }

    /**
     * @return the applied slash, or empty if this equivocation was already punished
     */
    public Optional<SlashEvent> slashForEquivocation(String validatorId, Attestation first, Attestation second) {
        String transferId = first.getTransferId();
        if (!reportedOffences.add(offenceKey(SlashReason.EQUIVOCATION, validatorId, transferId))) {
            log.debug("Equivocation already slashed: validatorId={}, transferId={}", validatorId, transferId);
            return Optional.empty();
        }
        Optional<Validator> validator = validatorRegistry.find(validatorId);
        if (validator.isEmpty()) {
            log.warn("Equivocation by unknown validator ignored: validatorId={}", validatorId);
            return Optional.empty();
        }

        int bps = slashPolicy.basisPointsFor(SlashReason.EQUIVOCATION, validator.get());
        SlashEvent applied = validatorRegistry.slash(validatorId, bps, SlashReason.EQUIVOCATION);
        validatorRegistry.applyPenalty(validatorId, SlashReason.EQUIVOCATION);

        SlashEvent event = applied.toBuilder()
                .disputeDeadline(applied.getTimestamp().plus(disputeWindow))
                .transferId(transferId)
                .evidence(new ArrayList<>(List.of(describe(first), describe(second))))
                .build();
        slashes.put(event.getSlashId(), event);
        metricsService.recordSlash(SlashReason.EQUIVOCATION, event.getAmountSlashed());

        events.validatorAlert(AlertType.EQUIVOCATION_DETECTED, validatorId, transferId, String.format(
                "Validator %s signed conflicting attestations for transfer %s", validatorId, transferId));
        events.validatorAlert(AlertType.VALIDATOR_SLASHED, validatorId, transferId, String.format(
                "Slashed %s (%d bps) for equivocation", event.getAmountSlashed().toPlainString(), bps));

        for (String pending : stateMachine.pendingTransfersCounting(validatorId)) {
            stateMachine.excludeAttestation(pending, validatorId);
        }
        return Optional.of(event);
    }

    @Override
    public void reportInvalidAttestation(String validatorId, String transferId, Attestation attestation) {
        openPendingSlash(validatorId, SlashReason.INVALID_ATTESTATION, transferId, describe(attestation));
    }

    @Override
    public void reportNonParticipation(String validatorId, String transferId, int consecutiveMisses) {
        openPendingSlash(validatorId, SlashReason.NON_PARTICIPATION, transferId,
                consecutiveMisses + " consecutive missed attestation windows, last on transfer " + transferId);
    }

    /**
     * Opens a slash that takes effect only when its dispute window closes uncontested.
     *
     * @return the pending slash, or empty if the offence was already reported
     */
    public Optional<SlashEvent> openPendingSlash(String validatorId, SlashReason reason, String transferId, String evidence) {
        if (!reportedOffences.add(offenceKey(reason, validatorId, transferId))) {
            return Optional.empty();
        }
        Optional<Validator> validator = validatorRegistry.find(validatorId);
        if (validator.isEmpty()) {
            log.warn("Slash for unknown validator ignored: validatorId={}, reason={}", validatorId, reason);
            return Optional.empty();
        }

        Instant now = clock.instant();
        SlashEvent event = SlashEvent.builder()
                .slashId(UUID.randomUUID().toString())
                .validatorId(validatorId)
                .reason(reason)
                .basisPoints(slashPolicy.basisPointsFor(reason, validator.get()))
                .timestamp(now)
                .disputeDeadline(now.plus(disputeWindow))
                .status(SlashStatus.PENDING)
                .transferId(transferId)
                .evidence(new ArrayList<>(List.of(evidence)))
                .build();
        slashes.put(event.getSlashId(), event);

        Set<String> disputed = new LinkedHashSet<>();
        for (String pending : stateMachine.pendingTransfersCounting(validatorId)) {
            if (stateMachine.markDisputed(pending, event.getSlashId(), validatorId)) {
                disputed.add(pending);
            }
        }
        implicatedTransfers.put(event.getSlashId(), disputed);

        log.warn("Pending slash opened: slashId={}, validatorId={}, reason={}, deadline={}, disputedTransfers={}",
                event.getSlashId(), validatorId, reason, event.getDisputeDeadline(), disputed.size());
        events.validatorAlert(AlertType.VALIDATOR_SLASHED, validatorId, transferId, String.format(
                "Pending %s slash of %d bps, disputable until %s", reason, event.getBasisPoints(), event.getDisputeDeadline()));
        return Optional.of(event.toBuilder().build());
    }

    /**
     * Submits contrary evidence against a pending slash. The window is open strictly before
     * the dispute deadline; at the deadline the slash belongs to {@link #finalizeDueSlashes}.
     */
    public SlashEvent contest(String slashId, String party, String evidence) {
        if (party == null || party.isBlank() || evidence == null || evidence.isBlank()) {
            throw new ValidationException("Contesting party and evidence are required");
        }
        SlashEvent contested = slashes.compute(slashId, (id, current) -> {
            if (current == null) {
                throw new SlashDisputeException("Slash not found: " + slashId);
            }
            if (current.getStatus() == SlashStatus.APPLIED) {
                throw new SlashDisputeException("Slash " + slashId + " for " + current.getReason()
                        + " is provable and cannot be contested");
            }
            if (current.getStatus() != SlashStatus.PENDING) {
                throw new SlashDisputeException("Slash " + slashId + " is " + current.getStatus() + ", not open for dispute");
            }
            if (!clock.instant().isBefore(current.getDisputeDeadline())) {
                throw new SlashDisputeException("Dispute window for slash " + slashId + " closed at " + current.getDisputeDeadline());
            }
            List<String> evidenceList = new ArrayList<>(current.getEvidence());
            evidenceList.add(party + ": " + evidence);
            return current.toBuilder().status(SlashStatus.CONTESTED).evidence(evidenceList).build();
        });

        log.info("Slash contested: slashId={}, party={}", slashId, party);
        events.validatorAlert(AlertType.SLASH_CONTESTED, contested.getValidatorId(), contested.getTransferId(),
                "Slash " + slashId + " contested by " + party);
        return contested.toBuilder().build();
    }

    /**
     * Decides a contested slash.
     *
     * @param upheld true applies the penalty, false overturns the slash
     */
    public synchronized SlashEvent adjudicate(String slashId, boolean upheld) {
        SlashEvent current = require(slashId);
        if (current.getStatus() != SlashStatus.CONTESTED) {
            throw new SlashDisputeException("Slash " + slashId + " is " + current.getStatus() + ", only contested slashes are adjudicated");
        }
        SlashEvent resolved = upheld ? applyPenalty(current) : resolve(current, SlashStatus.OVERTURNED, BigDecimal.ZERO, false);
        log.info("Slash adjudicated: slashId={}, upheld={}", slashId, upheld);
        releaseDisputes(resolved, upheld);
        return resolved;
    }

    /**
     * Closes slashes whose dispute window has passed.
     *
     * @return number of slashes finalized
     */
    public synchronized int finalizeDueSlashes() {
        Instant now = clock.instant();
        int finalized = 0;
        List<SlashEvent> due = slashes.values().stream()
                .filter(s -> s.getStatus() == SlashStatus.PENDING || s.getStatus() == SlashStatus.APPLIED)
                .filter(s -> !now.isBefore(s.getDisputeDeadline()))
                .sorted(Comparator.comparing(SlashEvent::getTimestamp))
                .toList();

        for (SlashEvent candidate : due) {
            SlashEvent slash = claimForFinalization(candidate.getSlashId(), now);
            if (slash == null) {
                continue;
            }
            if (slash.getStatus() == SlashStatus.PENDING) {
                releaseDisputes(applyPenalty(slash), true);
            } else {
                resolve(slash, SlashStatus.FINALIZED, slash.getAmountSlashed(), true);
                if (slash.getReason() == SlashReason.EQUIVOCATION && validatorRegistry.find(slash.getValidatorId()).isPresent()) {
                    validatorRegistry.deactivate(slash.getValidatorId());
                }
            }
            finalized++;
        }
        if (finalized > 0) {
            log.info("Finalized {} slashes", finalized);
        }
        return finalized;
    }

    /**
     * Marks a due slash FINALIZED inside {@code slashes.compute} so a concurrent contest sees it
     * closed.
     *
     * @return the slash as it was before the claim, or null if it is no longer due
     */
    private SlashEvent claimForFinalization(String slashId, Instant now) {
        AtomicReference<SlashEvent> claimed = new AtomicReference<>();
        slashes.computeIfPresent(slashId, (id, current) -> {
            boolean open = current.getStatus() == SlashStatus.PENDING || current.getStatus() == SlashStatus.APPLIED;
            if (!open || now.isBefore(current.getDisputeDeadline())) {
                return current;
            }
            claimed.set(current);
            return current.toBuilder().status(SlashStatus.FINALIZED).build();
        });
        return claimed.get();
    }

    private SlashEvent applyPenalty(SlashEvent slash) {
        BigDecimal amount;
        try {
            amount = validatorRegistry.slash(slash.getValidatorId(), slash.getBasisPoints(), slash.getReason()).getAmountSlashed();
            validatorRegistry.applyPenalty(slash.getValidatorId(), slash.getReason());
        } catch (ValidatorNotFoundException e) {
            log.warn("Validator left before slash {} finalized: validatorId={}", slash.getSlashId(), slash.getValidatorId());
            amount = BigDecimal.ZERO;
        }
        metricsService.recordSlash(slash.getReason(), amount);
        events.validatorAlert(AlertType.VALIDATOR_SLASHED, slash.getValidatorId(), slash.getTransferId(), String.format(
                "Slash %s finalized: %s removed for %s", slash.getSlashId(), amount.toPlainString(), slash.getReason()));
        return resolve(slash, SlashStatus.FINALIZED, amount, true);
    }

    private SlashEvent resolve(SlashEvent slash, SlashStatus status, BigDecimal amount, boolean penaltyApplied) {
        SlashEvent resolved = slash.toBuilder()
                .status(status)
                .amountSlashed(amount)
                .penaltyApplied(penaltyApplied)
                .resolvedAt(clock.instant())
                .build();
        slashes.put(slash.getSlashId(), resolved);
        log.info("Slash resolved: slashId={}, validatorId={}, status={}, amount={}",
                slash.getSlashId(), slash.getValidatorId(), status, amount);
        return resolved;
    }

    private void releaseDisputes(SlashEvent slash, boolean excludeValidator) {
        Set<String> transfers = implicatedTransfers.remove(slash.getSlashId());
        if (transfers == null) {
            return;
        }
        for (String transferId : transfers) {
            stateMachine.resolveDispute(transferId, slash.getSlashId(), slash.getValidatorId(), excludeValidator);
        }
    }

    public Optional<SlashEvent> find(String slashId) {
        return Optional.ofNullable(slashes.get(slashId)).map(s -> s.toBuilder().build());
    }

    public List<SlashEvent> slashesFor(String validatorId) {
        return slashes.values().stream()
                .filter(s -> s.getValidatorId().equals(validatorId))
                .sorted(Comparator.comparing(SlashEvent::getTimestamp))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    public List<SlashEvent> unresolvedSlashes() {
        return slashes.values().stream()
                .filter(s -> !s.getStatus().isResolved())
                .sorted(Comparator.comparing(SlashEvent::getTimestamp))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    public Set<String> implicatedTransfers(String slashId) {
        return Set.copyOf(implicatedTransfers.getOrDefault(slashId, Set.of()));
    }

    private SlashEvent require(String slashId) {
        SlashEvent slash = slashes.get(slashId);
        if (slash == null) {
            throw new SlashDisputeException("Slash not found: " + slashId);
        }
        return slash;
    }

    private static String offenceKey(SlashReason reason, String validatorId, String transferId) {
        return reason + ":" + validatorId + ":" + transferId;
    }

    private static String describe(Attestation attestation) {
        return attestation.getPayload().canonical() + "#" + attestation.getSignature();
    }
}
