package com.waqiti.bridge.validator;

import com.waqiti.bridge.alert.BridgeEventPublisher;
import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.AlertType;
import com.waqiti.bridge.domain.SlashEvent;
import com.waqiti.bridge.domain.SlashReason;
import com.waqiti.bridge.domain.SlashStatus;
import com.waqiti.bridge.domain.Validator;
import com.waqiti.bridge.exception.InsufficientStakeException;
import com.waqiti.bridge.exception.ValidationException;
import com.waqiti.bridge.exception.ValidatorNotFoundException;
import com.waqiti.bridge.metrics.BridgeMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validator Registry
 *
 * <p>Tracks stake, reputation and active-set membership for bridge validators.</p>
 *
 * <h3>Concurrency:</h3>
 * <ul>
 *   <li>Each validator has its own read/write lock; mutations are single-writer per validator</li>
 *   <li>Eligibility reads take the read lock and wait at most for one in-flight mutation</li>
 *   <li>Unrelated validators never contend</li>
 * </ul>
 *
 * <h3>Eligibility:</h3>
 * <pre>
 * isEligible(id) = stake ≥ minStake ∧ reputation ≥ minReputation ∧ active
 * </pre>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Slf4j
@Service
public class ValidatorRegistry {

    private static final BigDecimal BASIS_POINTS = BigDecimal.valueOf(10_000);

    private final ConcurrentHashMap<String, Entry> validators = new ConcurrentHashMap<>();

    private final AtomicBoolean belowMinimum = new AtomicBoolean(false);

    private final BridgeProperties.ValidatorSettings settings;
    private final ReputationPolicy reputationPolicy;
    private final BridgeEventPublisher eventPublisher;
    private final BridgeMetricsService metricsService;
    private final Clock clock;

    public ValidatorRegistry(BridgeProperties properties,
                             ReputationPolicy reputationPolicy,
                             BridgeEventPublisher eventPublisher,
                             BridgeMetricsService metricsService,
                             Clock clock) {
        this.settings = properties.getValidator();
        this.reputationPolicy = reputationPolicy;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @PostConstruct
    public void registerMetrics() {
        metricsService.registerEligibleValidatorGauge(this::eligibleCount);
    }

    /**
     * Registers a validator with its initial stake.
     *
     * @throws InsufficientStakeException if stake is below the configured minimum
     * @throws ValidationException if the id is already registered or the key is missing
     */
    public Validator register(String validatorId, BigDecimal stake, String publicKey) {
        if (validatorId == null || validatorId.isBlank()) {
            throw new ValidationException("Validator id is required");
        }
        if (publicKey == null || publicKey.isBlank()) {
            throw new ValidationException("Public key is required for validator " + validatorId);
        }
        if (stake == null || stake.compareTo(settings.getMinStake()) < 0) {
            throw new InsufficientStakeException(String.format(
                    "Stake %s below minimum %s for validator %s", stake, settings.getMinStake(), validatorId));
        }

        Instant now = clock.instant();
        Validator validator = Validator.builder()
                .validatorId(validatorId)
                .publicKey(publicKey)
                .stakeAmount(stake)
                .reputationScore(clamp(reputationPolicy.initialScore()))
                .active(true)
                .registeredAt(now)
                .lastActivityAt(now)
                .build();

        Entry existing = validators.putIfAbsent(validatorId, new Entry(validator));
        if (existing != null) {
            throw new ValidationException("Validator already registered: " + validatorId);
        }

        log.info("Validator registered: id={}, stake={}, reputation={}",
                validatorId, stake, validator.getReputationScore());
        return validator.copy();
    }

    /**
     * Slashes {@code stake * basisPoints / 10000}, floored at zero. The returned event is
     * {@link SlashStatus#APPLIED}; dispute handling is layered on top by the slashing engine.
     */
    public SlashEvent slash(String validatorId, int basisPoints) {
        return slash(validatorId, basisPoints, SlashReason.ADMINISTRATIVE);
    }

    public SlashEvent slash(String validatorId, int basisPoints, SlashReason reason) {
        if (basisPoints < 0) {
            throw new ValidationException("Basis points cannot be negative: " + basisPoints);
        }

        Entry entry = entry(validatorId);
        BigDecimal slashed;
        BigDecimal remaining;
        entry.lock.writeLock().lock();
        try {
            Validator v = entry.validator;
            BigDecimal stake = v.getStakeAmount();
            slashed = stake.multiply(BigDecimal.valueOf(basisPoints)).divide(BASIS_POINTS);
            if (slashed.compareTo(stake) > 0) {
                slashed = stake;
            }
            remaining = stake.subtract(slashed);
            v.setStakeAmount(remaining);
            v.setTotalSlashed(v.getTotalSlashed().add(slashed));
        } finally {
            entry.lock.writeLock().unlock();
        }

        Instant now = clock.instant();
        log.warn("Validator slashed: id={}, reason={}, bps={}, amount={}, remainingStake={}",
                validatorId, reason, basisPoints, slashed, remaining);

        if (remaining.compareTo(settings.getMinStake()) < 0) {
            log.warn("Validator {} lost eligibility: stake {} below minimum {}",
                    validatorId, remaining, settings.getMinStake());
        }
        checkMinimumActiveSet();

        return SlashEvent.builder()
                .slashId(UUID.randomUUID().toString())
                .validatorId(validatorId)
                .reason(reason)
                .basisPoints(basisPoints)
                .amountSlashed(slashed)
                .timestamp(now)
                .disputeDeadline(now)
                .status(SlashStatus.APPLIED)
                .penaltyApplied(true)
                .build();
    }

    /**
     * Adjusts reputation, clamped to [0, 100].
     *
     * @return the new score
     */
    public int updateReputation(String validatorId, int delta) {
        Validator updated = mutate(validatorId, v -> v.setReputationScore(clamp((long) v.getReputationScore() + delta)));
        log.debug("Reputation updated: id={}, delta={}, score={}", validatorId, delta, updated.getReputationScore());
        if (delta < 0) {
            checkMinimumActiveSet();
        }
        return updated.getReputationScore();
    }

    public int applyPenalty(String validatorId, SlashReason reason) {
        return updateReputation(validatorId, reputationPolicy.penaltyFor(reason));
    }

    /**
     * Records a counted attestation: rewards reputation and resets the missed-window streak.
     */
    public void recordAttestation(String validatorId, boolean timely) {
        int reward = reputationPolicy.rewardForAttestation(timely);
        Instant now = clock.instant();
        mutate(validatorId, v -> {
            v.setReputationScore(clamp((long) v.getReputationScore() + reward));
            v.setLastActivityAt(now);
            v.setValidatedTransfers(v.getValidatedTransfers() + 1);
            v.setMissedWindows(0);
        });
    }

    /**
     * @return consecutive missed windows after this one
     */
    public int recordMissedWindow(String validatorId) {
        return mutate(validatorId, v -> v.setMissedWindows(v.getMissedWindows() + 1)).getMissedWindows();
    }

    public void resetMissedWindows(String validatorId) {
        mutate(validatorId, v -> v.setMissedWindows(0));
    }

    /**
     * Eligibility evaluated against current state.
     */
    public boolean isEligible(String validatorId) {
        Entry entry = validators.get(validatorId);
        if (entry == null) {
            return false;
        }
        return entry.read(this::eligible);
    }

    public int eligibleCount() {
        return (int) validators.values().stream()
                .filter(e -> e.read(this::eligible))
                .count();
    }

    public Set<String> eligibleValidatorIds() {
        return validators.entrySet().stream()
                .filter(e -> e.getValue().read(this::eligible))
                .map(java.util.Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    public Optional<Validator> find(String validatorId) {
        Entry entry = validators.get(validatorId);
        return entry == null ? Optional.empty() : Optional.of(entry.read(Validator::copy));
    }

    public Validator get(String validatorId) {
        return find(validatorId)
                .orElseThrow(() -> new ValidatorNotFoundException("Validator not registered: " + validatorId));
    }

    public Optional<String> publicKey(String validatorId) {
        Entry entry = validators.get(validatorId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.read(Validator::getPublicKey));
    }

    public List<Validator> all() {
        return validators.values().stream()
                .map(e -> e.read(Validator::copy))
                .sorted(Comparator.comparing(Validator::getValidatorId))
                .toList();
    }

    /**
     * Starts a voluntary exit. The validator stops counting toward thresholds immediately.
     *
     * @throws ValidationException if the exit would shrink the eligible set below the minimum
     */
    public Validator requestExit(String validatorId) {
        Entry entry = entry(validatorId);
        boolean eligibleNow = entry.read(this::eligible);
        if (eligibleNow && eligibleCount() - 1 < settings.getMinActiveValidators()) {
            throw new ValidationException(String.format(
                    "Exit of %s would drop eligible validators below minimum %d",
                    validatorId, settings.getMinActiveValidators()));
        }

        Instant now = clock.instant();
        Validator updated = mutate(validatorId, v -> {
            if (v.isExiting()) {
                throw new ValidationException("Exit already requested for validator " + validatorId);
            }
            v.setActive(false);
            v.setExitRequestedAt(now);
        });
        log.info("Validator exit requested: id={}, cooldownEnds={}", validatorId, now.plus(settings.getExitCooldown()));
        return updated;
    }

    /**
     * Removes a validator whose exit cooldown has elapsed.
     *
     * @return the final state, including the stake to release
     */
    public Validator completeExit(String validatorId) {
        Validator current = get(validatorId);
        if (!current.isExiting()) {
            throw new ValidationException("No exit requested for validator " + validatorId);
        }
        Instant cooldownEnds = current.getExitRequestedAt().plus(settings.getExitCooldown());
        if (clock.instant().isBefore(cooldownEnds)) {
            throw new ValidationException("Exit cooldown for " + validatorId + " ends at " + cooldownEnds);
        }
        validators.remove(validatorId);
        log.info("Validator exited: id={}, releasedStake={}", validatorId, current.getStakeAmount());
        return current;
    }

    /**
     * Governance removal. No cooldown and no minimum-set check, but an alert is raised if the
     * set becomes too small.
     */
    public Validator remove(String validatorId) {
        Entry removed = validators.remove(validatorId);
        if (removed == null) {
            throw new ValidatorNotFoundException("Validator not registered: " + validatorId);
        }
        log.warn("Validator removed by governance: id={}", validatorId);
        checkMinimumActiveSet();
        return removed.read(Validator::copy);
    }

    public Validator deactivate(String validatorId) {
        Validator updated = mutate(validatorId, v -> v.setActive(false));
        log.warn("Validator deactivated: id={}", validatorId);
        checkMinimumActiveSet();
        return updated;
    }

    /**
     * Applies inactivity decay to every validator.
     *
     * @return number of validators whose score decayed
     */
    public int decayInactive() {
        Instant now = clock.instant();
        int decayed = 0;
        for (Entry entry : validators.values()) {
            entry.lock.writeLock().lock();
            try {
                Validator v = entry.validator;
                Instant since = latest(v.getLastActivityAt(), v.getLastDecayAt());
                int points = reputationPolicy.decayFor(Duration.between(since, now));
                if (points > 0) {
                    v.setReputationScore(clamp((long) v.getReputationScore() - points));
                    v.setLastDecayAt(now);
                    decayed++;
                }
            } finally {
                entry.lock.writeLock().unlock();
            }
        }
        if (decayed > 0) {
            log.info("Reputation decay applied to {} inactive validators", decayed);
            checkMinimumActiveSet();
        }
        return decayed;
    }

    public boolean hasMinimumActiveSet() {
        return eligibleCount() >= settings.getMinActiveValidators();
    }

    /**
     * Alerts once per drop below the minimum; the flag re-arms when the set recovers.
     */
    private void checkMinimumActiveSet() {
        int eligible = eligibleCount();
        if (eligible >= settings.getMinActiveValidators()) {
            belowMinimum.set(false);
            return;
        }
        if (belowMinimum.compareAndSet(false, true)) {
            eventPublisher.chainAlert(AlertType.VALIDATOR_SET_BELOW_MINIMUM, null,
                    String.format("Eligible validators %d below minimum %d", eligible, settings.getMinActiveValidators()));
        }
    }

    private boolean eligible(Validator v) {
        return v.isActive()
                && v.getStakeAmount().compareTo(settings.getMinStake()) >= 0
                && v.getReputationScore() >= settings.getMinReputation();
    }

    private Validator mutate(String validatorId, Consumer<Validator> mutation) {
        Entry entry = entry(validatorId);
        entry.lock.writeLock().lock();
        try {
            mutation.accept(entry.validator);
            return entry.validator.copy();
        } finally {
            entry.lock.writeLock().unlock();
        }
    }

    private Entry entry(String validatorId) {
        Entry entry = validators.get(validatorId);
        if (entry == null) {
            throw new ValidatorNotFoundException("Validator not registered: " + validatorId);
        }
        return entry;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    static int clamp(long score) {
        return (int) Math.max(0, Math.min(100, score));
    }

    private static final class Entry {
        private final Validator validator;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        private Entry(Validator validator) {
            this.validator = validator;
        }

        private <T> T read(Function<Validator, T> reader) {
            lock.readLock().lock();
            try {
                return reader.apply(validator);
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
