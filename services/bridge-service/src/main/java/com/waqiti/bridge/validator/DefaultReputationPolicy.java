package com.waqiti.bridge.validator;

import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.SlashReason;

import java.time.Duration;

/**
 * Linear scoring: small rewards for participation, one point of decay per idle interval and
 * sharp penalties for misbehavior. Equivocation wipes the score.
 */
public class DefaultReputationPolicy implements ReputationPolicy {

    private final int initialScore;
    private final Duration decayInterval;

    public DefaultReputationPolicy(BridgeProperties.ValidatorSettings settings) {
        this.initialScore = settings.getInitialReputation();
        this.decayInterval = settings.getReputationDecayInterval();
    }

    @Override
    public int initialScore() {
        return initialScore;
    }

    @Override
    public int rewardForAttestation(boolean timely) {
        return timely ? 2 : 1;
    }

    @Override
    public int penaltyFor(SlashReason reason) {
        switch (reason) {
            case EQUIVOCATION:
                return -100;
            case INVALID_ATTESTATION:
                return -30;
            case ADMINISTRATIVE:
                return -20;
            case NON_PARTICIPATION:
                return -15;
            default:
                return 0;
        }
    }

    @Override
    public int decayFor(Duration inactivity) {
        if (inactivity.isNegative() || decayInterval.isZero()) {
            return 0;
        }
        return (int) Math.min(100, inactivity.toMillis() / decayInterval.toMillis());
    }
}
