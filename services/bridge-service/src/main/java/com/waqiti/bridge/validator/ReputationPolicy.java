package com.waqiti.bridge.validator;

import com.waqiti.bridge.domain.SlashReason;

import java.time.Duration;

/**
 * Scoring strategy for validator reputation. The registry clamps every result to [0, 100].
 */
public interface ReputationPolicy {

    int initialScore();

    /**
     * @param timely whether the attestation arrived within the timely window of its round
     * @return non-negative delta
     */
    int rewardForAttestation(boolean timely);

    /**
     * @return non-positive delta for proven or finalized misbehavior
     */
    int penaltyFor(SlashReason reason);

    /**
     * @param inactivity time since the later of last activity and last decay
     * @return non-negative number of points to remove
     */
    int decayFor(Duration inactivity);
}
