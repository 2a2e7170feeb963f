package com.waqiti.bridge.slashing;

import com.waqiti.bridge.domain.SlashReason;
import com.waqiti.bridge.domain.Validator;

/**
 * Decides how much stake a misbehavior costs.
 */
public interface SlashPolicy {

    /**
     * @return fraction of current stake to slash, in basis points (0-10000)
     */
    int basisPointsFor(SlashReason reason, Validator validator);
}
