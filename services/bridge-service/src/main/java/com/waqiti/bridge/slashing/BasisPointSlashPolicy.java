package com.waqiti.bridge.slashing;

import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.SlashReason;
import com.waqiti.bridge.domain.Validator;

/**
 * Fixed basis-point fraction per reason, falling back to the configured default.
 */
public class BasisPointSlashPolicy implements SlashPolicy {

    private static final int MAX_BASIS_POINTS = 10_000;

    private final BridgeProperties.SlashingSettings settings;

    public BasisPointSlashPolicy(BridgeProperties.SlashingSettings settings) {
        this.settings = settings;
    }

    @Override
    public int basisPointsFor(SlashReason reason, Validator validator) {
        int bps = settings.getBasisPointsByReason().getOrDefault(reason, settings.getDefaultBasisPoints());
        return Math.max(0, Math.min(MAX_BASIS_POINTS, bps));
    }
}
