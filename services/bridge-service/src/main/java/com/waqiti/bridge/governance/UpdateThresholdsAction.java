package com.waqiti.bridge.governance;

import com.waqiti.bridge.chain.ThresholdUpdate;
import com.waqiti.bridge.domain.ChainConfig;
import lombok.Value;

@Value
public class UpdateThresholdsAction implements GovernanceAction {

    String chainId;
    ThresholdUpdate update;

    @Override
    public GovernanceActionType type() {
        return GovernanceActionType.UPDATE_THRESHOLDS;
    }

    @Override
    public String description() {
        return "Update parameters of chain " + chainId + ": " + update;
    }

    @Override
    public void validate(GovernanceTargets targets) {
        targets.getChainConfigRegistry().get(chainId);
    }

    @Override
    public String execute(GovernanceTargets targets) {
        ChainConfig updated = targets.getChainConfigRegistry().updateThresholds(chainId, update);
        return "Chain " + chainId + " now at config version " + updated.getVersion();
    }
}
