package com.waqiti.bridge.governance;

import com.waqiti.bridge.domain.AlertType;
import lombok.Value;

@Value
public class PauseBridgeAction implements GovernanceAction {

    String reason;

    @Override
    public GovernanceActionType type() {
        return GovernanceActionType.PAUSE;
    }

    @Override
    public String description() {
        return "Pause bridge: " + reason;
    }

    @Override
    public String execute(GovernanceTargets targets) {
        if (!targets.getPauseState().pause(targets.getClock().instant())) {
            return "Bridge already paused";
        }
        targets.getEvents().alert(AlertType.BRIDGE_PAUSED, null, null, "Bridge paused by governance: " + reason);
        return "Bridge paused";
    }
}
