package com.waqiti.bridge.governance;

import com.waqiti.bridge.domain.AlertType;
import lombok.Value;

@Value
public class UnpauseBridgeAction implements GovernanceAction {

    String reason;

    @Override
    public GovernanceActionType type() {
        return GovernanceActionType.UNPAUSE;
    }

    @Override
    public String description() {
        return "Unpause bridge: " + reason;
    }

    @Override
    public String execute(GovernanceTargets targets) {
        if (!targets.getPauseState().unpause()) {
            return "Bridge was not paused";
        }
        targets.getEvents().alert(AlertType.BRIDGE_UNPAUSED, null, null, "Bridge unpaused by governance: " + reason);
        int mints = targets.getStateMachine().resumeHeldSubmissions();
        int refunds = targets.getStateMachine().refundEligibleTransfers();
        return String.format("Bridge unpaused, %d held mints released, %d refunds sent", mints, refunds);
    }
}
