package com.waqiti.bridge.governance;

import com.waqiti.bridge.domain.SlashEvent;
import lombok.Value;

@Value
public class AdjudicateSlashAction implements GovernanceAction {

    String slashId;
    boolean upheld;

    @Override
    public GovernanceActionType type() {
        return GovernanceActionType.ADJUDICATE_SLASH;
    }

    @Override
    public String description() {
        return (upheld ? "Uphold" : "Overturn") + " contested slash " + slashId;
    }

    @Override
    public String execute(GovernanceTargets targets) {
        SlashEvent resolved = targets.getSlashingEngine().adjudicate(slashId, upheld);
        return "Slash " + slashId + " " + resolved.getStatus();
    }
}
