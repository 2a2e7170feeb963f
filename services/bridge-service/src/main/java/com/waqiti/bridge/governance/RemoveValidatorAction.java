package com.waqiti.bridge.governance;

import com.waqiti.bridge.domain.Validator;
import lombok.Value;

@Value
public class RemoveValidatorAction implements GovernanceAction {

    String validatorId;
    String reason;

    @Override
    public GovernanceActionType type() {
        return GovernanceActionType.REMOVE_VALIDATOR;
    }

    @Override
    public String description() {
        return "Remove validator " + validatorId + (reason != null ? ": " + reason : "");
    }

    @Override
    public void validate(GovernanceTargets targets) {
        targets.getValidatorRegistry().get(validatorId);
    }

    @Override
    public String execute(GovernanceTargets targets) {
        Validator removed = targets.getValidatorRegistry().remove(validatorId);
        return "Removed " + removed.getValidatorId() + ", stake " + removed.getStakeAmount().toPlainString();
    }
}
