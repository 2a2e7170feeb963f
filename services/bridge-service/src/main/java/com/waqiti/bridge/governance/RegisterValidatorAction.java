package com.waqiti.bridge.governance;

import com.waqiti.bridge.domain.Validator;
import com.waqiti.bridge.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RegisterValidatorAction implements GovernanceAction {

    String validatorId;
    BigDecimal stake;
    String publicKey;

    @Override
    public GovernanceActionType type() {
        return GovernanceActionType.REGISTER_VALIDATOR;
    }

    @Override
    public String description() {
        return "Register validator " + validatorId + " with stake " + stake;
    }

    @Override
    public void validate(GovernanceTargets targets) {
        if (!targets.getSignatureVerifier().isValidPublicKey(publicKey)) {
            throw new ValidationException("Invalid public key for validator " + validatorId);
        }
        if (targets.getValidatorRegistry().find(validatorId).isPresent()) {
            throw new ValidationException("Validator already registered: " + validatorId);
        }
    }

    @Override
    public String execute(GovernanceTargets targets) {
        validate(targets);
        Validator validator = targets.getValidatorRegistry().register(validatorId, stake, publicKey);
        return "Registered " + validator.getValidatorId() + " with reputation " + validator.getReputationScore();
    }
}
