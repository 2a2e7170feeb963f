package com.waqiti.bridge.governance;

/**
 * A privileged operation that runs only after enough council approvals.
 */
public interface GovernanceAction {

    GovernanceActionType type();

    String description();

    /**
     * Checks preconditions when the proposal is created.
     */
    default void validate(GovernanceTargets targets) {
    }

    /**
     * @return a short summary of the outcome
     */
    String execute(GovernanceTargets targets);
}
