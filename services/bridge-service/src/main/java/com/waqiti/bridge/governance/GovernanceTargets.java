package com.waqiti.bridge.governance;

import com.waqiti.bridge.alert.BridgeEventPublisher;
import com.waqiti.bridge.attestation.SignatureVerifier;
import com.waqiti.bridge.chain.ChainConfigRegistry;
import com.waqiti.bridge.slashing.SlashingEngine;
import com.waqiti.bridge.transfer.TransferStateMachine;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;

/**
 * Components a governance action may act on.
 */
@Value
@Builder
public class GovernanceTargets {

    ValidatorRegistry validatorRegistry;
    SignatureVerifier signatureVerifier;
    ChainConfigRegistry chainConfigRegistry;
    BridgePauseState pauseState;
    TransferStateMachine stateMachine;
    SlashingEngine slashingEngine;
    BridgeEventPublisher events;
    Clock clock;
}
