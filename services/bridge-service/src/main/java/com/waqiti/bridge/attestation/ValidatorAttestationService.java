package com.waqiti.bridge.attestation;

import com.waqiti.bridge.chain.LockEventListener;
import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.domain.Attestation;
import com.waqiti.bridge.domain.AttestationPayload;
import com.waqiti.bridge.domain.LockEvent;
import com.waqiti.bridge.transfer.TransferStateMachine;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Attests confirmed locks on behalf of the validator identities hosted by this node. Each
 * validator signs independently through the external key manager, one task per validator.
 */
@Slf4j
@Service
@Order(1)
public class ValidatorAttestationService implements LockEventListener {

    private final List<String> localValidatorIds;
    private final AttestationSigner signer;
    private final ValidatorRegistry validatorRegistry;
    private final TransferStateMachine stateMachine;
    private final Executor signingExecutor;
    private final Clock clock;

    public ValidatorAttestationService(BridgeProperties properties,
                                       ObjectProvider<AttestationSigner> signer,
                                       ValidatorRegistry validatorRegistry,
                                       TransferStateMachine stateMachine,
                                       @Qualifier("attestationSigningExecutor") Executor signingExecutor,
                                       Clock clock) {
        this.localValidatorIds = List.copyOf(properties.getValidator().getLocalIds());
        this.signer = signer.getIfAvailable();
        this.validatorRegistry = validatorRegistry;
        this.stateMachine = stateMachine;
        this.signingExecutor = signingExecutor;
        this.clock = clock;
        if (!localValidatorIds.isEmpty() && this.signer == null) {
            log.warn("Local validator ids configured but no AttestationSigner available: {}", localValidatorIds);
        }
    }

    @Override
    public void onLockObserved(LockEvent event) {
        // validators only sign confirmed locks
    }

    @Override
    public void onLockDropped(LockEvent event, String reason) {
        // nothing was signed for an unconfirmed lock
    }

    @Override
    public void onLockConfirmed(LockEvent event) {
        if (signer == null || localValidatorIds.isEmpty()) {
            return;
        }
        AttestationPayload payload = AttestationPayload.of(event);
        for (String validatorId : localValidatorIds) {
            if (validatorRegistry.find(validatorId).isEmpty()) {
                continue;
            }
            signingExecutor.execute(() -> attest(validatorId, payload));
        }
    }

    private void attest(String validatorId, AttestationPayload payload) {
        try {
            String signature = signer.signAttestation(validatorId, payload);
            Attestation attestation = Attestation.builder()
                    .validatorId(validatorId)
                    .payload(payload)
                    .signature(signature)
                    .timestamp(clock.instant())
                    .build();
            AttestationResult result = stateMachine.submitAttestation(attestation);
            log.debug("Local attestation submitted: validatorId={}, transferId={}, outcome={}",
                    validatorId, payload.getTransferId(), result.getOutcome());
        } catch (RuntimeException e) {
            log.error("Local attestation failed: validatorId={}, transferId={}", validatorId, payload.getTransferId(), e);
        }
    }

    public List<String> localValidatorIds() {
        return localValidatorIds;
    }
}
