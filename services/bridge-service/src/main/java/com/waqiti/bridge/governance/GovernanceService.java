package com.waqiti.bridge.governance;

import com.waqiti.bridge.alert.BridgeEventPublisher;
import com.waqiti.bridge.attestation.SignatureVerifier;
import com.waqiti.bridge.chain.ChainConfigRegistry;
import com.waqiti.bridge.config.BridgeProperties;
import com.waqiti.bridge.exception.BridgeException;
import com.waqiti.bridge.exception.GovernanceException;
import com.waqiti.bridge.slashing.SlashingEngine;
import com.waqiti.bridge.transfer.TransferStateMachine;
import com.waqiti.bridge.validator.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * M-of-N Governance
 *
 * <p>Privileged operations (validator registration and removal, chain threshold changes,
 * pause/unpause, slash adjudication) run only after {@code requiredApprovals} distinct council
 * members approve. The proposer's own approval counts as the first. No single member can act
 * alone: at least two approvals are always required.</p>
 *
 * @author Waqiti Platform Team
 * @since 1.0.0
 */
@Slf4j
@Service
public class GovernanceService {

    private static final int MINIMUM_APPROVALS = 2;

    private final Map<String, GovernanceProposal> proposals = new ConcurrentHashMap<>();

    private final Set<String> council;
    private final int requiredApprovals;
    private final Duration proposalTtl;
    private final GovernanceTargets targets;
    private final Clock clock;

    public GovernanceService(BridgeProperties properties,
                             ValidatorRegistry validatorRegistry,
                             SignatureVerifier signatureVerifier,
                             ChainConfigRegistry chainConfigRegistry,
                             BridgePauseState pauseState,
                             TransferStateMachine stateMachine,
                             SlashingEngine slashingEngine,
                             BridgeEventPublisher events,
                             Clock clock) {
        BridgeProperties.GovernanceSettings settings = properties.getGovernance();
        this.council = Set.copyOf(new LinkedHashSet<>(settings.getCouncil()));
        this.requiredApprovals = settings.getRequiredApprovals();
        this.proposalTtl = settings.getProposalTtl();
        this.clock = clock;
        this.targets = GovernanceTargets.builder()
                .validatorRegistry(validatorRegistry)
                .signatureVerifier(signatureVerifier)
                .chainConfigRegistry(chainConfigRegistry)
                .pauseState(pauseState)
                .stateMachine(stateMachine)
                .slashingEngine(slashingEngine)
                .events(events)
                .clock(clock)
                .build();

        if (requiredApprovals < MINIMUM_APPROVALS) {
            throw new IllegalStateException("Governance requires at least " + MINIMUM_APPROVALS
                    + " approvals, configured " + requiredApprovals);
        }
        if (council.size() < requiredApprovals) {
            log.warn("Governance council has {} members but {} approvals are required; no proposal can pass",
                    council.size(), requiredApprovals);
        }
    }

    public GovernanceProposal propose(String proposer, GovernanceAction action) {
        requireMember(proposer);
        if (action == null) {
            throw new GovernanceException("Proposal action is required");
        }
        action.validate(targets);

        Instant now = clock.instant();
        GovernanceProposal proposal = GovernanceProposal.builder()
                .proposalId(UUID.randomUUID().toString())
                .action(action)
                .proposer(proposer)
                .requiredApprovals(requiredApprovals)
                .status(ProposalStatus.PENDING)
                .createdAt(now)
                .expiresAt(now.plus(proposalTtl))
                .build();
        proposal.getApprovals().add(proposer);
        proposals.put(proposal.getProposalId(), proposal);

        log.info("Governance proposal created: id={}, type={}, proposer={}, action={}",
                proposal.getProposalId(), action.type(), proposer, action.description());
        return proposal.snapshot();
    }

    /**
     * Records an approval and executes the action once enough members approved.
     */
    public GovernanceProposal approve(String proposalId, String member) {
        requireMember(member);
        GovernanceProposal proposal = require(proposalId);
        synchronized (proposal) {
            requireOpen(proposal);
            if (!proposal.getApprovals().add(member)) {
                throw new GovernanceException(member + " already approved proposal " + proposalId);
            }
            log.info("Governance approval: id={}, member={}, approvals={}/{}",
                    proposalId, member, proposal.getApprovals().size(), proposal.getRequiredApprovals());

            if (proposal.getApprovals().size() >= proposal.getRequiredApprovals()) {
                execute(proposal);
            }
            return proposal.snapshot();
        }
    }

    public GovernanceProposal cancel(String proposalId, String member) {
        GovernanceProposal proposal = require(proposalId);
        synchronized (proposal) {
            requireOpen(proposal);
            if (!proposal.getProposer().equals(member)) {
                throw new GovernanceException("Only the proposer can cancel proposal " + proposalId);
            }
            proposal.setStatus(ProposalStatus.CANCELLED);
            log.info("Governance proposal cancelled: id={}", proposalId);
            return proposal.snapshot();
        }
    }

    private void execute(GovernanceProposal proposal) {
        GovernanceAction action = proposal.getAction();
        try {
            String result = action.execute(targets);
            proposal.setStatus(ProposalStatus.EXECUTED);
            proposal.setResult(result);
            log.warn("Governance action executed: id={}, type={}, approvals={}, result={}",
                    proposal.getProposalId(), action.type(), proposal.getApprovals(), result);
        } catch (BridgeException e) {
            proposal.setStatus(ProposalStatus.FAILED);
            proposal.setFailureReason(e.getMessage());
            log.error("Governance action failed: id={}, type={}, error={}",
                    proposal.getProposalId(), action.type(), e.getMessage());
        }
        proposal.setExecutedAt(clock.instant());
    }

    /**
     * @return number of proposals that expired
     */
    public int expireStaleProposals() {
        Instant now = clock.instant();
        int expired = 0;
        for (GovernanceProposal proposal : proposals.values()) {
            synchronized (proposal) {
                if (proposal.getStatus().isOpen() && !now.isBefore(proposal.getExpiresAt())) {
                    proposal.setStatus(ProposalStatus.EXPIRED);
                    expired++;
                }
            }
        }
        if (expired > 0) {
            log.info("Expired {} governance proposals", expired);
        }
        return expired;
    }

    public Optional<GovernanceProposal> find(String proposalId) {
        return Optional.ofNullable(proposals.get(proposalId)).map(p -> {
            synchronized (p) {
                return p.snapshot();
            }
        });
    }

    public List<GovernanceProposal> openProposals() {
        return proposals.values().stream()
                .filter(p -> p.getStatus().isOpen())
                .sorted(Comparator.comparing(GovernanceProposal::getCreatedAt))
                .map(GovernanceProposal::snapshot)
                .toList();
    }

    public boolean isCouncilMember(String member) {
        return member != null && council.contains(member);
    }

    private void requireMember(String member) {
        if (!isCouncilMember(member)) {
            throw new GovernanceException("Not a governance council member: " + member);
        }
    }

    private void requireOpen(GovernanceProposal proposal) {
        if (proposal.getStatus().isOpen() && !clock.instant().isBefore(proposal.getExpiresAt())) {
            proposal.setStatus(ProposalStatus.EXPIRED);
        }
        if (!proposal.getStatus().isOpen()) {
            throw new GovernanceException("Proposal " + proposal.getProposalId() + " is " + proposal.getStatus());
        }
    }

    private GovernanceProposal require(String proposalId) {
        GovernanceProposal proposal = proposals.get(proposalId);
        if (proposal == null) {
            throw new GovernanceException("Proposal not found: " + proposalId);
        }
        return proposal;
    }
}
