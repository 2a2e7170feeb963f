package com.waqiti.bridge.governance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GovernanceProposal {

    private String proposalId;
    private GovernanceAction action;
    private String proposer;

    /**
     * Council members who approved, proposer first.
     */
    @Builder.Default
    private Set<String> approvals = new LinkedHashSet<>();

    private int requiredApprovals;
    private ProposalStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant executedAt;
    private String result;
    private String failureReason;

    public GovernanceProposal snapshot() {
        return toBuilder().approvals(new LinkedHashSet<>(approvals)).build();
    }
}
