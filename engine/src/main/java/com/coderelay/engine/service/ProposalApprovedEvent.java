package com.coderelay.engine.service;

import java.util.UUID;

/** Published when a reviewer approves a proposal, so the merge can start right away. */
public record ProposalApprovedEvent(UUID proposalId) {
}
