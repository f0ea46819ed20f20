package com.coderelay.engine.repository;

import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the change_proposals table.
 *
 * Writes are optimistic: ChangeProposal carries a @Version column, so a save
 * based on a stale read fails instead of overwriting.
 */
public interface ChangeProposalRepository extends JpaRepository<ChangeProposal, UUID> {

    List<ChangeProposal> findByStatusOrderByCreatedAtAsc(ProposalStatus status);

    /** Approved proposals the merge scheduler may pick up. */
    List<ChangeProposal> findByStatusAndEscalatedFalseOrderByCreatedAtAsc(ProposalStatus status);

    List<ChangeProposal> findByTaskIdAndStatusIn(UUID taskId, Collection<ProposalStatus> statuses);

    List<ChangeProposal> findByTaskIdOrderByCreatedAtAsc(UUID taskId);

    long countByStatus(ProposalStatus status);
}
