package com.coderelay.engine.ledger;

import com.coderelay.engine.error.NotFoundException;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.ReviewComment;
import com.coderelay.engine.repository.ChangeProposalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable store of change proposals.
 *
 * A transition is load → check status → mutate → saveAndFlush. The flush
 * issues {@code UPDATE ... WHERE version = ?}, so if anyone else wrote the
 * row since our read the save fails and is reported as StaleStateException.
 *
 * Transitions deliberately run in their own short transactions (the
 * repository's) rather than joining a caller's: a failed optimistic write
 * would otherwise poison the surrounding transaction.
 */
@Service
public class ProposalLedger {

    private static final Logger log = LoggerFactory.getLogger(ProposalLedger.class);

    private static final EnumSet<ProposalStatus> ACTIVE = EnumSet.noneOf(ProposalStatus.class);

    static {
        for (ProposalStatus status : ProposalStatus.values()) {
            if (status.isActive()) {
                ACTIVE.add(status);
            }
        }
    }

    private final ChangeProposalRepository proposalRepo;

    public ProposalLedger(ChangeProposalRepository proposalRepo) {
        this.proposalRepo = proposalRepo;
    }

    // ------------------------------------------------------------------
    // Creation and reads
    // ------------------------------------------------------------------

    /**
     * Record a new OPEN proposal.
     *
     * @throws IllegalStateException if the task already has an active proposal
     */
    public ChangeProposal create(ChangeProposal proposal) {
        Optional<ChangeProposal> active = findActiveForTask(proposal.getTaskId());
        if (active.isPresent()) {
            throw new IllegalStateException("Task " + proposal.getTaskId()
                    + " already has active proposal " + active.get().getId());
        }
        ChangeProposal saved = proposalRepo.saveAndFlush(proposal);
        log.info("Proposal {} opened for task {} from {} ({})",
                saved.getId(), saved.getTaskId(), saved.getSourceBranch(), saved.getHeadRevision());
        return saved;
    }

    public ChangeProposal get(UUID id) {
        return proposalRepo.findById(id).orElseThrow(() -> new NotFoundException("Proposal", id));
    }

    public List<ChangeProposal> list(ProposalStatus status) {
        return status == null
                ? proposalRepo.findAll()
                : proposalRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    public List<ChangeProposal> listForTask(UUID taskId) {
        return proposalRepo.findByTaskIdOrderByCreatedAtAsc(taskId);
    }

    public Optional<ChangeProposal> findActiveForTask(UUID taskId) {
        return proposalRepo.findByTaskIdAndStatusIn(taskId, ACTIVE).stream().findFirst();
    }

    /** APPROVED proposals that have not been escalated, oldest first. */
    public List<ChangeProposal> findMergeCandidates() {
        return proposalRepo.findByStatusAndEscalatedFalseOrderByCreatedAtAsc(ProposalStatus.APPROVED);
    }

    public Map<ProposalStatus, Long> countByStatus() {
        Map<ProposalStatus, Long> counts = new EnumMap<>(ProposalStatus.class);
        for (ProposalStatus status : ProposalStatus.values()) {
            counts.put(status, proposalRepo.countByStatus(status));
        }
        return counts;
    }

    // ------------------------------------------------------------------
    // Compare-and-swap
    // ------------------------------------------------------------------

    /**
     * Move a proposal from {@code expected} to {@code target}, applying
     * {@code mutation} to the other fields in the same write.
     *
     * @throws StaleStateException if the proposal is not in {@code expected}
     *                             or was written concurrently
     */
    public ChangeProposal transition(UUID id, ProposalStatus expected, ProposalStatus target,
                                     Consumer<ChangeProposal> mutation) {
        ChangeProposal proposal = get(id);
        if (proposal.getStatus() != expected) {
            throw new StaleStateException(id.toString(),
                    "Proposal " + id + " is " + proposal.getStatus() + ", expected " + expected);
        }
        mutation.accept(proposal);
        proposal.setStatus(target);
        ChangeProposal saved = save(proposal);
        log.debug("Proposal {} {} → {}", id, expected, target);
        return saved;
    }

    public ChangeProposal transition(UUID id, ProposalStatus expected, ProposalStatus target) {
        return transition(id, expected, target, p -> { });
    }

    /** Change fields without moving the status (still checked against {@code expected}). */
    public ChangeProposal update(UUID id, ProposalStatus expected, Consumer<ChangeProposal> mutation) {
        return transition(id, expected, expected, mutation);
    }

    /**
     * Drop an OPEN or REJECTED proposal whose author no longer holds the task.
     *
     * @throws IllegalStateException if the proposal is past review
     * @throws StaleStateException   if it is not in {@code expected} any more
     */
    public ChangeProposal abandon(UUID id, ProposalStatus expected, String reason) {
        if (!expected.isAbandonable()) {
            throw new IllegalStateException("Proposal " + id + " is " + expected + " and cannot be abandoned");
        }
        ChangeProposal abandoned = transition(id, expected, ProposalStatus.ABANDONED,
                p -> p.addComment(ReviewComment.system("Abandoned: " + reason)));
        log.info("Proposal {} abandoned ({})", id, reason);
        return abandoned;
    }

    /**
     * Abandon whatever proposal of {@code taskId} is still waiting on its author.
     *
     * @return the number of proposals abandoned
     */
    public int abandonForTask(UUID taskId, String reason) {
        int abandoned = 0;
        for (ChangeProposal proposal : proposalRepo.findByTaskIdAndStatusIn(taskId, ACTIVE)) {
            if (!proposal.getStatus().isAbandonable()) {
                continue;
            }
            try {
                abandon(proposal.getId(), proposal.getStatus(), reason);
                abandoned++;
            } catch (StaleStateException e) {
                log.warn("Proposal {} of task {} moved while being abandoned: {}",
                        proposal.getId(), taskId, e.getMessage());
            }
        }
        return abandoned;
    }

    /** Append a comment whatever the status. */
    public ChangeProposal comment(UUID id, ReviewComment comment) {
        ChangeProposal proposal = get(id);
        proposal.addComment(comment);
        return save(proposal);
    }

    private ChangeProposal save(ChangeProposal proposal) {
        try {
            return proposalRepo.saveAndFlush(proposal);
        } catch (OptimisticLockingFailureException e) {
            throw new StaleStateException(proposal.getId().toString(),
                    "Proposal " + proposal.getId() + " was modified concurrently", e);
        }
    }
}
