package com.coderelay.engine.service;

import com.coderelay.engine.error.LeaseExpiredException;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.ledger.ProposalLedger;
import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.ReviewComment;
import com.coderelay.engine.model.Task;
import com.coderelay.engine.model.TaskStatus;
import com.coderelay.engine.tree.PatchSet;
import com.coderelay.engine.tree.VersionedTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The pull-request workflow as seen by workers and reviewers.
 *
 * Proposal and task move together:
 *   submit / resubmit   proposal OPEN,     task ASSIGNED → IN_REVIEW
 *   approve             proposal APPROVED  (merge happens in MergeCoordinator)
 *   reject              proposal REJECTED, task IN_REVIEW → ASSIGNED
 *
 * A proposal left behind by a worker who no longer holds the task is
 * abandoned when the new owner submits.
 */
@Service
public class ProposalService {

    private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

    private final ProposalLedger            proposalLedger;
    private final TaskLedger                taskLedger;
    private final WorkspaceService          workspaceService;
    private final VersionedTree             tree;
    private final ApplicationEventPublisher events;

    public ProposalService(ProposalLedger proposalLedger,
                           TaskLedger taskLedger,
                           WorkspaceService workspaceService,
                           VersionedTree tree,
                           ApplicationEventPublisher events) {
        this.proposalLedger   = proposalLedger;
        this.taskLedger       = taskLedger;
        this.workspaceService = workspaceService;
        this.tree             = tree;
        this.events           = events;
    }

    // ------------------------------------------------------------------
    // Author side
    // ------------------------------------------------------------------

    /**
     * Open a proposal for the worker's task branch.
     *
     * Steps:
     *  1. Check the worker still holds the task; a pending proposal from a
     *     previous owner is abandoned, one of the worker's own must be resubmitted
     *  2. Push the task branch to trunk (so it can be reviewed and merged)
     *  3. CAS the task ASSIGNED → IN_REVIEW
     *  4. Record the proposal; if that fails the task goes back to ASSIGNED
     */
    public ChangeProposal submit(String workerId, UUID taskId, String title, String description) {
        Task task = taskLedger.getTask(taskId);
        if (task.getStatus() != TaskStatus.ASSIGNED || !workerId.equals(task.getOwner())) {
            throw new LeaseExpiredException(taskId, workerId);
        }
        Optional<ChangeProposal> active = proposalLedger.findActiveForTask(taskId);
        if (active.isPresent()) {
            ChangeProposal previous = active.get();
            if (workerId.equals(previous.getWorkspaceId()) || !previous.getStatus().isAbandonable()) {
                throw new IllegalStateException("Task " + taskId + " already has proposal " + previous.getId()
                        + " (" + previous.getStatus() + "); resubmit it instead");
            }
            proposalLedger.abandon(previous.getId(), previous.getStatus(),
                    "superseded by a submission from '" + workerId + "'");
        }

        String head = workspaceService.publish(workerId, taskId);
        taskLedger.updateStatus(taskId, TaskStatus.ASSIGNED, TaskStatus.IN_REVIEW, workerId);

        ChangeProposal proposal = new ChangeProposal(taskId, workerId, workerId,
                title == null || title.isBlank() ? task.getTitle() : title,
                WorkspaceService.branchFor(taskId, workerId), tree.trunkBranch());
        proposal.setDescription(description);
        proposal.setHeadRevision(head);
        try {
            return proposalLedger.create(proposal);
        } catch (RuntimeException e) {
            taskLedger.updateStatus(taskId, TaskStatus.IN_REVIEW, TaskStatus.ASSIGNED, workerId);
            throw e;
        }
    }

    /**
     * Put a rejected or conflicted proposal back up for review with the
     * branch's new commits.
     */
    public ChangeProposal resubmit(UUID proposalId, String note) {
        ChangeProposal proposal = proposalLedger.get(proposalId);
        ProposalStatus current = proposal.getStatus();
        boolean conflicted = current == ProposalStatus.OPEN && !proposal.getConflictingPaths().isEmpty();
        if (current != ProposalStatus.REJECTED && !conflicted) {
            throw new IllegalStateException("Proposal " + proposalId + " is " + current
                    + "; only rejected or conflicted proposals can be resubmitted");
        }

        String workerId = proposal.getWorkspaceId();
        String head = workspaceService.publish(workerId, proposal.getTaskId());
        if (head.equals(proposal.getHeadRevision())) {
            throw new IllegalStateException("Proposal " + proposalId + " has no new commits since " + head);
        }
        taskLedger.updateStatus(proposal.getTaskId(), TaskStatus.ASSIGNED, TaskStatus.IN_REVIEW, workerId);
        try {
            ChangeProposal resubmitted = proposalLedger.transition(proposalId, current, ProposalStatus.OPEN, p -> {
                p.setHeadRevision(head);
                p.setConflictingPaths(List.of());
                p.addComment(new ReviewComment(p.getAuthor(), ReviewComment.Verdict.COMMENT,
                        note == null || note.isBlank() ? "Resubmitted at " + head : note));
            });
            log.info("Proposal {} resubmitted at {}", proposalId, head);
            return resubmitted;
        } catch (RuntimeException e) {
            taskLedger.updateStatus(proposal.getTaskId(), TaskStatus.IN_REVIEW, TaskStatus.ASSIGNED, workerId);
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Reviewer side
    // ------------------------------------------------------------------

    /**
     * Only a proposal that is actually up for review can be approved: a
     * conflicted one (task back with its author) has to be resubmitted first.
     */
    public ChangeProposal approve(UUID proposalId, String reviewer, String body) {
        ChangeProposal approved = proposalLedger.transition(proposalId, ProposalStatus.OPEN, ProposalStatus.APPROVED,
                p -> {
                    requireInReview(p);
                    p.addComment(new ReviewComment(reviewer, ReviewComment.Verdict.APPROVE, body));
                });
        log.info("Proposal {} approved by {}", proposalId, reviewer);
        events.publishEvent(new ProposalApprovedEvent(proposalId));
        return approved;
    }

    public ChangeProposal reject(UUID proposalId, String reviewer, String body) {
        ChangeProposal rejected = proposalLedger.transition(proposalId, ProposalStatus.OPEN, ProposalStatus.REJECTED,
                p -> p.addComment(new ReviewComment(reviewer, ReviewComment.Verdict.REQUEST_CHANGES, body)));
        try {
            taskLedger.updateStatus(rejected.getTaskId(), TaskStatus.IN_REVIEW, TaskStatus.ASSIGNED,
                    rejected.getWorkspaceId());
        } catch (StaleStateException e) {
            log.warn("Task {} was not in review when proposal {} was rejected: {}",
                    rejected.getTaskId(), proposalId, e.getMessage());
        }
        log.info("Proposal {} rejected by {}", proposalId, reviewer);
        return rejected;
    }

    public ChangeProposal comment(UUID proposalId, String reviewer, String body) {
        return proposalLedger.comment(proposalId, new ReviewComment(reviewer, ReviewComment.Verdict.COMMENT, body));
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public ChangeProposal get(UUID proposalId) {
        return proposalLedger.get(proposalId);
    }

    public List<ChangeProposal> list(ProposalStatus status) {
        return proposalLedger.list(status);
    }

    /** What the proposal's branch changes relative to where it left trunk. */
    public PatchSet diff(UUID proposalId) {
        ChangeProposal proposal = proposalLedger.get(proposalId);
        if (proposal.getStatus() == ProposalStatus.MERGED && proposal.getMergeRevision() != null) {
            String merged = proposal.getMergeRevision();
            // The branch is gone after the merge; show what the merge brought into trunk.
            // Without a merge commit trunk already had everything, so nothing came in.
            return proposal.isMergeCommit()
                    ? tree.diff(merged + "^1", merged)
                    : tree.diff(merged, merged);
        }
        return tree.touchedPaths(proposal.getSourceBranch());
    }

    private void requireInReview(ChangeProposal proposal) {
        if (!proposal.getConflictingPaths().isEmpty()) {
            throw new IllegalStateException("Proposal " + proposal.getId() + " conflicts on "
                    + String.join(", ", proposal.getConflictingPaths()) + "; it must be resubmitted first");
        }
        Task task = taskLedger.getTask(proposal.getTaskId());
        if (task.getStatus() != TaskStatus.IN_REVIEW) {
            throw new IllegalStateException("Task " + task.getId() + " of proposal " + proposal.getId()
                    + " is " + task.getStatus() + ", not IN_REVIEW");
        }
    }
}
