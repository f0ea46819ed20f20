package com.coderelay.engine.service;

import com.coderelay.engine.config.RetryPolicy;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.ledger.ProposalLedger;
import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.ReviewComment;
import com.coderelay.engine.model.TaskStatus;
import com.coderelay.engine.tree.MergeResult;
import com.coderelay.engine.tree.TreeIOException;
import com.coderelay.engine.tree.VersionedTree;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Merges approved proposals into trunk.
 *
 * For each proposal:
 *  1. work out which paths its branch touches (diff against the merge base),
 *  2. take a merge slot for those paths (overlapping merges queue up,
 *     disjoint ones run side by side),
 *  3. APPROVED → MERGING,
 *  4. three-way merge into trunk under the retry policy,
 *  5. record the result: MERGED (+ task COMPLETED, broadcast), back to OPEN
 *     with the conflicting paths, or APPROVED + escalated when the backend
 *     kept failing.
 *
 * A conflicted proposal is never marked MERGED, and the slot is released on
 * every path out of step 2.
 */
@Service
public class MergeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MergeCoordinator.class);

    // Re-reads when a reviewer comment races our own write to a MERGING proposal.
    private static final int MAX_VERSION_RETRIES = 3;

    private final ProposalLedger    proposalLedger;
    private final TaskLedger        taskLedger;
    private final VersionedTree     tree;
    private final MergeSlotRegistry slots;
    private final RetryPolicy       retryPolicy;
    private final SyncBroadcaster   syncBroadcaster;
    private final MeterRegistry     meterRegistry;
    private final Duration          slotTimeout;

    public MergeCoordinator(ProposalLedger proposalLedger,
                            TaskLedger taskLedger,
                            VersionedTree tree,
                            MergeSlotRegistry slots,
                            RetryPolicy retryPolicy,
                            SyncBroadcaster syncBroadcaster,
                            MeterRegistry meterRegistry,
                            @Value("${coderelay.merge.slot-timeout:10m}") Duration slotTimeout) {
        this.proposalLedger  = proposalLedger;
        this.taskLedger      = taskLedger;
        this.tree            = tree;
        this.slots           = slots;
        this.retryPolicy     = retryPolicy;
        this.syncBroadcaster = syncBroadcaster;
        this.meterRegistry   = meterRegistry;
        this.slotTimeout     = slotTimeout;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Merge an APPROVED, non-escalated proposal, waiting up to the slot
     * timeout behind overlapping merges.
     */
    public MergeOutcome merge(UUID proposalId) {
        return merge(proposalId, true);
    }

    /**
     * Like {@link #merge(UUID)}, but returns DEFERRED at once when an
     * overlapping merge holds (or is queued for) any of the paths. Pool
     * threads use this so a busy path never keeps a disjoint merge waiting.
     */
    public MergeOutcome mergeIfFree(UUID proposalId) {
        return merge(proposalId, false);
    }

    private MergeOutcome merge(UUID proposalId, boolean waitForSlot) {
        MDC.put("proposalId", proposalId.toString());
        try {
            ChangeProposal proposal = proposalLedger.get(proposalId);
            MDC.put("taskId", proposal.getTaskId().toString());

            if (proposal.getStatus() != ProposalStatus.APPROVED) {
                log.debug("Proposal {} is {}, nothing to merge", proposalId, proposal.getStatus());
                return MergeOutcome.skipped(proposalId, "status is " + proposal.getStatus());
            }
            if (proposal.isEscalated()) {
                return MergeOutcome.skipped(proposalId, "escalated: " + proposal.getFailureReason());
            }

            Timer.Sample sample = Timer.start(meterRegistry);
            MergeOutcome outcome = mergeApproved(proposal, waitForSlot);
            sample.stop(meterRegistry.timer("coderelay.merge.duration"));
            if (outcome.kind() != MergeOutcome.Kind.DEFERRED && outcome.kind() != MergeOutcome.Kind.SKIPPED) {
                meterRegistry.counter("coderelay.merge.outcomes",
                        "outcome", outcome.kind().name().toLowerCase()).increment();
            }
            return outcome;
        } finally {
            MDC.remove("proposalId");
            MDC.remove("taskId");
        }
    }

    /**
     * Clear an escalation (after an operator fixed the backend) and merge again.
     *
     * @throws IllegalStateException if the proposal is not escalated
     */
    public MergeOutcome retryEscalated(UUID proposalId) {
        proposalLedger.update(proposalId, ProposalStatus.APPROVED, p -> {
            if (!p.isEscalated()) {
                throw new IllegalStateException("Proposal " + proposalId + " is not escalated");
            }
            p.setEscalated(false);
            p.setFailureReason(null);
            p.addComment(ReviewComment.system("Merge retry requested after escalation."));
        });
        log.info("Escalation of proposal {} cleared, merging again", proposalId);
        return merge(proposalId);
    }

    // ------------------------------------------------------------------
    // Merge pipeline
    // ------------------------------------------------------------------

    private MergeOutcome mergeApproved(ChangeProposal proposal, boolean waitForSlot) {
        UUID id = proposal.getId();

        Set<String> paths;
        try {
            paths = retryPolicy.execute("touched paths of " + id,
                    () -> tree.touchedPaths(proposal.getSourceBranch())).paths();
        } catch (TreeIOException e) {
            return escalate(id, ProposalStatus.APPROVED, e);
        }

        Optional<MergeSlot> acquired;
        if (!waitForSlot) {
            acquired = slots.tryAcquire(id, paths);
            if (acquired.isEmpty()) {
                return MergeOutcome.deferred(id, "merge slot busy");
            }
        } else {
            try {
                acquired = slots.acquire(id, paths, slotTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return MergeOutcome.deferred(id, "interrupted while waiting for a merge slot");
            }
            if (acquired.isEmpty()) {
                return MergeOutcome.deferred(id, "no merge slot within " + slotTimeout);
            }
        }

        MergeOutcome outcome;
        try (MergeSlot slot = acquired.get()) {
            try {
                proposalLedger.transition(id, ProposalStatus.APPROVED, ProposalStatus.MERGING);
            } catch (StaleStateException e) {
                log.info("Proposal {} changed before the merge started: {}", id, e.getMessage());
                return MergeOutcome.skipped(id, e.getMessage());
            }
            outcome = runMerge(proposal, slot);
        }

        if (outcome.kind() == MergeOutcome.Kind.MERGED) {
            syncBroadcaster.broadcast(outcome.revision(), proposal.getWorkspaceId());
        }
        return outcome;
    }

    private MergeOutcome runMerge(ChangeProposal proposal, MergeSlot slot) {
        UUID id = proposal.getId();
        String message = "Merge proposal " + id + ": " + proposal.getTitle()
                + "\n\nSource: " + proposal.getSourceBranch() + " (" + proposal.getAuthor() + ")\n";

        MergeResult result;
        try {
            result = retryPolicy.execute("merge " + id,
                    () -> tree.merge(proposal.getSourceBranch(), message));
        } catch (TreeIOException e) {
            return escalate(id, ProposalStatus.MERGING, e);
        }

        if (result.success()) {
            return completed(proposal, result);
        }
        return conflicted(proposal, result.conflictingPaths());
    }

    private MergeOutcome completed(ChangeProposal proposal, MergeResult result) {
        UUID id = proposal.getId();
        String revision = result.revision();
        finish(id, ProposalStatus.MERGED, p -> {
            p.setMergeRevision(revision);
            p.setMergeCommit(!result.upToDate());
            p.setConflictingPaths(List.of());
        });
        moveTask(proposal, TaskStatus.IN_REVIEW, TaskStatus.COMPLETED);
        try {
            tree.deleteBranch(proposal.getSourceBranch());
        } catch (TreeIOException e) {
            log.warn("Merged branch {} could not be deleted: {}", proposal.getSourceBranch(), e.getMessage());
        }
        log.info("Proposal {} merged into {} at {}", id, tree.trunkBranch(), revision);
        return MergeOutcome.merged(id, revision);
    }

    private MergeOutcome conflicted(ChangeProposal proposal, List<String> paths) {
        UUID id = proposal.getId();
        finish(id, ProposalStatus.OPEN, p -> {
            p.setConflictingPaths(paths);
            p.addComment(ReviewComment.system("Merge into " + tree.trunkBranch() + " conflicts on "
                    + String.join(", ", paths)
                    + ". Integrate the latest trunk into your branch and resubmit."));
        });
        moveTask(proposal, TaskStatus.IN_REVIEW, TaskStatus.ASSIGNED);
        log.info("Proposal {} conflicts on {}; returned to its author", id, paths);
        return MergeOutcome.conflict(id, paths);
    }

    private MergeOutcome escalate(UUID id, ProposalStatus from, TreeIOException cause) {
        String reason = cause.getMessage();
        log.error("Proposal {} escalated: merge kept failing after {} attempt(s)",
                id, retryPolicy.getMaxAttempts(), cause);
        Consumer<ChangeProposal> mark = p -> {
            p.setEscalated(true);
            p.setFailureReason(reason);
            p.addComment(ReviewComment.system("Merge failed after " + retryPolicy.getMaxAttempts()
                    + " attempt(s) and needs manual attention: " + reason));
        };
        if (from == ProposalStatus.MERGING) {
            finish(id, ProposalStatus.APPROVED, mark);
        } else {
            proposalLedger.update(id, ProposalStatus.APPROVED, mark);
        }
        return MergeOutcome.escalated(id, reason);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * MERGING → target. Only this coordinator moves a MERGING proposal, but a
     * reviewer comment can still bump its version, so re-read and retry.
     */
    private void finish(UUID id, ProposalStatus target, Consumer<ChangeProposal> mutation) {
        for (int attempt = 1; ; attempt++) {
            try {
                proposalLedger.transition(id, ProposalStatus.MERGING, target, mutation);
                return;
            } catch (StaleStateException e) {
                if (attempt >= MAX_VERSION_RETRIES
                        || proposalLedger.get(id).getStatus() != ProposalStatus.MERGING) {
                    throw e;
                }
                log.debug("Proposal {} written concurrently, retrying MERGING → {}", id, target);
            }
        }
    }

    private void moveTask(ChangeProposal proposal, TaskStatus from, TaskStatus to) {
        try {
            taskLedger.updateStatus(proposal.getTaskId(), from, to, proposal.getWorkspaceId());
        } catch (StaleStateException e) {
            log.warn("Task {} was not {} for '{}' when its proposal {} finished merging: {}",
                    proposal.getTaskId(), from, proposal.getWorkspaceId(), proposal.getId(), e.getMessage());
        }
    }
}
