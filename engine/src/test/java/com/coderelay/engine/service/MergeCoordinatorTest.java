package com.coderelay.engine.service;

import com.coderelay.engine.TestEntities;
import com.coderelay.engine.config.RetryPolicy;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.ReviewComment;
import com.coderelay.engine.model.TaskStatus;
import com.coderelay.engine.tree.MergeResult;
import com.coderelay.engine.tree.PatchSet;
import com.coderelay.engine.tree.TreeIOException;
import com.coderelay.engine.tree.VersionedTree;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeCoordinatorTest {

    @Mock TaskLedger      taskLedger;
    @Mock VersionedTree   tree;
    @Mock SyncBroadcaster syncBroadcaster;

    InMemoryProposalLedger proposals;
    MergeSlotRegistry      slots;
    SimpleMeterRegistry    meterRegistry;
    MergeCoordinator       coordinator;

    UUID           taskId;
    ChangeProposal proposal;

    @BeforeEach
    void setUp() {
        proposals     = new InMemoryProposalLedger();
        slots         = new MergeSlotRegistry();
        meterRegistry = new SimpleMeterRegistry();
        RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ofMillis(1), 2.0, d -> { });
        coordinator = new MergeCoordinator(proposals, taskLedger, tree, slots, retryPolicy,
                syncBroadcaster, meterRegistry, Duration.ofSeconds(1));

        taskId   = UUID.randomUUID();
        proposal = proposals.put(TestEntities.proposal(taskId, "worker-a", ProposalStatus.APPROVED));
        lenient().when(tree.trunkBranch()).thenReturn("main");
    }

    @Test
    void merge_clean_marksMergedCompletesTaskAndBroadcasts() {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        when(tree.merge(anyString(), anyString())).thenReturn(MergeResult.merged("abc123"));

        MergeOutcome outcome = coordinator.merge(proposal.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(outcome.revision()).isEqualTo("abc123");
        ChangeProposal stored = proposals.get(proposal.getId());
        assertThat(stored.getStatus()).isEqualTo(ProposalStatus.MERGED);
        assertThat(stored.getMergeRevision()).isEqualTo("abc123");
        assertThat(stored.isMergeCommit()).isTrue();
        verify(taskLedger).updateStatus(taskId, TaskStatus.IN_REVIEW, TaskStatus.COMPLETED, "worker-a");
        verify(tree).deleteBranch(proposal.getSourceBranch());
        verify(syncBroadcaster).broadcast("abc123", "worker-a");
        assertThat(slots.activeSlots()).isEmpty();
        assertThat(meterRegistry.counter("coderelay.merge.outcomes", "outcome", "merged").count()).isEqualTo(1.0);
    }

    @Test
    void merge_conflict_returnsProposalToAuthorWithPaths() {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        when(tree.merge(anyString(), anyString())).thenReturn(MergeResult.conflicted(List.of("foo.py")));

        MergeOutcome outcome = coordinator.merge(proposal.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.CONFLICT);
        assertThat(outcome.conflictingPaths()).containsExactly("foo.py");
        ChangeProposal stored = proposals.get(proposal.getId());
        assertThat(stored.getStatus()).isEqualTo(ProposalStatus.OPEN);
        assertThat(stored.getMergeRevision()).isNull();
        assertThat(stored.getConflictingPaths()).containsExactly("foo.py");
        assertThat(stored.getComments()).extracting(ReviewComment::getVerdict)
                .containsExactly(ReviewComment.Verdict.SYSTEM);
        assertThat(stored.getComments().get(0).getBody()).contains("foo.py");
        verify(taskLedger).updateStatus(taskId, TaskStatus.IN_REVIEW, TaskStatus.ASSIGNED, "worker-a");
        verify(tree, never()).deleteBranch(anyString());
        verifyNoInteractions(syncBroadcaster);
        assertThat(slots.activeSlots()).isEmpty();
    }

    @Test
    void merge_backendKeepsFailing_escalatesAfterRetryBudget() {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        when(tree.merge(anyString(), anyString())).thenThrow(new TreeIOException("disk full"));

        MergeOutcome outcome = coordinator.merge(proposal.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.ESCALATED);
        verify(tree, times(3)).merge(anyString(), anyString());
        ChangeProposal stored = proposals.get(proposal.getId());
        assertThat(stored.getStatus()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(stored.isEscalated()).isTrue();
        assertThat(stored.getFailureReason()).isEqualTo("disk full");
        verify(taskLedger, never()).updateStatus(any(), any(), any(), anyString());
        assertThat(slots.activeSlots()).isEmpty();
    }

    @Test
    void merge_transientFailure_isRetriedAndSucceeds() {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        when(tree.merge(anyString(), anyString()))
                .thenThrow(new TreeIOException("lock held"))
                .thenReturn(MergeResult.merged("def456"));

        MergeOutcome outcome = coordinator.merge(proposal.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(proposals.get(proposal.getId()).isEscalated()).isFalse();
    }

    @Test
    void merge_cannotReadTouchedPaths_escalatesWithoutTakingSlot() {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenThrow(new TreeIOException("no such ref"));

        MergeOutcome outcome = coordinator.merge(proposal.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.ESCALATED);
        assertThat(proposals.get(proposal.getId()).getStatus()).isEqualTo(ProposalStatus.APPROVED);
        verify(tree, never()).merge(anyString(), anyString());
    }

    @Test
    void merge_notApproved_isSkipped() {
        ChangeProposal open = proposals.put(TestEntities.proposal(UUID.randomUUID(), "worker-b", ProposalStatus.OPEN));

        MergeOutcome outcome = coordinator.merge(open.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.SKIPPED);
        verifyNoInteractions(taskLedger, syncBroadcaster);
        verify(tree, never()).merge(anyString(), anyString());
    }

    @Test
    void merge_escalated_isSkippedUntilRetried() {
        proposal.setEscalated(true);
        proposal.setFailureReason("disk full");

        assertThat(coordinator.merge(proposal.getId()).kind()).isEqualTo(MergeOutcome.Kind.SKIPPED);

        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        when(tree.merge(anyString(), anyString())).thenReturn(MergeResult.merged("abc123"));

        MergeOutcome retried = coordinator.retryEscalated(proposal.getId());

        assertThat(retried.kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(proposals.get(proposal.getId()).isEscalated()).isFalse();
    }

    @Test
    void retryEscalated_whenNotEscalated_isRejected() {
        assertThatThrownBy(() -> coordinator.retryEscalated(proposal.getId()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void merge_overlappingSlotHeldElsewhere_isDeferred() throws Exception {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        coordinator = new MergeCoordinator(proposals, taskLedger, tree, slots,
                new RetryPolicy(1, Duration.ZERO, 1.0), syncBroadcaster, meterRegistry, Duration.ofMillis(50));

        try (MergeSlot held = slots.acquire(UUID.randomUUID(), Set.of("foo.py"), Duration.ofSeconds(1)).orElseThrow()) {
            MergeOutcome outcome = coordinator.merge(proposal.getId());

            assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.DEFERRED);
            assertThat(proposals.get(proposal.getId()).getStatus()).isEqualTo(ProposalStatus.APPROVED);
        }
        verify(tree, never()).merge(anyString(), anyString());
    }

    @Test
    void mergeIfFree_overlappingSlotHeld_defersWithoutWaiting() throws Exception {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py", "bar.py"));

        try (MergeSlot held = slots.acquire(UUID.randomUUID(), Set.of("foo.py"), Duration.ofSeconds(1)).orElseThrow()) {
            MergeOutcome outcome = coordinator.mergeIfFree(proposal.getId());

            assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.DEFERRED);
            assertThat(proposals.get(proposal.getId()).getStatus()).isEqualTo(ProposalStatus.APPROVED);
            assertThat(slots.activeSlots()).extracting(MergeSlot::getProposalId).containsExactly(held.getProposalId());
            assertThat(slots.waitingCount()).isZero();
        }
        verify(tree, never()).merge(anyString(), anyString());
    }

    @Test
    void mergeIfFree_disjointSlotHeld_mergesAtOnce() throws Exception {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("bar.py"));
        when(tree.merge(anyString(), anyString())).thenReturn(MergeResult.merged("abc123"));

        try (MergeSlot held = slots.acquire(UUID.randomUUID(), Set.of("foo.py"), Duration.ofSeconds(1)).orElseThrow()) {
            assertThat(coordinator.mergeIfFree(proposal.getId()).kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        }
    }

    @Test
    void merge_branchAlreadyInTrunk_recordsMergeWithoutMergeCommit() {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        when(tree.merge(anyString(), anyString())).thenReturn(MergeResult.upToDate("t9"));

        MergeOutcome outcome = coordinator.merge(proposal.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        ChangeProposal stored = proposals.get(proposal.getId());
        assertThat(stored.getMergeRevision()).isEqualTo("t9");
        assertThat(stored.isMergeCommit()).isFalse();
    }

    @Test
    void merge_taskMovedUnderneath_stillRecordsMerge() {
        when(tree.touchedPaths(proposal.getSourceBranch())).thenReturn(patch("foo.py"));
        when(tree.merge(anyString(), anyString())).thenReturn(MergeResult.merged("abc123"));
        when(taskLedger.updateStatus(taskId, TaskStatus.IN_REVIEW, TaskStatus.COMPLETED, "worker-a"))
                .thenThrow(new StaleStateException(taskId.toString(), "task moved"));

        MergeOutcome outcome = coordinator.merge(proposal.getId());

        assertThat(outcome.kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(proposals.get(proposal.getId()).getStatus()).isEqualTo(ProposalStatus.MERGED);
    }

    private static PatchSet patch(String... paths) {
        return new PatchSet("base", "head", Arrays.stream(paths)
                .map(p -> new PatchSet.FileChange(PatchSet.ChangeType.MODIFY, p, p))
                .toList());
    }
}
