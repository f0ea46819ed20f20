package com.coderelay.engine;

import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ProposalStatus;
import com.coderelay.engine.model.ReviewComment;
import com.coderelay.engine.model.Task;
import com.coderelay.engine.model.TaskStatus;
import com.coderelay.engine.service.ClaimCoordinator;
import com.coderelay.engine.service.MergeCoordinator;
import com.coderelay.engine.service.MergeOutcome;
import com.coderelay.engine.service.ProgressReport;
import com.coderelay.engine.service.ProposalService;
import com.coderelay.engine.service.ReportService;
import com.coderelay.engine.service.SyncOutcome;
import com.coderelay.engine.service.WorkspaceService;
import com.coderelay.engine.tree.MergeResult;
import com.coderelay.engine.tree.VersionedTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end runs against a real bare trunk and real workspace clones:
 * workers claim tasks, commit, submit, get reviewed and merged, and a
 * conflicting change is integrated and resubmitted.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class CollaborationScenarioTest {

    @TempDir
    static Path treeRoot;

    @DynamicPropertySource
    static void treeProperties(DynamicPropertyRegistry registry) {
        registry.add("coderelay.tree.root", () -> treeRoot.toString());
    }

    @Autowired TaskLedger       taskLedger;
    @Autowired ClaimCoordinator claimCoordinator;
    @Autowired WorkspaceService workspaceService;
    @Autowired ProposalService  proposalService;
    @Autowired MergeCoordinator mergeCoordinator;
    @Autowired ReportService    reportService;
    @Autowired VersionedTree    tree;

    @Test
    void conflictingEditsOnSameLine_secondIsReturnedIntegratedAndMerged() throws Exception {
        workspaceService.register("worker-a");
        workspaceService.register("worker-b");
        workspaceService.register("worker-c");

        // Seed trunk with foo.py through the normal workflow.
        taskLedger.createTask("Seed foo.py", null, Map.of());
        Task seed = claimCoordinator.claimNext("worker-c").orElseThrow();
        workspaceService.commit("worker-c", seed.getId(), Map.of("foo.py", "print('hello')\n"), "Add foo.py");
        ChangeProposal seeded = proposalService.submit("worker-c", seed.getId(), null, null);
        proposalService.approve(seeded.getId(), "reviewer", null);
        assertThat(mergeCoordinator.merge(seeded.getId()).kind()).isEqualTo(MergeOutcome.Kind.MERGED);

        Task t1 = taskLedger.createTask("Greet from A", null, Map.of());
        Task t2 = taskLedger.createTask("Unrelated work", null, Map.of());
        Task t3 = taskLedger.createTask("Greet from C", null, Map.of());

        assertThat(claimCoordinator.claimNext("worker-a")).map(Task::getId).contains(t1.getId());
        assertThat(claimCoordinator.claimNext("worker-b")).map(Task::getId).contains(t2.getId());
        assertThat(claimCoordinator.claimNext("worker-c")).map(Task::getId).contains(t3.getId());

        assertThat(workspaceService.startTask("worker-a", t1.getId()))
                .isEqualTo(WorkspaceService.branchFor(t1.getId(), "worker-a"));
        workspaceService.commit("worker-a", t1.getId(), Map.of("foo.py", "print('hello from A')\n"), "A greets");
        workspaceService.commit("worker-c", t3.getId(), Map.of("foo.py", "print('hello from C')\n"), "C greets");
        ChangeProposal p1 = proposalService.submit("worker-a", t1.getId(), null, null);
        ChangeProposal p2 = proposalService.submit("worker-c", t3.getId(), null, null);
        assertThat(taskLedger.getTask(t1.getId()).getStatus()).isEqualTo(TaskStatus.IN_REVIEW);

        proposalService.approve(p2.getId(), "reviewer", "ok");
        proposalService.approve(p1.getId(), "reviewer", "ok");

        // First merge lands.
        MergeOutcome first = mergeCoordinator.merge(p1.getId());
        assertThat(first.kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(tree.trunkHead()).isEqualTo(first.revision());
        assertThat(proposalService.get(p1.getId()).getStatus()).isEqualTo(ProposalStatus.MERGED);
        assertThat(taskLedger.getTask(t1.getId()).getStatus()).isEqualTo(TaskStatus.COMPLETED);

        // Second touches the same line: back to its author, trunk untouched.
        MergeOutcome second = mergeCoordinator.merge(p2.getId());
        assertThat(second.kind()).isEqualTo(MergeOutcome.Kind.CONFLICT);
        assertThat(second.conflictingPaths()).containsExactly("foo.py");
        assertThat(tree.trunkHead()).isEqualTo(first.revision());
        ChangeProposal conflicted = proposalService.get(p2.getId());
        assertThat(conflicted.getStatus()).isEqualTo(ProposalStatus.OPEN);
        assertThat(conflicted.getConflictingPaths()).containsExactly("foo.py");
        assertThat(conflicted.getComments()).extracting(ReviewComment::getVerdict).contains(ReviewComment.Verdict.SYSTEM);
        Task t3AfterConflict = taskLedger.getTask(t3.getId());
        assertThat(t3AfterConflict.getStatus()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(t3AfterConflict.getOwner()).isEqualTo("worker-c");

        // Bystander B catches up with trunk; syncing again changes nothing.
        assertThat(workspaceService.synchronize("worker-b").isCurrent()).isTrue();
        assertThat(workspaceService.get("worker-b").getSyncedRevision()).isEqualTo(tree.trunkHead());
        assertThat(workspaceService.synchronize("worker-b")).isEqualTo(SyncOutcome.NOOP);

        // C integrates trunk: first without a resolution, then with one.
        MergeResult unresolved = workspaceService.integrateTrunk("worker-c", t3.getId(), Map.of());
        assertThat(unresolved.success()).isFalse();
        assertThat(unresolved.conflictingPaths()).containsExactly("foo.py");

        String resolved = "print('hello from A')\nprint('hello from C')\n";
        MergeResult integrated = workspaceService.integrateTrunk("worker-c", t3.getId(), Map.of("foo.py", resolved));
        assertThat(integrated.success()).isTrue();

        proposalService.resubmit(p2.getId(), "Kept both greetings");
        assertThat(proposalService.get(p2.getId()).getConflictingPaths()).isEmpty();
        proposalService.approve(p2.getId(), "reviewer", "ok now");
        MergeOutcome retried = mergeCoordinator.merge(p2.getId());
        assertThat(retried.kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(taskLedger.getTask(t3.getId()).getStatus()).isEqualTo(TaskStatus.COMPLETED);

        // A worker joining now sees both changes.
        workspaceService.register("worker-d");
        Path fooInD = Path.of(workspaceService.get("worker-d").getRootPath()).resolve("foo.py");
        assertThat(Files.readString(fooInD)).isEqualTo(resolved);

        ProgressReport report = reportService.report();
        assertThat(report.trunkHead()).isEqualTo(retried.revision());
        assertThat(report.tasks()).containsEntry(TaskStatus.COMPLETED, 3L).containsEntry(TaskStatus.ASSIGNED, 1L);
        assertThat(report.proposals()).containsEntry(ProposalStatus.MERGED, 3L);
        assertThat(report.escalatedProposals()).isEmpty();
    }

    @Test
    void concurrentMergesOfOverlappingProposals_exactlyOneLands() throws Exception {
        workspaceService.register("worker-e");
        workspaceService.register("worker-f");
        Task te = taskLedger.createTask("Config from E", null, Map.of());
        Task tf = taskLedger.createTask("Config from F", null, Map.of());
        assertThat(claimCoordinator.claimNext("worker-e")).map(Task::getId).contains(te.getId());
        assertThat(claimCoordinator.claimNext("worker-f")).map(Task::getId).contains(tf.getId());

        workspaceService.commit("worker-e", te.getId(), Map.of("shared.cfg", "mode=e\n"), "E config");
        workspaceService.commit("worker-f", tf.getId(), Map.of("shared.cfg", "mode=f\n"), "F config");
        ChangeProposal pe = proposalService.submit("worker-e", te.getId(), null, null);
        ChangeProposal pf = proposalService.submit("worker-f", tf.getId(), null, null);
        proposalService.approve(pe.getId(), "reviewer", null);
        proposalService.approve(pf.getId(), "reviewer", null);

        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<MergeOutcome>> merges = new ArrayList<>();
        for (ChangeProposal p : List.of(pe, pf)) {
            merges.add(CompletableFuture.supplyAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return mergeCoordinator.merge(p.getId());
            }));
        }
        start.countDown();

        List<MergeOutcome.Kind> kinds = new ArrayList<>();
        for (CompletableFuture<MergeOutcome> merge : merges) {
            kinds.add(merge.get(30, TimeUnit.SECONDS).kind());
        }

        assertThat(kinds).containsExactlyInAnyOrder(MergeOutcome.Kind.MERGED, MergeOutcome.Kind.CONFLICT);
        assertThat(proposalService.list(ProposalStatus.MERGED)).hasSize(1);
        assertThat(proposalService.list(ProposalStatus.OPEN)).hasSize(1);
    }

    @Test
    void rejectedTaskReleased_nextOwnerSubmitsAfreshAndMerges() {
        workspaceService.register("worker-g");
        workspaceService.register("worker-h");
        Task task = taskLedger.createTask("Write notes", null, Map.of());

        assertThat(claimCoordinator.claimNext("worker-g")).map(Task::getId).contains(task.getId());
        workspaceService.commit("worker-g", task.getId(), Map.of("notes.md", "draft\n"), "Notes draft");
        ChangeProposal first = proposalService.submit("worker-g", task.getId(), null, null);
        proposalService.reject(first.getId(), "reviewer", "needs more detail");
        claimCoordinator.release(task.getId(), "worker-g");

        assertThat(proposalService.get(first.getId()).getStatus()).isEqualTo(ProposalStatus.ABANDONED);

        assertThat(claimCoordinator.claimNext("worker-h")).map(Task::getId).contains(task.getId());
        workspaceService.startTask("worker-h", task.getId());
        workspaceService.commit("worker-h", task.getId(), Map.of("notes.md", "full notes\n"), "Notes");
        ChangeProposal second = proposalService.submit("worker-h", task.getId(), null, null);
        proposalService.approve(second.getId(), "reviewer", null);

        assertThat(mergeCoordinator.merge(second.getId()).kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(taskLedger.getTask(task.getId()).getStatus()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void conflictedTaskReleased_anotherWorkerFinishesIt() {
        workspaceService.register("worker-i");
        workspaceService.register("worker-j");
        Task ti = taskLedger.createTask("Limits from I", null, Map.of());
        Task tj = taskLedger.createTask("Limits from J", null, Map.of());
        assertThat(claimCoordinator.claimNext("worker-i")).map(Task::getId).contains(ti.getId());
        assertThat(claimCoordinator.claimNext("worker-j")).map(Task::getId).contains(tj.getId());

        workspaceService.commit("worker-i", ti.getId(), Map.of("limits.cfg", "max=10\n"), "I limits");
        workspaceService.commit("worker-j", tj.getId(), Map.of("limits.cfg", "max=20\n"), "J limits");
        ChangeProposal pi = proposalService.submit("worker-i", ti.getId(), null, null);
        ChangeProposal pj = proposalService.submit("worker-j", tj.getId(), null, null);
        proposalService.approve(pi.getId(), "reviewer", null);
        proposalService.approve(pj.getId(), "reviewer", null);
        assertThat(mergeCoordinator.merge(pi.getId()).kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(mergeCoordinator.merge(pj.getId()).kind()).isEqualTo(MergeOutcome.Kind.CONFLICT);

        claimCoordinator.release(tj.getId(), "worker-j");
        assertThat(proposalService.get(pj.getId()).getStatus()).isEqualTo(ProposalStatus.ABANDONED);

        assertThat(claimCoordinator.claimNext("worker-i")).map(Task::getId).contains(tj.getId());
        workspaceService.startTask("worker-i", tj.getId());
        workspaceService.commit("worker-i", tj.getId(), Map.of("limits.cfg", "max=20\n"), "Raise limit");
        ChangeProposal retake = proposalService.submit("worker-i", tj.getId(), null, null);
        proposalService.approve(retake.getId(), "reviewer", null);

        assertThat(mergeCoordinator.merge(retake.getId()).kind()).isEqualTo(MergeOutcome.Kind.MERGED);
        assertThat(taskLedger.getTask(tj.getId()).getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(reportService.report().proposals())
                .containsEntry(ProposalStatus.MERGED, 2L)
                .containsEntry(ProposalStatus.ABANDONED, 1L);
    }
}
