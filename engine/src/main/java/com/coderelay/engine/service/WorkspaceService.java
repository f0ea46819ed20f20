package com.coderelay.engine.service;

import com.coderelay.engine.config.RetryPolicy;
import com.coderelay.engine.error.NotFoundException;
import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.Workspace;
import com.coderelay.engine.model.WorkspaceState;
import com.coderelay.engine.repository.WorkspaceRepository;
import com.coderelay.engine.tree.MergeResult;
import com.coderelay.engine.tree.TreeConflictException;
import com.coderelay.engine.tree.TreeIOException;
import com.coderelay.engine.tree.VersionedTree;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Lifecycle of worker workspaces (clones of trunk) and every git operation
 * that runs inside one.
 *
 * A workspace is never touched by two engine threads at once: all work on a
 * clone happens under that workspace's ReentrantLock, so a broadcast sync
 * cannot interleave with the owner's commit or trunk integration.
 */
@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    // Worker ids end up in directory and branch names.
    private static final Pattern WORKER_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");

    private final WorkspaceRepository workspaceRepo;
    private final VersionedTree       tree;
    private final TaskLedger          taskLedger;
    private final RetryPolicy         retryPolicy;
    private final MeterRegistry       meterRegistry;
    private final Path                workspacesDir;

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public WorkspaceService(WorkspaceRepository workspaceRepo,
                            VersionedTree tree,
                            TaskLedger taskLedger,
                            RetryPolicy retryPolicy,
                            MeterRegistry meterRegistry,
                            @Value("${coderelay.tree.root}") String treeRoot) {
        this.workspaceRepo = workspaceRepo;
        this.tree          = tree;
        this.taskLedger    = taskLedger;
        this.retryPolicy   = retryPolicy;
        this.meterRegistry = meterRegistry;
        this.workspacesDir = Path.of(treeRoot).toAbsolutePath().resolve("workspaces");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Register a worker: clone trunk into its workspace directory.
     * Registering an existing worker returns its workspace unchanged.
     */
    public Workspace register(String workerId) {
        if (workerId == null || !WORKER_ID.matcher(workerId).matches()) {
            throw new IllegalArgumentException("Invalid worker id: " + workerId);
        }
        return withLock(workerId, () -> {
            Workspace existing = workspaceRepo.findById(workerId).orElse(null);
            if (existing != null) {
                return existing;
            }
            Path root = workspacesDir.resolve(workerId);
            tree.deleteWorkspace(root);   // leftovers from an unregistered run
            String revision = retryPolicy.execute("clone for " + workerId,
                    () -> tree.cloneWorkspace(root, workerId));
            Workspace workspace = new Workspace(workerId, root.toString());
            workspace.markSynced(revision);
            log.info("Workspace '{}' registered at {} ({})", workerId, root, revision);
            return workspaceRepo.save(workspace);
        });
    }

    /** Tear the clone down and clone trunk again (worker restart). */
    public Workspace recreate(String workerId) {
        return withLock(workerId, () -> {
            Workspace workspace = get(workerId);
            Path root = rootOf(workspace);
            tree.deleteWorkspace(root);
            String revision = retryPolicy.execute("re-clone for " + workerId,
                    () -> tree.cloneWorkspace(root, workerId));
            workspace.markSynced(revision);
            log.info("Workspace '{}' recreated at {}", workerId, revision);
            return workspaceRepo.save(workspace);
        });
    }

    public void remove(String workerId) {
        withLock(workerId, () -> {
            Workspace workspace = get(workerId);
            tree.deleteWorkspace(rootOf(workspace));
            workspaceRepo.delete(workspace);
            log.info("Workspace '{}' removed", workerId);
            return null;
        });
        locks.remove(workerId);
    }

    public Workspace get(String workerId) {
        return workspaceRepo.findById(workerId).orElseThrow(() -> new NotFoundException("Workspace", workerId));
    }

    public List<Workspace> listAll() {
        return workspaceRepo.findAllByOrderByIdAsc();
    }

    /** Feature branch a worker uses for a task: feature/&lt;task-id prefix&gt;-&lt;worker&gt;. */
    public static String branchFor(UUID taskId, String workerId) {
        return "feature/" + taskId.toString().substring(0, 8) + "-" + workerId;
    }

    // ------------------------------------------------------------------
    // Work inside a workspace
    // ------------------------------------------------------------------

    /**
     * Create (or switch back to) the task's feature branch, starting from the
     * workspace's trunk branch. Renews the claim lease.
     *
     * @return the branch name
     */
    public String startTask(String workerId, UUID taskId) {
        taskLedger.renewLease(taskId, workerId);
        Workspace workspace = get(workerId);
        String branch = branchFor(taskId, workerId);
        withLock(workerId, () -> retryPolicy.execute("create " + branch,
                () -> tree.createBranch(rootOf(workspace), branch, tree.trunkBranch())));
        log.info("Workspace '{}' on {} for task {}", workerId, branch, taskId);
        return branch;
    }

    /**
     * Commit changes for a task on the worker's feature branch.
     * Also renews the worker's claim lease, so a worker that keeps
     * committing never loses its task.
     */
    public String commit(String workerId, UUID taskId, Map<String, String> changes, String message) {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("Nothing to commit");
        }
        taskLedger.renewLease(taskId, workerId);
        Workspace workspace = get(workerId);
        String branch = branchFor(taskId, workerId);
        return withLock(workerId, () -> retryPolicy.execute("commit on " + branch,
                () -> tree.commit(rootOf(workspace), branch, changes, message)));
    }

    /** Push the task branch to trunk; returns the published tip. */
    public String publish(String workerId, UUID taskId) {
        Workspace workspace = get(workerId);
        String branch = branchFor(taskId, workerId);
        return withLock(workerId, () -> retryPolicy.execute("publish " + branch,
                () -> tree.publish(rootOf(workspace), branch)));
    }

    /**
     * Merge the latest trunk into the task branch, taking the worker's
     * content for conflicting paths. Used to fix up a conflicted proposal
     * before resubmitting it.
     */
    public MergeResult integrateTrunk(String workerId, UUID taskId, Map<String, String> resolutions) {
        taskLedger.renewLease(taskId, workerId);
        Workspace workspace = get(workerId);
        String branch = branchFor(taskId, workerId);
        MergeResult result = withLock(workerId, () -> retryPolicy.execute("integrate trunk into " + branch,
                () -> tree.integrateTrunk(rootOf(workspace), branch,
                        resolutions == null ? Map.of() : resolutions)));
        if (!result.success()) {
            log.info("Workspace '{}': integrating trunk into {} still conflicts on {}",
                    workerId, branch, result.conflictingPaths());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Synchronization
    // ------------------------------------------------------------------

    /**
     * Fast-forward the workspace's trunk branch to the current trunk head.
     * Idempotent: calling again at the same head is a NOOP.
     */
    public SyncOutcome synchronize(String workerId) {
        MDC.put("workerId", workerId);
        try {
            SyncOutcome outcome = withLock(workerId, () -> doSynchronize(get(workerId)));
            meterRegistry.counter("coderelay.sync.outcomes", "outcome", outcome.name().toLowerCase()).increment();
            return outcome;
        } finally {
            MDC.remove("workerId");
        }
    }

    private SyncOutcome doSynchronize(Workspace workspace) {
        String head;
        try {
            head = retryPolicy.execute("read trunk head", tree::trunkHead);
        } catch (TreeIOException e) {
            log.error("Cannot read trunk head to sync '{}'", workspace.getId(), e);
            return SyncOutcome.FAILED;
        }
        if (head.equals(workspace.getSyncedRevision()) && workspace.getState() == WorkspaceState.ACTIVE) {
            return SyncOutcome.NOOP;
        }
        try {
            String revision = retryPolicy.execute("fast-forward " + workspace.getId(),
                    () -> tree.fastForward(rootOf(workspace), head));
            workspace.markSynced(revision);
            workspaceRepo.save(workspace);
            log.info("Workspace '{}' synchronized to {}", workspace.getId(), revision);
            return SyncOutcome.SYNCED;
        } catch (TreeConflictException e) {
            workspace.setState(WorkspaceState.DIVERGED);
            workspaceRepo.save(workspace);
            log.warn("Workspace '{}' diverged from trunk on {}; recreate it or fix its {} branch",
                    workspace.getId(), e.getConflictingPaths(), tree.trunkBranch());
            return SyncOutcome.DIVERGED;
        } catch (TreeIOException e) {
            log.error("Workspace '{}' could not be synchronized to {}", workspace.getId(), head, e);
            return SyncOutcome.FAILED;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path rootOf(Workspace workspace) {
        return Path.of(workspace.getRootPath());
    }

    private <T> T withLock(String workerId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(workerId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
