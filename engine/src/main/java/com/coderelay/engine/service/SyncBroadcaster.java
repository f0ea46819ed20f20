package com.coderelay.engine.service;

import com.coderelay.engine.model.Workspace;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Propagates a new trunk revision to every worker workspace.
 *
 * After a merge, each other workspace is fast-forwarded on a small fixed
 * pool; the merge never waits for it. A workspace that misses a broadcast
 * (down, diverged, backend error) is brought up to date by
 * {@link #ensureCurrent} before its worker is handed another task.
 */
@Component
public class SyncBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SyncBroadcaster.class);

    private final WorkspaceService workspaceService;
    private final ExecutorService  workers;

    public SyncBroadcaster(WorkspaceService workspaceService,
                           @Value("${coderelay.sync.workers:4}") int workerCount) {
        this.workspaceService = workspaceService;
        this.workers          = Executors.newFixedThreadPool(workerCount);
    }

    /**
     * Queue a synchronization of every workspace except {@code sourceWorkspaceId}.
     * The returned future completes when all of them have finished; callers
     * are free to ignore it.
     */
    public CompletableFuture<Void> broadcast(String newRevision, String sourceWorkspaceId) {
        List<CompletableFuture<SyncOutcome>> pending = new ArrayList<>();
        for (Workspace workspace : workspaceService.listAll()) {
            String id = workspace.getId();
            if (id.equals(sourceWorkspaceId)) {
                continue;
            }
            pending.add(CompletableFuture.supplyAsync(() -> syncQuietly(id), workers));
        }
        log.info("Broadcasting trunk {} to {} workspace(s)", newRevision, pending.size());
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    /** Synchronous sync; true if the workspace is at the trunk head afterwards. */
    public boolean ensureCurrent(String workspaceId) {
        return workspaceService.synchronize(workspaceId).isCurrent();
    }

    private SyncOutcome syncQuietly(String workspaceId) {
        try {
            return workspaceService.synchronize(workspaceId);
        } catch (RuntimeException e) {
            // Workspace removed mid-broadcast, or a bug; the next claim retries.
            log.error("Background sync of '{}' failed", workspaceId, e);
            return SyncOutcome.FAILED;
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }
}
