package com.coderelay.engine.service;

import com.coderelay.engine.error.LeaseExpiredException;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.ledger.ProposalLedger;
import com.coderelay.engine.ledger.TaskLedger;
import com.coderelay.engine.model.Task;
import com.coderelay.engine.model.TaskStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Hands tasks to competing workers.
 *
 * Claiming is optimistic: read the open list, try OPEN → ASSIGNED on each
 * candidate with a CAS, and treat a StaleStateException as "someone else
 * won that one". Because only the CAS decides, two workers can never both
 * own a task, and a lost race always moves on to the next candidate.
 *
 * A task that goes back to OPEN takes its author's pending proposal with it
 * (ABANDONED), so whoever claims it next can submit afresh.
 */
@Service
public class ClaimCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ClaimCoordinator.class);

    private final TaskLedger      taskLedger;
    private final ProposalLedger  proposalLedger;
    private final SyncBroadcaster syncBroadcaster;
    private final MeterRegistry   meterRegistry;
    private final int             maxRounds;

    public ClaimCoordinator(TaskLedger taskLedger,
                            ProposalLedger proposalLedger,
                            SyncBroadcaster syncBroadcaster,
                            MeterRegistry meterRegistry,
                            @Value("${coderelay.claim.max-rounds:3}") int maxRounds) {
        this.taskLedger      = taskLedger;
        this.proposalLedger  = proposalLedger;
        this.syncBroadcaster = syncBroadcaster;
        this.meterRegistry   = meterRegistry;
        this.maxRounds       = maxRounds;
    }

    // ------------------------------------------------------------------
    // Claiming
    // ------------------------------------------------------------------

    /**
     * Give {@code workerId} a task to work on.
     *
     * Steps:
     *  1. Bring the worker's workspace up to the trunk head; a workspace
     *     that cannot be synchronized gets no task this time.
     *  2. If the worker still holds an ASSIGNED task, hand that back (resume).
     *  3. Otherwise walk the open list oldest-first, CAS-ing each entry,
     *     re-reading the list up to maxRounds times.
     *
     * @return the claimed task, or empty when nothing is claimable
     */
    public Optional<Task> claimNext(String workerId) {
        MDC.put("workerId", workerId);
        try {
            if (!syncBroadcaster.ensureCurrent(workerId)) {
                log.warn("Worker '{}' is not at the trunk head; no task handed out", workerId);
                return Optional.empty();
            }

            Optional<Task> resumed = resume(workerId);
            if (resumed.isPresent()) {
                return resumed;
            }

            for (int round = 1; round <= maxRounds; round++) {
                List<Task> open = taskLedger.listOpenTasks();
                if (open.isEmpty()) {
                    break;
                }
                for (Task candidate : open) {
                    try {
                        Task claimed = taskLedger.updateStatus(
                                candidate.getId(), TaskStatus.OPEN, TaskStatus.ASSIGNED, workerId);
                        count("won");
                        log.info("Worker '{}' claimed task {} ({})", workerId, claimed.getId(), claimed.getTitle());
                        return Optional.of(claimed);
                    } catch (StaleStateException e) {
                        count("lost");
                        log.debug("Worker '{}' lost the race for task {} (round {})",
                                workerId, candidate.getId(), round);
                    }
                }
            }
            log.debug("Nothing claimable for worker '{}'", workerId);
            return Optional.empty();
        } finally {
            MDC.remove("workerId");
        }
    }

    private Optional<Task> resume(String workerId) {
        for (Task held : taskLedger.findClaims(workerId)) {
            try {
                Task task = taskLedger.renewLease(held.getId(), workerId);
                count("resumed");
                log.info("Worker '{}' resumes task {}", workerId, task.getId());
                return Optional.of(task);
            } catch (LeaseExpiredException e) {
                log.debug("Claim on {} lapsed before it could be resumed", held.getId());
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Giving tasks back
    // ------------------------------------------------------------------

    /** The worker gives up its task; it goes back to OPEN. */
    public Task release(UUID taskId, String workerId) {
        Task task = taskLedger.updateStatus(taskId, TaskStatus.ASSIGNED, TaskStatus.OPEN, workerId);
        proposalLedger.abandonForTask(taskId, "task released by '" + workerId + "'");
        log.info("Worker '{}' released task {}", workerId, taskId);
        return task;
    }

    public Task renewLease(UUID taskId, String workerId) {
        return taskLedger.renewLease(taskId, workerId);
    }

    /**
     * Return every ASSIGNED task whose lease has passed to OPEN.
     * A worker that renews in the meantime keeps its task.
     *
     * @return the number of tasks reopened
     */
    public int reapExpiredLeases() {
        Instant now = Instant.now();
        int reopened = 0;
        for (Task task : taskLedger.findExpiredClaims(now)) {
            if (taskLedger.reopenExpired(task.getId(), task.getOwner(), now)) {
                proposalLedger.abandonForTask(task.getId(), "lease of '" + task.getOwner() + "' expired");
                reopened++;
            } else {
                log.debug("Task {} was renewed or released before it could be reaped", task.getId());
            }
        }
        return reopened;
    }

    private void count(String outcome) {
        meterRegistry.counter("coderelay.claim.attempts", "outcome", outcome).increment();
    }
}
