package com.coderelay.engine.ledger;

import com.coderelay.engine.error.LeaseExpiredException;
import com.coderelay.engine.error.NotFoundException;
import com.coderelay.engine.error.StaleStateException;
import com.coderelay.engine.model.Task;
import com.coderelay.engine.model.TaskStatus;
import com.coderelay.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable store of tasks.
 *
 * Every status change is a single compare-and-swap UPDATE
 * ({@link TaskRepository#compareAndSetUnowned} / {@link TaskRepository#compareAndSetOwned}).
 * Nothing here holds a lock across read-decide-write: a caller reads, decides,
 * and the CAS either applies or throws {@link StaleStateException}.
 *
 * CAS methods are marked noRollbackFor StaleStateException so a caller that
 * catches the lost race inside its own transaction can carry on.
 */
@Service
public class TaskLedger {

    private static final Logger log = LoggerFactory.getLogger(TaskLedger.class);

    private final TaskRepository taskRepo;
    private final Duration       lease;

    public TaskLedger(TaskRepository taskRepo,
                      @Value("${coderelay.claim.lease:30m}") Duration lease) {
        this.taskRepo = taskRepo;
        this.lease    = lease;
    }

    public Duration getLease() {
        return lease;
    }

    // ------------------------------------------------------------------
    // Creation and reads
    // ------------------------------------------------------------------

    @Transactional
    public Task createTask(String title, String description, Map<String, String> metadata) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        Task task = new Task(title, description);
        if (metadata != null) {
            task.setMetadata(metadata);
        }
        task = taskRepo.save(task);
        log.info("Task {} created: {}", task.getId(), title);
        return task;
    }

    /** Snapshot of OPEN tasks, oldest first. May be stale by the time it is used. */
    @Transactional(readOnly = true)
    public List<Task> listOpenTasks() {
        return taskRepo.findByStatusOrderByCreatedAtAsc(TaskStatus.OPEN);
    }

    @Transactional(readOnly = true)
    public List<Task> listByStatus(TaskStatus status) {
        return taskRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional(readOnly = true)
    public Task getTask(UUID id) {
        return taskRepo.findById(id).orElseThrow(() -> new NotFoundException("Task", id));
    }

    /** Tasks {@code owner} currently holds in ASSIGNED, oldest first. */
    @Transactional(readOnly = true)
    public List<Task> findClaims(String owner) {
        return taskRepo.findByOwnerAndStatusOrderByCreatedAtAsc(owner, TaskStatus.ASSIGNED);
    }

    @Transactional(readOnly = true)
    public List<Task> findExpiredClaims(Instant now) {
        return taskRepo.findByStatusAndLeaseExpiresAtBefore(TaskStatus.ASSIGNED, now);
    }

    @Transactional(readOnly = true)
    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, taskRepo.countByStatus(status));
        }
        return counts;
    }

    // ------------------------------------------------------------------
    // Compare-and-swap
    // ------------------------------------------------------------------

    /**
     * Move a task from {@code expectedStatus} to {@code newStatus}.
     *
     * The owner is implied by the transition: leaving OPEN the row must have
     * no owner, otherwise it must be held by {@code owner}; entering OPEN
     * clears the owner, otherwise {@code owner} keeps/takes the claim.
     *
     * @throws StaleStateException if the row no longer matches
     * @throws NotFoundException   if the task does not exist
     */
    @Transactional(noRollbackFor = StaleStateException.class)
    public Task updateStatus(UUID id, TaskStatus expectedStatus, TaskStatus newStatus, String owner) {
        String expectedOwner = expectedStatus == TaskStatus.OPEN ? null : owner;
        String newOwner      = newStatus == TaskStatus.OPEN ? null : owner;
        return updateStatus(id, expectedStatus, expectedOwner, newStatus, newOwner);
    }

    /**
     * Explicit form of {@link #updateStatus(UUID, TaskStatus, TaskStatus, String)}
     * for transitions where expected and new owner differ (e.g. the reaper
     * returning another worker's task to OPEN).
     */
    @Transactional(noRollbackFor = StaleStateException.class)
    public Task updateStatus(UUID id,
                             TaskStatus expectedStatus, String expectedOwner,
                             TaskStatus newStatus, String newOwner) {
        if ((newStatus == TaskStatus.OPEN) != (newOwner == null)) {
            throw new IllegalArgumentException(
                    "A task has an owner exactly when it is not OPEN (status=" + newStatus + ", owner=" + newOwner + ")");
        }
        if ((expectedStatus == TaskStatus.OPEN) != (expectedOwner == null)) {
            throw new IllegalArgumentException(
                    "Expected owner must be null exactly when expecting OPEN (status=" + expectedStatus + ")");
        }

        Instant now         = Instant.now();
        Instant leaseUntil  = newStatus == TaskStatus.ASSIGNED ? now.plus(lease) : null;
        Instant completedAt = newStatus == TaskStatus.COMPLETED ? now : null;

        int rows = expectedOwner == null
                ? taskRepo.compareAndSetUnowned(id, expectedStatus, newStatus, newOwner, leaseUntil, completedAt, now)
                : taskRepo.compareAndSetOwned(id, expectedStatus, expectedOwner, newStatus, newOwner,
                        leaseUntil, completedAt, now);

        if (rows == 0) {
            if (!taskRepo.existsById(id)) {
                throw new NotFoundException("Task", id);
            }
            throw new StaleStateException(id.toString(),
                    "Task " + id + " is no longer " + expectedStatus
                            + (expectedOwner == null ? "" : " held by '" + expectedOwner + "'"));
        }
        log.debug("Task {} {} → {} (owner={})", id, expectedStatus, newStatus, newOwner);
        return getTask(id);
    }

    /**
     * Extend {@code owner}'s lease on an ASSIGNED task.
     *
     * @throws LeaseExpiredException if the worker no longer holds the task
     */
    @Transactional(noRollbackFor = LeaseExpiredException.class)
    public Task renewLease(UUID id, String owner) {
        Instant now = Instant.now();
        if (taskRepo.renewLease(id, owner, now.plus(lease), now) == 0) {
            if (!taskRepo.existsById(id)) {
                throw new NotFoundException("Task", id);
            }
            throw new LeaseExpiredException(id, owner);
        }
        return getTask(id);
    }

    /**
     * Return {@code owner}'s task to OPEN if its lease has passed at {@code now}.
     *
     * @return false if the owner renewed (or released) first
     */
    @Transactional
    public boolean reopenExpired(UUID id, String owner, Instant now) {
        boolean reopened = taskRepo.reopenExpired(id, owner, now) == 1;
        if (reopened) {
            log.info("Task {} lease held by '{}' expired, task is OPEN again", id, owner);
        }
        return reopened;
    }
}
