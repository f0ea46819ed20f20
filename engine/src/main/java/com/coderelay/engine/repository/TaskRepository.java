package com.coderelay.engine.repository;

import com.coderelay.engine.model.Task;
import com.coderelay.engine.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Storage for the tasks table.
 *
 * Status changes are single conditional UPDATE statements: the row only
 * changes if it still holds the status (and owner) the caller read. The
 * return value is the number of rows touched, so 0 means another writer got
 * there first. No lock is held between the caller's read and this write.
 *
 * Only TaskLedger should call the modifying queries.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /** Open tasks, oldest first, the order workers try to claim them in. */
    List<Task> findByStatusOrderByCreatedAtAsc(TaskStatus status);

    /** Tasks a worker currently holds in the given status. */
    List<Task> findByOwnerAndStatusOrderByCreatedAtAsc(String owner, TaskStatus status);

    /** ASSIGNED tasks whose lease has run out before 'cutoff'. */
    List<Task> findByStatusAndLeaseExpiresAtBefore(TaskStatus status, Instant cutoff);

    long countByStatus(TaskStatus status);

    /**
     * CAS for transitions out of an unowned state (OPEN → ASSIGNED).
     * Matches only if the row is still in 'expected' and has no owner.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.status = :target,
                   t.owner = :newOwner,
                   t.leaseExpiresAt = :leaseExpiresAt,
                   t.completedAt = :completedAt,
                   t.updatedAt = :now,
                   t.version = t.version + 1
             WHERE t.id = :id
               AND t.status = :expected
               AND t.owner IS NULL
            """)
    int compareAndSetUnowned(@Param("id") UUID id,
                             @Param("expected") TaskStatus expected,
                             @Param("target") TaskStatus target,
                             @Param("newOwner") String newOwner,
                             @Param("leaseExpiresAt") Instant leaseExpiresAt,
                             @Param("completedAt") Instant completedAt,
                             @Param("now") Instant now);

    /**
     * CAS for transitions made by the current owner (ASSIGNED → IN_REVIEW,
     * IN_REVIEW → COMPLETED, ASSIGNED → OPEN, ...).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.status = :target,
                   t.owner = :newOwner,
                   t.leaseExpiresAt = :leaseExpiresAt,
                   t.completedAt = :completedAt,
                   t.updatedAt = :now,
                   t.version = t.version + 1
             WHERE t.id = :id
               AND t.status = :expected
               AND t.owner = :expectedOwner
            """)
    int compareAndSetOwned(@Param("id") UUID id,
                           @Param("expected") TaskStatus expected,
                           @Param("expectedOwner") String expectedOwner,
                           @Param("target") TaskStatus target,
                           @Param("newOwner") String newOwner,
                           @Param("leaseExpiresAt") Instant leaseExpiresAt,
                           @Param("completedAt") Instant completedAt,
                           @Param("now") Instant now);

    /** Push the lease forward; 0 rows means the claim is gone. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.leaseExpiresAt = :leaseExpiresAt,
                   t.updatedAt = :now,
                   t.version = t.version + 1
             WHERE t.id = :id
               AND t.status = com.coderelay.engine.model.TaskStatus.ASSIGNED
               AND t.owner = :owner
            """)
    int renewLease(@Param("id") UUID id,
                   @Param("owner") String owner,
                   @Param("leaseExpiresAt") Instant leaseExpiresAt,
                   @Param("now") Instant now);

    /**
     * Return an ASSIGNED task to OPEN, but only if the lease is still past
     * 'now'. A renewal that lands first moves the lease and makes this a no-op.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Task t
               SET t.status = com.coderelay.engine.model.TaskStatus.OPEN,
                   t.owner = NULL,
                   t.leaseExpiresAt = NULL,
                   t.updatedAt = :now,
                   t.version = t.version + 1
             WHERE t.id = :id
               AND t.status = com.coderelay.engine.model.TaskStatus.ASSIGNED
               AND t.owner = :owner
               AND t.leaseExpiresAt < :now
            """)
    int reopenExpired(@Param("id") UUID id,
                      @Param("owner") String owner,
                      @Param("now") Instant now);
}
