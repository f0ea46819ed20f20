package com.coderelay.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One unit of requested work (an "issue").
 *
 * Status and owner are only ever changed through the compare-and-swap
 * queries in TaskRepository; the entity itself exposes no status setter.
 * Completed tasks stay in the table for audit.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.OPEN;

    // Worker id of the current claim holder. Null exactly when status = OPEN.
    @Column(name = "owner")
    private String owner;

    // Set while ASSIGNED. The reaper returns the task to OPEN once this passes.
    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    // Bumped by every CAS update as well as by JPA on entity writes.
    @Version
    private long version;

    // Collaborator-specific fields (planner hints, labels, ...).
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_metadata", joinColumns = @JoinColumn(name = "task_id"))
    @MapKeyColumn(name = "meta_key")
    @Column(name = "meta_value", columnDefinition = "TEXT")
    private Map<String, String> metadata = new HashMap<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String title, String description) {
        this.title       = title;
        this.description = description;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID        getId()             { return id; }
    public String      getTitle()          { return title; }
    public String      getDescription()    { return description; }
    public TaskStatus  getStatus()         { return status; }
    public String      getOwner()          { return owner; }
    public Instant     getLeaseExpiresAt() { return leaseExpiresAt; }
    public Instant     getCreatedAt()      { return createdAt; }
    public Instant     getUpdatedAt()      { return updatedAt; }
    public Instant     getCompletedAt()    { return completedAt; }
    public long        getVersion()        { return version; }
    public Map<String, String> getMetadata() { return metadata; }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = new HashMap<>(metadata);
    }

    /** True if the claim lease has passed at {@code now}. */
    public boolean isLeaseExpired(Instant now) {
        return status == TaskStatus.ASSIGNED && leaseExpiresAt != null && leaseExpiresAt.isBefore(now);
    }
}
