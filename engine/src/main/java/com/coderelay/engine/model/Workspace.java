package com.coderelay.engine.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A worker's private clone of trunk. The id is the worker id, so a worker
 * owns exactly one workspace.
 *
 * syncedRevision only ever moves forward: WorkspaceService records a new
 * value only after a successful fast-forward to a descendant commit.
 *
 * DB table: workspaces  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workspaces")
public class Workspace {

    @Id
    @Column(length = 128)
    private String id;

    @Column(name = "root_path", nullable = false, length = 1024)
    private String rootPath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkspaceState state = WorkspaceState.ACTIVE;

    @Column(name = "synced_revision", length = 64)
    private String syncedRevision;

    @Column(name = "synced_at")
    private Instant syncedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Version
    private long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Workspace() {}   // required by JPA

    public Workspace(String id, String rootPath) {
        this.id       = id;
        this.rootPath = rootPath;
    }

    public String         getId()             { return id; }
    public String         getRootPath()       { return rootPath; }
    public WorkspaceState getState()          { return state; }
    public String         getSyncedRevision() { return syncedRevision; }
    public Instant        getSyncedAt()       { return syncedAt; }
    public Instant        getCreatedAt()      { return createdAt; }
    public Instant        getUpdatedAt()      { return updatedAt; }

    public void setState(WorkspaceState state) { this.state = state; }
    public void setRootPath(String rootPath)   { this.rootPath = rootPath; }

    /** Record a completed fast-forward. */
    public void markSynced(String revision) {
        this.syncedRevision = revision;
        this.syncedAt       = Instant.now();
        this.state          = WorkspaceState.ACTIVE;
    }
}
