package com.coderelay.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A reviewable bundle of commits ("pull request") on a feature branch,
 * always targeting the trunk branch.
 *
 * Rows are never deleted. Every write goes through ProposalLedger, which
 * checks the expected status and relies on the @Version column so that two
 * concurrent writers cannot both succeed.
 *
 * DB table: change_proposals  (created by Flyway V1, merge_commit added in V2)
 */
@Entity
@Table(name = "change_proposals")
public class ChangeProposal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    // Workspace (= worker id) whose clone holds the source branch.
    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(nullable = false)
    private String author;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "source_branch", nullable = false)
    private String sourceBranch;

    @Column(name = "target_branch", nullable = false)
    private String targetBranch;

    // Branch tip at the time of the latest submission.
    @Column(name = "head_revision", length = 64)
    private String headRevision;

    // Trunk commit produced by the merge. Null until MERGED.
    @Column(name = "merge_revision", length = 64)
    private String mergeRevision;

    // False when trunk already contained the branch and no merge commit was written.
    @Column(name = "merge_commit", nullable = false)
    private boolean mergeCommit = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProposalStatus status = ProposalStatus.OPEN;

    // Set when a merge exhausted its retry budget; the scheduler skips it.
    @Column(nullable = false)
    private boolean escalated = false;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_comments", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "comment_order")
    private List<ReviewComment> comments = new ArrayList<>();

    // Paths reported by the last conflicting merge. Cleared on resubmission.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_conflicts", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "conflict_order")
    @Column(name = "path", nullable = false, length = 1024)
    private List<String> conflictingPaths = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_metadata", joinColumns = @JoinColumn(name = "proposal_id"))
    @MapKeyColumn(name = "meta_key")
    @Column(name = "meta_value", columnDefinition = "TEXT")
    private Map<String, String> metadata = new HashMap<>();

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

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ChangeProposal() {}   // required by JPA

    public ChangeProposal(UUID taskId, String workspaceId, String author, String title,
                          String sourceBranch, String targetBranch) {
        this.taskId       = taskId;
        this.workspaceId  = workspaceId;
        this.author       = author;
        this.title        = title;
        this.sourceBranch = sourceBranch;
        this.targetBranch = targetBranch;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()               { return id; }
    public UUID           getTaskId()           { return taskId; }
    public String         getWorkspaceId()      { return workspaceId; }
    public String         getAuthor()           { return author; }
    public String         getTitle()            { return title; }
    public String         getDescription()      { return description; }
    public String         getSourceBranch()     { return sourceBranch; }
    public String         getTargetBranch()     { return targetBranch; }
    public String         getHeadRevision()     { return headRevision; }
    public String         getMergeRevision()    { return mergeRevision; }
    public boolean        isMergeCommit()       { return mergeCommit; }
    public ProposalStatus getStatus()           { return status; }
    public boolean        isEscalated()         { return escalated; }
    public String         getFailureReason()    { return failureReason; }
    public List<ReviewComment> getComments()    { return comments; }
    public List<String>   getConflictingPaths() { return conflictingPaths; }
    public Map<String, String> getMetadata()    { return metadata; }
    public Instant        getCreatedAt()        { return createdAt; }
    public Instant        getUpdatedAt()        { return updatedAt; }
    public long           getVersion()          { return version; }

    public void setStatus(ProposalStatus status)         { this.status = status; }
    public void setDescription(String description)       { this.description = description; }
    public void setHeadRevision(String headRevision)     { this.headRevision = headRevision; }
    public void setMergeRevision(String mergeRevision)   { this.mergeRevision = mergeRevision; }
    public void setMergeCommit(boolean mergeCommit)      { this.mergeCommit = mergeCommit; }
    public void setEscalated(boolean escalated)          { this.escalated = escalated; }
    public void setFailureReason(String failureReason)   { this.failureReason = failureReason; }
    public void addComment(ReviewComment comment)        { this.comments.add(comment); }

    public void setConflictingPaths(List<String> paths) {
        this.conflictingPaths.clear();
        this.conflictingPaths.addAll(paths);
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = new HashMap<>(metadata);
    }
}
