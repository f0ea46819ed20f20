package com.coderelay.engine.api.dto;

import com.coderelay.engine.model.ChangeProposal;
import com.coderelay.engine.model.ReviewComment;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Full view of a proposal, including its review thread and the paths of
 * the last conflicting merge.
 */
public record ProposalResponse(
        UUID          id,
        UUID          taskId,
        String        workspaceId,
        String        author,
        String        title,
        String        description,
        String        sourceBranch,
        String        targetBranch,
        String        headRevision,
        String        mergeRevision,
        String        status,
        boolean       escalated,
        String        failureReason,
        List<Comment> comments,
        List<String>  conflictingPaths,
        Map<String, String> metadata,
        Instant       createdAt,
        Instant       updatedAt
) {
    public record Comment(String author, String verdict, String body, Instant createdAt) {
        static Comment from(ReviewComment c) {
            return new Comment(c.getAuthor(), c.getVerdict().name(), c.getBody(), c.getCreatedAt());
        }
    }

    public static ProposalResponse from(ChangeProposal p) {
        return new ProposalResponse(
                p.getId(),
                p.getTaskId(),
                p.getWorkspaceId(),
                p.getAuthor(),
                p.getTitle(),
                p.getDescription(),
                p.getSourceBranch(),
                p.getTargetBranch(),
                p.getHeadRevision(),
                p.getMergeRevision(),
                p.getStatus().name(),
                p.isEscalated(),
                p.getFailureReason(),
                p.getComments().stream().map(Comment::from).toList(),
                List.copyOf(p.getConflictingPaths()),
                Map.copyOf(p.getMetadata()),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
