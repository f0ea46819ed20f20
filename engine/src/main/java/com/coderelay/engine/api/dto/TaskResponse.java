package com.coderelay.engine.api.dto;

import com.coderelay.engine.model.Task;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record TaskResponse(
        UUID    id,
        String  title,
        String  description,
        String  status,
        String  owner,
        Instant leaseExpiresAt,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        Map<String, String> metadata
) {
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getStatus().name(),
                task.getOwner(),
                task.getLeaseExpiresAt(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                task.getCompletedAt(),
                Map.copyOf(task.getMetadata())
        );
    }
}
