package com.coderelay.engine.api.dto;

import java.util.Map;
import java.util.UUID;

/**
 * Request body for POST /workspaces/{id}/commits.
 *
 * changes maps a workspace-relative path to its new content; a null value
 * deletes the file.
 */
public record CommitRequest(UUID taskId, String message, Map<String, String> changes) {

    public CommitRequest {
        if (message == null || message.isBlank()) message = "Work on task " + taskId;
    }
}
