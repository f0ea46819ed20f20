package com.coderelay.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /tasks.
 *
 * Required: title
 * Optional: description, metadata (free-form key/values kept with the task)
 */
public record CreateTaskRequest(String title, String description, Map<String, String> metadata) {

    public CreateTaskRequest {
        if (metadata == null) metadata = Map.of();
    }
}
