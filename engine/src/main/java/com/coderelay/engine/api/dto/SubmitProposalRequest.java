package com.coderelay.engine.api.dto;

import java.util.UUID;

/**
 * Request body for POST /proposals.
 *
 * Required: workspaceId, taskId
 * Optional: title (defaults to the task title), description
 */
public record SubmitProposalRequest(String workspaceId, UUID taskId, String title, String description) {
}
