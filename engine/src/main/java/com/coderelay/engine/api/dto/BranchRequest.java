package com.coderelay.engine.api.dto;

import java.util.UUID;

/** Request body for POST /workspaces/{id}/branches. */
public record BranchRequest(UUID taskId) {
}
