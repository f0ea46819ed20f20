package com.coderelay.engine.api.dto;

import java.util.UUID;

public record BranchResponse(String workspaceId, UUID taskId, String branch) {
}
