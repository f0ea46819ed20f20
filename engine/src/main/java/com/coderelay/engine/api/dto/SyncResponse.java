package com.coderelay.engine.api.dto;

public record SyncResponse(String workspaceId, String outcome, String syncedRevision) {
}
