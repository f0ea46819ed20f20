package com.coderelay.engine.api.dto;

import com.coderelay.engine.model.Workspace;

import java.time.Instant;

public record WorkspaceResponse(
        String  id,
        String  rootPath,
        String  state,
        String  syncedRevision,
        Instant syncedAt,
        Instant createdAt
) {
    public static WorkspaceResponse from(Workspace ws) {
        return new WorkspaceResponse(
                ws.getId(),
                ws.getRootPath(),
                ws.getState().name(),
                ws.getSyncedRevision(),
                ws.getSyncedAt(),
                ws.getCreatedAt()
        );
    }
}
