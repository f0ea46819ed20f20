package com.coderelay.engine.api.dto;

import java.util.Map;
import java.util.UUID;

/**
 * Request body for POST /workspaces/{id}/integrate.
 *
 * resolutions supplies the final content for paths that conflict with trunk.
 */
public record IntegrateRequest(UUID taskId, Map<String, String> resolutions) {

    public IntegrateRequest {
        if (resolutions == null) resolutions = Map.of();
    }
}
