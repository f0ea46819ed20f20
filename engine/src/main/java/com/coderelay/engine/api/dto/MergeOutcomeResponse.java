package com.coderelay.engine.api.dto;

import com.coderelay.engine.service.MergeOutcome;

import java.util.List;
import java.util.UUID;

public record MergeOutcomeResponse(UUID proposalId, String outcome, String revision,
                                   List<String> conflictingPaths, String reason) {

    public static MergeOutcomeResponse from(MergeOutcome o) {
        return new MergeOutcomeResponse(o.proposalId(), o.kind().name(), o.revision(),
                o.conflictingPaths(), o.reason());
    }
}
