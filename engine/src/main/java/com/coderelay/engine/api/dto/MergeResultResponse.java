package com.coderelay.engine.api.dto;

import com.coderelay.engine.tree.MergeResult;

import java.util.List;

public record MergeResultResponse(boolean success, String revision, List<String> conflictingPaths) {

    public static MergeResultResponse from(MergeResult result) {
        return new MergeResultResponse(result.success(), result.revision(), result.conflictingPaths());
    }
}
