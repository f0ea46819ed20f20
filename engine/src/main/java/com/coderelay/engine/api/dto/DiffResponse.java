package com.coderelay.engine.api.dto;

import com.coderelay.engine.tree.PatchSet;

import java.util.List;

/** Review view of a proposal's changes. */
public record DiffResponse(String baseRevision, String headRevision, List<String> paths, List<Change> changes) {

    public record Change(String type, String oldPath, String newPath) {
    }

    public static DiffResponse from(PatchSet patch) {
        return new DiffResponse(
                patch.baseRevision(),
                patch.headRevision(),
                List.copyOf(patch.paths()),
                patch.changes().stream()
                        .map(c -> new Change(c.type().name(), c.oldPath(), c.newPath()))
                        .toList());
    }
}
