package com.coderelay.engine.tree;

import java.util.List;

/**
 * Outcome of a merge attempt.
 *
 * @param success          true if the merge produced a commit (or was already up to date)
 * @param revision         the resulting commit id; null when the merge conflicted
 * @param conflictingPaths paths that could not be merged; empty on success
 * @param upToDate         the target already contained the source; {@code revision}
 *                         is its unchanged head, not a new commit
 */
public record MergeResult(boolean success, String revision, List<String> conflictingPaths, boolean upToDate) {

    public MergeResult {
        conflictingPaths = conflictingPaths == null ? List.of() : List.copyOf(conflictingPaths);
    }

    public static MergeResult merged(String revision) {
        return new MergeResult(true, revision, List.of(), false);
    }

    public static MergeResult upToDate(String revision) {
        return new MergeResult(true, revision, List.of(), true);
    }

    public static MergeResult conflicted(List<String> paths) {
        return new MergeResult(false, null, paths, false);
    }
}
