package com.coderelay.engine.tree;

import java.nio.file.Path;
import java.util.Map;

/**
 * Branch / commit / diff / merge primitives over a versioned file tree.
 *
 * The trunk ("authoritative workspace") is a single repository holding the
 * merged history; each worker workspace is a clone of it. Revisions are
 * passed around as commit ids or full ref names.
 *
 * Failures surface as {@link TreeConflictException} (recoverable, the
 * histories disagree on some paths) or {@link TreeIOException} (backend
 * trouble, retried by the caller).
 */
public interface VersionedTree {

    /** Name of the trunk branch, e.g. "main". */
    String trunkBranch();

    /** Create the trunk repository if it does not exist yet; returns its head. */
    String initTrunk();

    /** Current commit id of the trunk branch. */
    String trunkHead();

    // ------------------------------------------------------------------
    // Workspace side
    // ------------------------------------------------------------------

    /** Clone trunk into {@code root}; returns the cloned trunk revision. */
    String cloneWorkspace(Path root, String workerId);

    void deleteWorkspace(Path root);

    /** Commit id the workspace's local trunk branch points at. */
    String workspaceRevision(Path root);

    /**
     * Create {@code branch} at {@code base} (the local trunk branch when null)
     * and check it out. An existing branch is simply checked out.
     *
     * @return the full ref name of the branch
     */
    String createBranch(Path root, String branch, String base);

    /**
     * Write {@code changes} (path → content, null content deletes) onto
     * {@code branch} and commit them.
     *
     * @return the new commit id
     */
    String commit(Path root, String branch, Map<String, String> changes, String message);

    /** Push {@code branch} to trunk so it can be merged; returns its tip. */
    String publish(Path root, String branch);

    /**
     * Advance the workspace's local trunk branch to {@code targetRevision}.
     * Already being at (or past) the target is a no-op.
     *
     * @throws TreeConflictException if the local branch has diverged
     */
    String fastForward(Path root, String targetRevision);

    /**
     * Merge the latest trunk into {@code branch} inside the workspace.
     * Conflicting paths listed in {@code resolutions} take the supplied
     * content; if any conflict is left unresolved the branch is restored and
     * a conflicted result is returned.
     */
    MergeResult integrateTrunk(Path root, String branch, Map<String, String> resolutions);

    // ------------------------------------------------------------------
    // Trunk side
    // ------------------------------------------------------------------

    /** Files that differ between two trunk-repository revisions. */
    PatchSet diff(String baseRevision, String headRevision);

    /** Files {@code sourceRef} changes relative to its merge base with trunk. */
    PatchSet touchedPaths(String sourceRef);

    /** Three-way merge of {@code sourceRef} into trunk. */
    MergeResult merge(String sourceRef, String message);

    /** Remove a (merged) branch from the trunk repository. */
    void deleteBranch(String branch);
}
