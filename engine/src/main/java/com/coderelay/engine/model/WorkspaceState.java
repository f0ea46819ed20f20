package com.coderelay.engine.model;

/**
 * Health of a worker's clone relative to trunk.
 *
 * ACTIVE:   the local trunk branch can be fast-forwarded (it may still be behind).
 * DIVERGED: the local trunk branch has history trunk does not; fast-forward
 *            was refused and the worker must resync or recreate the workspace.
 */
public enum WorkspaceState {
    ACTIVE,
    DIVERGED
}
