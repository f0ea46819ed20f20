package com.coderelay.engine.tree;

import java.util.List;

/**
 * Thrown when two histories touch the same paths and cannot be combined
 * automatically (e.g. a workspace whose trunk branch can no longer be
 * fast-forwarded). Recoverable: the owning worker resyncs and retries.
 */
public class TreeConflictException extends TreeException {

    private final List<String> conflictingPaths;

    public TreeConflictException(String message, List<String> conflictingPaths) {
        super(message + " " + conflictingPaths);
        this.conflictingPaths = List.copyOf(conflictingPaths);
    }

    public List<String> getConflictingPaths() { return conflictingPaths; }
}
