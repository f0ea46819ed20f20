package com.coderelay.engine.model;

/**
 * Lifecycle of a Task.
 *
 * Transitions:
 *   OPEN      → ASSIGNED   (claimed by a worker, contended)
 *   ASSIGNED  → IN_REVIEW  (owner submitted a change proposal)
 *   IN_REVIEW → COMPLETED  (proposal merged into trunk)
 *   ASSIGNED  → OPEN       (released, or the claim lease expired)
 *   IN_REVIEW → ASSIGNED   (proposal rejected or conflicted, same owner continues)
 */
public enum TaskStatus {
    OPEN,
    ASSIGNED,
    IN_REVIEW,
    COMPLETED;

    /** True while a worker holds the claim. */
    public boolean isClaimed() {
        return this == ASSIGNED || this == IN_REVIEW;
    }
}
