package com.coderelay.engine.service;

/** Result of one workspace synchronization attempt. */
public enum SyncOutcome {
    /** Fast-forwarded to the trunk head. */
    SYNCED,
    /** Already at the trunk head; nothing to do. */
    NOOP,
    /** Local trunk branch has commits trunk does not; workspace marked DIVERGED. */
    DIVERGED,
    /** Backend kept failing; retried at the worker's next claim. */
    FAILED;

    public boolean isCurrent() {
        return this == SYNCED || this == NOOP;
    }
}
