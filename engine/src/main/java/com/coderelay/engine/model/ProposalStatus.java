package com.coderelay.engine.model;

/**
 * Review and merge state of a ChangeProposal.
 *
 * Transitions:
 *   OPEN     → APPROVED  (reviewer accepts)
 *   OPEN     → REJECTED  (reviewer asks for changes)
 *   REJECTED → OPEN      (author pushed new commits and resubmitted)
 *   APPROVED → MERGING   (merge slot acquired)
 *   MERGING  → MERGED    (trunk updated)
 *   MERGING  → OPEN      (conflict; author must resync and resubmit)
 *   MERGING  → APPROVED  (backend failures exhausted the retry budget; escalated)
 *   OPEN / REJECTED → ABANDONED  (its task went back to OPEN, or a new owner superseded it)
 */
public enum ProposalStatus {
    OPEN,
    APPROVED,
    MERGING,
    MERGED,
    REJECTED,
    ABANDONED;

    /** Proposal still competes for its task (not terminal). */
    public boolean isActive() {
        return this != MERGED && this != ABANDONED;
    }

    /** Waiting on its author, so it may be dropped when the author lets go of the task. */
    public boolean isAbandonable() {
        return this == OPEN || this == REJECTED;
    }
}
