package com.coderelay.engine.service;

import java.util.List;
import java.util.UUID;

/**
 * What a merge attempt did to a proposal.
 *
 * @param revision         trunk commit, set only for MERGED
 * @param conflictingPaths set only for CONFLICT
 * @param reason           human-readable detail for ESCALATED / DEFERRED / SKIPPED
 */
public record MergeOutcome(UUID proposalId, Kind kind, String revision,
                           List<String> conflictingPaths, String reason) {

    public enum Kind {
        /** Trunk now contains the proposal. */
        MERGED,
        /** Overlapping edits; proposal back to OPEN for the author. */
        CONFLICT,
        /** Backend failures exhausted the retry budget; proposal APPROVED + escalated. */
        ESCALATED,
        /** No merge slot (in time); proposal still APPROVED and dispatched again later. */
        DEFERRED,
        /** Proposal was not in a mergeable state. */
        SKIPPED
    }

    public MergeOutcome {
        conflictingPaths = conflictingPaths == null ? List.of() : List.copyOf(conflictingPaths);
    }

    public static MergeOutcome merged(UUID id, String revision) {
        return new MergeOutcome(id, Kind.MERGED, revision, List.of(), null);
    }

    public static MergeOutcome conflict(UUID id, List<String> paths) {
        return new MergeOutcome(id, Kind.CONFLICT, null, paths, null);
    }

    public static MergeOutcome escalated(UUID id, String reason) {
        return new MergeOutcome(id, Kind.ESCALATED, null, List.of(), reason);
    }

    public static MergeOutcome deferred(UUID id, String reason) {
        return new MergeOutcome(id, Kind.DEFERRED, null, List.of(), reason);
    }

    public static MergeOutcome skipped(UUID id, String reason) {
        return new MergeOutcome(id, Kind.SKIPPED, null, List.of(), reason);
    }
}
