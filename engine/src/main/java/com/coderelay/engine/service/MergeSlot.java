package com.coderelay.engine.service;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Exclusive right to merge a set of paths into trunk. Release by closing;
 * closing twice is harmless.
 */
public final class MergeSlot implements AutoCloseable {

    private final MergeSlotRegistry registry;
    private final UUID              proposalId;
    private final Set<String>       paths;
    private final Instant           acquiredAt = Instant.now();

    MergeSlot(MergeSlotRegistry registry, UUID proposalId, Set<String> paths) {
        this.registry   = registry;
        this.proposalId = proposalId;
        this.paths      = paths;
    }

    public UUID        getProposalId() { return proposalId; }
    public Set<String> getPaths()      { return paths; }
    public Instant     getAcquiredAt() { return acquiredAt; }

    @Override
    public void close() {
        registry.release(this);
    }
}
