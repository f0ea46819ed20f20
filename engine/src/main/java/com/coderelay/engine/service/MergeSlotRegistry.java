package com.coderelay.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control for merges, keyed by the set of paths each merge touches.
 *
 * Two merges whose path sets overlap never hold slots at the same time;
 * merges over disjoint paths run in parallel. Waiters are served in arrival
 * order: a request is admitted only when it overlaps neither an active slot
 * nor an earlier waiter, so a stream of small merges cannot starve a large
 * one queued before them.
 *
 * Slots live in this process only; the coordinating process owns all merges.
 */
@Component
public class MergeSlotRegistry {

    private static final Logger log = LoggerFactory.getLogger(MergeSlotRegistry.class);

    private final ReentrantLock lock    = new ReentrantLock();
    private final Condition     changed = lock.newCondition();

    private final List<MergeSlot> active  = new ArrayList<>();
    private final Deque<Waiter>   waiting = new ArrayDeque<>();

    private static final class Waiter {
        final UUID        proposalId;
        final Set<String> paths;

        Waiter(UUID proposalId, Set<String> paths) {
            this.proposalId = proposalId;
            this.paths      = paths;
        }
    }

    /**
     * Wait up to {@code timeout} for a slot covering {@code paths}.
     *
     * @return the slot, or empty if the wait timed out
     */
    public Optional<MergeSlot> acquire(UUID proposalId, Set<String> paths, Duration timeout)
            throws InterruptedException {
        Waiter me = new Waiter(proposalId, Set.copyOf(paths));
        long remaining = timeout.toNanos();

        lock.lock();
        try {
            waiting.addLast(me);
            try {
                while (!admissible(me)) {
                    if (remaining <= 0L) {
                        log.info("Proposal {} timed out waiting for a merge slot on {} path(s)",
                                proposalId, me.paths.size());
                        return Optional.empty();
                    }
                    remaining = changed.awaitNanos(remaining);
                }
                MergeSlot slot = new MergeSlot(this, proposalId, me.paths);
                active.add(slot);
                log.debug("Proposal {} holds a merge slot ({} active)", proposalId, active.size());
                return Optional.of(slot);
            } finally {
                waiting.remove(me);
                // Leaving the queue can unblock waiters behind us.
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take a slot only if one is free right now. Queued waiters count as
     * ahead of this caller, so an overlapping waiter still blocks it.
     *
     * @return the slot, or empty if {@code paths} are busy
     */
    public Optional<MergeSlot> tryAcquire(UUID proposalId, Set<String> paths) {
        Waiter me = new Waiter(proposalId, Set.copyOf(paths));
        lock.lock();
        try {
            if (!admissible(me)) {
                log.debug("Proposal {} found its merge slot busy", proposalId);
                return Optional.empty();
            }
            MergeSlot slot = new MergeSlot(this, proposalId, me.paths);
            active.add(slot);
            log.debug("Proposal {} holds a merge slot ({} active)", proposalId, active.size());
            return Optional.of(slot);
        } finally {
            lock.unlock();
        }
    }

    void release(MergeSlot slot) {
        lock.lock();
        try {
            if (active.remove(slot)) {
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of the slots currently held. */
    public List<MergeSlot> activeSlots() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(active));
        } finally {
            lock.unlock();
        }
    }

    public int waitingCount() {
        lock.lock();
        try {
            return waiting.size();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private boolean admissible(Waiter me) {
        for (MergeSlot slot : active) {
            if (!Collections.disjoint(slot.getPaths(), me.paths)) {
                return false;
            }
        }
        for (Waiter ahead : waiting) {
            if (ahead == me) {
                break;
            }
            if (!Collections.disjoint(ahead.paths, me.paths)) {
                return false;
            }
        }
        return true;
    }
}
