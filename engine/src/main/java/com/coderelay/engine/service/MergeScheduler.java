package com.coderelay.engine.service;

import com.coderelay.engine.ledger.ProposalLedger;
import com.coderelay.engine.model.ChangeProposal;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives approved proposals through the MergeCoordinator.
 *
 * Two triggers feed the same fixed worker pool:
 *   - ProposalApprovedEvent, so a merge starts as soon as it is approved;
 *   - a periodic sweep of the ledger, which picks up anything the event
 *     missed (restart, a busy merge slot) except escalated proposals.
 *
 * The in-flight set keeps the two triggers from merging one proposal twice.
 *
 * Pool threads never wait for a merge slot. A proposal whose paths are busy
 * comes back DEFERRED and is dispatched again when another merge finishes
 * (or by the next sweep), so a queue on one path cannot occupy the pool
 * while merges on other paths are ready.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "coderelay.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class MergeScheduler {

    private static final Logger log = LoggerFactory.getLogger(MergeScheduler.class);

    private final MergeCoordinator mergeCoordinator;
    private final ProposalLedger   proposalLedger;
    private final ExecutorService  workers;

    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<UUID> deferred = ConcurrentHashMap.newKeySet();

    public MergeScheduler(MergeCoordinator mergeCoordinator,
                          ProposalLedger proposalLedger,
                          @Value("${coderelay.merge.workers:2}") int workerCount) {
        this.mergeCoordinator = mergeCoordinator;
        this.proposalLedger   = proposalLedger;
        this.workers          = Executors.newFixedThreadPool(workerCount);
    }

    @EventListener
    public void onApproved(ProposalApprovedEvent event) {
        dispatch(event.proposalId());
    }

    @Scheduled(fixedDelay = 5000)
    public void sweep() {
        for (ChangeProposal proposal : proposalLedger.findMergeCandidates()) {
            dispatch(proposal.getId());
        }
    }

    /** @return false if the proposal was already queued or running */
    boolean dispatch(UUID proposalId) {
        if (!inFlight.add(proposalId)) {
            return false;
        }
        workers.submit(() -> {
            MergeOutcome outcome = null;
            try {
                outcome = mergeCoordinator.mergeIfFree(proposalId);
                log.debug("Merge of {} finished: {}", proposalId, outcome.kind());
            } catch (Exception e) {
                log.error("Unhandled error merging proposal {}: {}", proposalId, e.getMessage(), e);
            } finally {
                inFlight.remove(proposalId);
            }
            if (outcome != null && outcome.kind() == MergeOutcome.Kind.DEFERRED) {
                deferred.add(proposalId);
            } else {
                redispatchDeferred();
            }
        });
        return true;
    }

    // A finished merge may have freed the paths a deferred proposal waits for.
    private void redispatchDeferred() {
        for (UUID id : Set.copyOf(deferred)) {
            if (deferred.remove(id)) {
                dispatch(id);
            }
        }
    }

    int deferredCount() {
        return deferred.size();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }
}
