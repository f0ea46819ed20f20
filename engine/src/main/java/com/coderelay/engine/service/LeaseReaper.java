package com.coderelay.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Returns abandoned tasks to the pool.
 *
 * A worker that crashes stops renewing its lease; once the lease passes the
 * task goes back to OPEN and another worker can claim it.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "coderelay.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final ClaimCoordinator claimCoordinator;

    public LeaseReaper(ClaimCoordinator claimCoordinator) {
        this.claimCoordinator = claimCoordinator;
    }

    @Scheduled(fixedDelay = 60_000)
    public void reap() {
        int reopened = claimCoordinator.reapExpiredLeases();
        if (reopened > 0) {
            log.info("Reopened {} task(s) with expired leases", reopened);
        }
    }
}
