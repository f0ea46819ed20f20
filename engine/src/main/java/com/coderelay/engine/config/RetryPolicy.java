package com.coderelay.engine.config;

import com.coderelay.engine.tree.TreeIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for versioned-tree operations.
 *
 * Only {@link TreeIOException} is retried. Conflicts and stale-state errors
 * are outcomes, not failures, and pass straight through. After the last
 * attempt the final TreeIOException is rethrown for the caller to escalate.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Blocks between attempts; swapped out in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int      maxAttempts;
    private final Duration initialBackoff;
    private final double   multiplier;
    private final Sleeper  sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
        this(maxAttempts, initialBackoff, multiplier, d -> Thread.sleep(d.toMillis()));
    }

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        this.maxAttempts    = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier     = multiplier;
        this.sleeper        = sleeper;
    }

    public int      getMaxAttempts()    { return maxAttempts; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public double   getMultiplier()     { return multiplier; }

    /** Delay before attempt {@code attempt + 1} (attempts are 1-based). */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) (initialBackoff.toMillis() * factor));
    }

    public <T> T execute(String operation, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (TreeIOException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                Duration delay = backoffAfter(attempt);
                log.info("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                pause(operation, delay, e);
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private void pause(String operation, Duration delay, TreeIOException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            TreeIOException interrupted = new TreeIOException(operation + " interrupted while backing off", ie);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
