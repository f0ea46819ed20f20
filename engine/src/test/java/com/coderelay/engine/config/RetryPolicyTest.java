package com.coderelay.engine.config;

import com.coderelay.engine.tree.TreeConflictException;
import com.coderelay.engine.tree.TreeIOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    final List<Duration> sleeps = new ArrayList<>();

    RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(500), 2.0, sleeps::add);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void backoff_growsByMultiplier() {
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void execute_transientFailure_retriesThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("op", () -> {
            if (calls.incrementAndGet() < 3) throw new TreeIOException("lock file present");
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
    }

    @Test
    void execute_persistentFailure_rethrowsAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("op", () -> {
            calls.incrementAndGet();
            throw new TreeIOException("disk gone");
        })).isInstanceOf(TreeIOException.class).hasMessage("disk gone");

        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void execute_conflict_isNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("op", () -> {
            calls.incrementAndGet();
            throw new TreeConflictException("diverged", List.of("foo.py"));
        })).isInstanceOf(TreeConflictException.class);

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_interruptedWhileBackingOff_stopsAndKeepsInterruptFlag() {
        RetryPolicy interrupting = new RetryPolicy(3, Duration.ofMillis(10), 2.0, d -> {
            throw new InterruptedException();
        });

        assertThatThrownBy(() -> interrupting.execute("op", () -> {
            throw new TreeIOException("flaky");
        })).isInstanceOf(TreeIOException.class).hasMessageContaining("interrupted");

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
