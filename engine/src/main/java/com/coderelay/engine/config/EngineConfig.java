package com.coderelay.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    /** Retry budget shared by merges and workspace synchronization. */
    @Bean
    public RetryPolicy treeRetryPolicy(
            @Value("${coderelay.merge.retry.max-attempts:3}") int maxAttempts,
            @Value("${coderelay.merge.retry.initial-backoff:500ms}") Duration initialBackoff,
            @Value("${coderelay.merge.retry.multiplier:2.0}") double multiplier) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier);
    }
}
