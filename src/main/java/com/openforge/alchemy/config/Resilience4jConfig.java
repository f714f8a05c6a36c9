package com.openforge.alchemy.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance:
 *   • "storeWrite" re-runs a write transaction that lost a SQLite lock race
 *                  (SQLITE_BUSY surfaces as a TransientDataAccessException
 *                  once busy_timeout has elapsed).
 *
 * Input errors (StoreException) are never retried.
 */
@Configuration
public class Resilience4jConfig {

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(200))
                .retryExceptions(TransientDataAccessException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry("storeWrite");
        return registry;
    }

    @Bean
    public Retry storeWriteRetry(RetryRegistry registry) {
        return registry.retry("storeWrite");
    }
}
