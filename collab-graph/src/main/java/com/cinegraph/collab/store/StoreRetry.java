package com.cinegraph.collab.store;

import com.cinegraph.collab.config.CollabGraphProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Bounded retry for store calls. Covers lock/deadlock losers, timeouts,
 * dropped connections and duplicate-key races between concurrent writers.
 * Everything else (bad SQL, constraint violations) fails on the first attempt.
 */
@Slf4j
public final class StoreRetry {

    private StoreRetry() {
    }

    public static Retry create(String name, CollabGraphProperties.Store store) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, store.getMaxAttempts()))
                .waitDuration(store.getRetryWait())
                .retryExceptions(
                        TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class,
                        DuplicateKeyException.class)
                .build();

        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} (attempt {}): {}", event.getName(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
