package com.debateplatform.engine.config;

import io.r2dbc.spi.R2dbcTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Timeout and retry applied to every call leaving the process: provider completions and
 * persistence writes.
 *
 * <p>{@code debate.retry-count} is the total number of attempts per call, the first one
 * included. With {@code retry-count: 3} a call that fails transiently three times fails for
 * good. Backoff starts at {@code debate.retry-backoff} and doubles. The last failure is
 * re-thrown unchanged when attempts run out.
 *
 * <p>Settings are read per call, so the policy follows the current {@link DebateProperties}.
 */
public class ExternalCallPolicy {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallPolicy.class);

    private final DebateProperties properties;

    public ExternalCallPolicy(DebateProperties properties) {
        this.properties = properties;
    }

    public int maxAttempts() {
        return Math.max(1, properties.getRetryCount());
    }

    /** Backoff for {@code retryWhen}: retries only failures matching {@code retryable}. */
    public Retry retrySpec(String call, Predicate<Throwable> retryable) {
        return Retry.backoff(maxAttempts() - 1L, properties.getRetryBackoff())
            .filter(retryable)
            .doBeforeRetry(signal -> log.warn("[ExternalCall] transient failure, retrying. call={} attempt={}/{} reason={}",
                                              call, signal.totalRetries() + 2, maxAttempts(),
                                              signal.failure().getMessage()))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Guards a store write: bounded by {@code debate.call-timeout}, retried on timeouts and
     * transient database errors. {@code write} must be lazy, as retries resubscribe to it.
     */
    public <T> Mono<T> persist(String call, Mono<T> write) {
        return write
            .timeout(properties.getCallTimeout())
            .retryWhen(retrySpec(call, ExternalCallPolicy::isTransientStoreFailure));
    }

    static boolean isTransientStoreFailure(Throwable e) {
        return e instanceof TimeoutException
            || e instanceof TransientDataAccessException
            || e instanceof R2dbcTransientException;
    }
}
