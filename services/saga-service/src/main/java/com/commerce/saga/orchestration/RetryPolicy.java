package com.commerce.saga.orchestration;

import com.commerce.core.error.CommerceException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Exponential backoff for transient failures: {@code unit * 2^attempt}, with the
 * unit one minute by default. Only gateway, network and timeout errors qualify.
 */
@Component
public class RetryPolicy {

    private final int maxRetries;
    private final Duration unit;

    public RetryPolicy(@Value("${saga.retry.max-retries:3}") int maxRetries,
                       @Value("${saga.retry.unit:PT1M}") Duration unit) {
        this.maxRetries = maxRetries;
        this.unit = unit;
    }

    /**
     * @param attempt zero-based number of the attempt that just failed
     * @return the delay before the next attempt, or empty when the failure must not be retried
     */
    public Optional<Duration> nextDelay(int attempt, Throwable error) {
        if (!CommerceException.classify(error).isRetryable() || attempt >= maxRetries) {
            return Optional.empty();
        }
        return Optional.of(unit.multipliedBy(1L << attempt));
    }
}
