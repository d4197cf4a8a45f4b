package com.hookrelay.common.resilience;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Configuration for {@link ErrorRecoveryService#withRetry}.
 */
@Data
@Builder(toBuilder = true)
public class RetryOptions {

    @Builder.Default
    private int maxAttempts = 3;

    /**
     * Delay before the second attempt; doubles per attempt when exponential backoff is on.
     */
    @Builder.Default
    private Duration delay = Duration.ofSeconds(1);

    @Builder.Default
    private boolean exponentialBackoff = true;

    @Builder.Default
    private Predicate<Throwable> retryOn = RetryPredicates.networkOrServerError();

    public static RetryOptions defaults() {
        return RetryOptions.builder().build();
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayAfter(int attempt) {
        if (!exponentialBackoff) {
            return delay;
        }
        return delay.multipliedBy(1L << Math.min(attempt - 1, 30));
    }
}
