package com.docsight.research.model;

import java.time.Duration;

/**
 * Retry budget and timeout for one fetch call.
 *
 * @param maxRetries    total number of attempts, at least 1
 * @param timeout       per-attempt request timeout
 * @param baseDelay     backoff unit; attempt n waits 2^n units plus up to one unit of jitter
 * @param maxRetryAfter longest server-requested wait that is honored; a longer one fails the call
 */
public record FetchOptions(int maxRetries, Duration timeout, Duration baseDelay, Duration maxRetryAfter) {

    public static final Duration DEFAULT_MAX_RETRY_AFTER = Duration.ofSeconds(60);

    public FetchOptions {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxRetryAfter == null || maxRetryAfter.isNegative()) {
            throw new IllegalArgumentException("maxRetryAfter must not be negative");
        }
    }

    public FetchOptions(int maxRetries, Duration timeout, Duration baseDelay) {
        this(maxRetries, timeout, baseDelay, DEFAULT_MAX_RETRY_AFTER);
    }
}
