package com.docsight.research.exception;

import java.time.Duration;

/**
 * Retryable failure of a single request attempt (timeout, 429, 5xx, connection error).
 * Carries the server's Retry-After window when one was sent.
 */
public class TransientFetchException extends ResearchException {

    private final int status;
    private final Duration retryAfter;

    public TransientFetchException(String message, int status, Duration retryAfter, Throwable cause) {
        super("FETCH_TRANSIENT", message, cause);
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public static TransientFetchException status(int status, Duration retryAfter) {
        return new TransientFetchException("HTTP " + status, status, retryAfter, null);
    }

    public static TransientFetchException io(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TransientFetchException(message, 0, null, cause);
    }

    /**
     * HTTP status, or 0 when no response was received.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Server-specified wait, or null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isRateLimited() {
        return status == 429;
    }
}
