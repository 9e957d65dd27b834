package com.docsight.research.exception;

/**
 * A URL could not be fetched within its retry budget, or failed permanently.
 */
public class FetchException extends ResearchException {

    private final String url;
    private final int attempts;
    private final boolean rateLimited;

    public FetchException(String url, String reason, int attempts, boolean rateLimited, Throwable cause) {
        super("FETCH_FAILED", "Failed to fetch " + url + " after " + attempts + " attempt(s): " + reason, cause);
        this.url = url;
        this.attempts = attempts;
        this.rateLimited = rateLimited;
    }

    /**
     * Non-retryable HTTP status (e.g. 404).
     */
    public static FetchException permanent(String url, int status, int attempts) {
        return new FetchException(url, "HTTP " + status, attempts, false, null);
    }

    /**
     * Retry budget used up; {@code lastFailure} is the final attempt's error.
     */
    public static FetchException exhausted(String url, int attempts, Throwable lastFailure) {
        boolean rateLimited = lastFailure instanceof TransientFetchException t && t.isRateLimited();
        String reason = lastFailure != null ? lastFailure.getMessage() : "unknown";
        return new FetchException(url, reason, attempts, rateLimited, lastFailure);
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
