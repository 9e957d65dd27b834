package com.docsight.research.exception;

/**
 * Neither static extraction nor the rendered fallback produced usable text.
 * Callers treat this as "the URL yielded nothing".
 */
public class AcquireException extends ResearchException {

    private final String url;

    public AcquireException(String url, String message) {
        super("ACQUIRE_FAILED", message);
        this.url = url;
    }

    public AcquireException(String url, String message, Throwable cause) {
        super("ACQUIRE_FAILED", message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
