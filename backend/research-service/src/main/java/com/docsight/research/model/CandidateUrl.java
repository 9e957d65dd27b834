package com.docsight.research.model;

/**
 * A URL worth trying for a topic, tagged with where the guess came from
 * ("known", "pattern" or "mdn").
 */
public record CandidateUrl(String url, String sourceHint) {

    public static final String HINT_KNOWN = "known";
    public static final String HINT_PATTERN = "pattern";
    public static final String HINT_MDN = "mdn";
}
