package com.docsight.research.model;

/**
 * Caller-supplied finding, merged with automated research results.
 */
public record ManualFinding(
        String content,
        String title,
        String sourceUrl,
        DomainCategory domainCategory,
        boolean verifiedWithOfficial
) {
}
