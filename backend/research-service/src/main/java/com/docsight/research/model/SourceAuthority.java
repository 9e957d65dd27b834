package com.docsight.research.model;

/**
 * Derives a confidence tier from where a finding came from.
 */
@FunctionalInterface
public interface SourceAuthority {

    ConfidenceLevel classify(String url, boolean verifiedWithOfficial);
}
