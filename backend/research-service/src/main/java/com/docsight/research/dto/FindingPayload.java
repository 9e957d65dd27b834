package com.docsight.research.dto;

import com.docsight.research.model.AcquisitionMethod;
import com.docsight.research.model.DomainCategory;

import java.util.List;

/**
 * Inbound form of a finding. Confidence is not accepted from callers.
 */
public record FindingPayload(
        String content,
        String title,
        String sourceUrl,
        DomainCategory domainCategory,
        boolean verifiedWithOfficial,
        AcquisitionMethod method,
        List<String> alternateSources
) {
    public FindingPayload {
        alternateSources = alternateSources == null ? List.of() : List.copyOf(alternateSources);
    }
}
