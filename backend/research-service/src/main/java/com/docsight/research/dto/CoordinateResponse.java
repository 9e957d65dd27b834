package com.docsight.research.dto;

import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.DomainResult;

import java.util.Map;

public record CoordinateResponse(
        String topic,
        Map<DomainCategory, DomainResult> results,
        int totalFindings,
        int failedDomains
) {
    public static CoordinateResponse from(String topic, Map<DomainCategory, DomainResult> results) {
        int total = results.values().stream().mapToInt(r -> r.findings().size()).sum();
        int failed = (int) results.values().stream().filter(DomainResult::isFailed).count();
        return new CoordinateResponse(topic, results, total, failed);
    }
}
