package com.docsight.research.dto;

import com.docsight.research.model.ManualFinding;

import java.util.List;

/**
 * Automated findings as previously returned by this service, plus manual ones.
 * Both are re-classified on the way in.
 */
public record MergeRequest(
        List<FindingPayload> automated,
        List<ManualFinding> manual
) {
    public MergeRequest {
        automated = automated == null ? List.of() : automated;
        manual = manual == null ? List.of() : manual;
    }
}
