package com.docsight.research.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record DomainResearchRequest(
        @NotBlank String topic,
        @NotBlank String domain,
        Map<String, String> constraints
) {
    public DomainResearchRequest {
        constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
    }
}
