package com.docsight.research.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

/**
 * @param domains     category names; all four when empty
 * @param concurrency simultaneous domains; configured default when null
 */
public record CoordinateRequest(
        @NotBlank String topic,
        List<String> domains,
        Integer concurrency,
        Map<String, String> constraints
) {
    public CoordinateRequest {
        domains = domains == null ? List.of() : List.copyOf(domains);
        constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
    }
}
