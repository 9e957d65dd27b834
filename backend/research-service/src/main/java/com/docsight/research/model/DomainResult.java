package com.docsight.research.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of one domain unit. An empty finding list with no error means the
 * domain was researched and yielded nothing; a set error means the unit failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainResult(
        DomainCategory domainCategory,
        List<Finding> findings,
        String error
) {
    public DomainResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static DomainResult succeeded(DomainCategory category, List<Finding> findings) {
        return new DomainResult(category, findings, null);
    }

    public static DomainResult failed(DomainCategory category, String error) {
        return new DomainResult(category, List.of(), error != null ? error : "unknown error");
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
