package com.docsight.research.model;

import java.util.Map;

/**
 * One topic/domain research request with the caller's locked decisions.
 */
public record ResearchTopic(
        String topic,
        DomainCategory domainCategory,
        Map<String, String> constraints
) {
    public ResearchTopic {
        constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
    }

    public static ResearchTopic of(String topic, DomainCategory domainCategory) {
        return new ResearchTopic(topic, domainCategory, Map.of());
    }

    public ResearchTopic withDomain(DomainCategory category) {
        return new ResearchTopic(topic, category, constraints);
    }
}
