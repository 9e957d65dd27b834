package com.docsight.research.model;

import com.docsight.research.exception.ResearchConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Research angles a topic is partitioned into. Each category is researched as an
 * independent unit by the coordinator.
 */
public enum DomainCategory {
    STACK,
    FEATURES,
    ARCHITECTURE,
    PITFALLS;

    /**
     * Case-insensitive lookup that reports unknown names as a configuration error.
     * Request bodies are decoded through it as well.
     */
    @JsonCreator
    public static DomainCategory fromName(String name) {
        if (name == null || name.isBlank()) {
            throw ResearchConfigurationException.unknownDomain(name, allowedNames());
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ResearchConfigurationException.unknownDomain(name, allowedNames());
        }
    }

    private static String allowedNames() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
