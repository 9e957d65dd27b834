package com.docsight.research.exception;

/**
 * Invalid input detected before any research work starts. Never retried.
 */
public class ResearchConfigurationException extends ResearchException {

    public ResearchConfigurationException(String message) {
        super("INVALID_CONFIGURATION", message);
    }

    public static ResearchConfigurationException invalidConcurrency(int concurrency, int min, int max) {
        return new ResearchConfigurationException(
                "Concurrency must be between " + min + " and " + max + ", got " + concurrency);
    }

    public static ResearchConfigurationException unknownDomain(String name, String allowed) {
        return new ResearchConfigurationException(
                "Invalid domain: " + name + ". Must be one of: " + allowed);
    }

    public static ResearchConfigurationException missingDomain() {
        return new ResearchConfigurationException("Domain category is required");
    }

    public static ResearchConfigurationException blankTopic() {
        return new ResearchConfigurationException("Invalid topic: must be a non-empty string");
    }
}
