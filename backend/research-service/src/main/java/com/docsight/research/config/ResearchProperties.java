package com.docsight.research.config;

import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.FetchOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for the research engine.
 *
 * The static-length threshold and the concurrency defaults are carried-over
 * heuristics; they live here so deployments can adjust them.
 */
@Configuration
@ConfigurationProperties(prefix = "research")
@Validated
@Data
public class ResearchProperties {

    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 10;

    @Valid
    private Coordinator coordinator = new Coordinator();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Acquisition acquisition = new Acquisition();

    private Render render = new Render();

    @Valid
    private Candidates candidates = new Candidates();

    @Valid
    private Findings findings = new Findings();

    private Filter filter = new Filter();

    private Constraints constraints = new Constraints();

    @Data
    public static class Coordinator {
        /** Simultaneous domain units (and so render sessions); above ~5 risks exhaustion */
        @Min(MIN_CONCURRENCY)
        @Max(MAX_CONCURRENCY)
        private int concurrency = 2;
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int maxRetries = 3;

        private Duration baseDelay = Duration.ofSeconds(1);

        private Duration timeout = Duration.ofSeconds(10);

        private Duration connectTimeout = Duration.ofSeconds(10);

        private String userAgent = "Mozilla/5.0 (Research Bot)";

        /** Retry-After values above this fail the fetch instead of parking the worker */
        private Duration maxRetryAfter = FetchOptions.DEFAULT_MAX_RETRY_AFTER;

        /** Cap on buffered response bodies */
        private int maxInMemorySize = 4 * 1024 * 1024;

        public FetchOptions toOptions() {
            return new FetchOptions(maxRetries, timeout, baseDelay, maxRetryAfter);
        }
    }

    @Data
    public static class Acquisition {
        /** Static text at or above this length skips the rendered fallback */
        @Min(0)
        private int minStaticLength = 100;

        private List<String> selectors = new ArrayList<>(List.of("main", "article", ".content"));
    }

    @Data
    public static class Render {
        private boolean enabled = true;

        private boolean headless = true;

        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Candidates {
        @Min(1)
        private int maxPerDomain = 3;
    }

    @Data
    public static class Findings {
        @Min(1)
        private int maxContentLength = 500;
    }

    @Data
    public static class Filter {
        /** Low-signal community platforms, matched as substrings of the URL */
        private List<String> denylist = new ArrayList<>(List.of("forum.", "reddit.com", "discord."));
    }

    @Data
    public static class Constraints {
        /** Locked-decision key that pins the topic for a domain */
        private Map<DomainCategory, String> lockedKeys = new EnumMap<>(Map.of(
                DomainCategory.STACK, "technology_stack",
                DomainCategory.ARCHITECTURE, "architectural_patterns"
        ));
    }
}
