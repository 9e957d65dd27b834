package com.docsight.research.service;

import com.docsight.research.config.ResearchProperties;
import com.docsight.research.model.CandidateUrl;
import com.docsight.research.model.DomainCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Guesses where documentation for a topic lives.
 *
 * Well-known ecosystems come from a fixed table; anything else falls back to
 * host-name patterns ({@code docs.<topic>.com}, {@code <topic>.dev}, ...).
 * The list is regenerated on every call.
 */
@Component
@RequiredArgsConstructor
public class CandidateUrlBuilder {

    private static final Map<String, List<String>> KNOWN_ECOSYSTEMS = Map.ofEntries(
            Map.entry("react", List.of("https://react.dev/", "https://react.dev/learn")),
            Map.entry("nodejs", List.of("https://nodejs.org/en/docs/", "https://nodejs.org/api/")),
            Map.entry("node.js", List.of("https://nodejs.org/en/docs/", "https://nodejs.org/api/")),
            Map.entry("express", List.of("https://expressjs.com/", "https://expressjs.com/en/guide/routing.html")),
            Map.entry("vue", List.of("https://vuejs.org/", "https://vuejs.org/guide/introduction.html")),
            Map.entry("angular", List.of("https://angular.dev/", "https://angular.dev/overview")),
            Map.entry("svelte", List.of("https://svelte.dev/", "https://svelte.dev/docs/introduction")),
            Map.entry("nextjs", List.of("https://nextjs.org/", "https://nextjs.org/docs")),
            Map.entry("next.js", List.of("https://nextjs.org/", "https://nextjs.org/docs")),
            Map.entry("typescript", List.of("https://www.typescriptlang.org/", "https://www.typescriptlang.org/docs/")),
            Map.entry("python", List.of("https://docs.python.org/", "https://docs.python.org/3/")),
            Map.entry("django", List.of("https://docs.djangoproject.com/", "https://www.djangoproject.com/start/")),
            Map.entry("flask", List.of("https://flask.palletsprojects.com/", "https://flask.palletsprojects.com/en/stable/")),
            Map.entry("fastapi", List.of("https://fastapi.tiangolo.com/", "https://fastapi.tiangolo.com/tutorial/"))
    );

    private static final List<String> HOST_PATTERNS = List.of(
            "https://docs.%s.com/",
            "https://docs.%s.dev/",
            "https://docs.%s.org/",
            "https://%s.dev/",
            "https://%s.com/",
            "https://%s.org/"
    );

    private static final List<String> WEB_PLATFORM_KEYWORDS = List.of("javascript", "html", "css", "web");

    private final ResearchProperties properties;

    /**
     * Ordered candidates for {@code topic}, capped at the configured per-domain limit.
     * All categories currently share the same documentation roots.
     */
    public List<CandidateUrl> build(String topic, DomainCategory category) {
        String lower = topic.trim().toLowerCase(Locale.ROOT);
        String normalized = lower.replaceAll("\\s+", "");

        List<CandidateUrl> candidates = new ArrayList<>();
        for (String url : KNOWN_ECOSYSTEMS.getOrDefault(normalized, List.of())) {
            candidates.add(new CandidateUrl(url, CandidateUrl.HINT_KNOWN));
        }
        for (String pattern : HOST_PATTERNS) {
            candidates.add(new CandidateUrl(String.format(pattern, normalized), CandidateUrl.HINT_PATTERN));
        }
        if (WEB_PLATFORM_KEYWORDS.stream().anyMatch(lower::contains)) {
            candidates.add(new CandidateUrl(
                    "https://developer.mozilla.org/en-US/docs/Web/" + topic.trim().replaceAll("\\s+", "_"),
                    CandidateUrl.HINT_MDN));
        }

        Set<String> seen = new LinkedHashSet<>();
        return candidates.stream()
                .filter(candidate -> seen.add(candidate.url()))
                .limit(properties.getCandidates().getMaxPerDomain())
                .toList();
    }
}
