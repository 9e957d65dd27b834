package com.docsight.research.service;

import com.docsight.research.model.AcquisitionMethod;
import com.docsight.research.model.ConfidenceLevel;
import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.Finding;
import com.docsight.research.model.ManualFinding;
import com.docsight.research.model.SourceAuthority;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a source URL to a confidence tier.
 *
 * Tiers are tested in order (HIGH, MEDIUM, LOW) against the lowercased URL; the
 * first match wins and anything unmatched is UNVERIFIED. A finding verified against
 * an official source is always HIGH.
 */
@Component
public class SourceAuthorityClassifier implements SourceAuthority {

    private static final Map<ConfidenceLevel, List<Pattern>> AUTHORITY_RULES = new LinkedHashMap<>();

    static {
        AUTHORITY_RULES.put(ConfidenceLevel.HIGH, List.of(
                Pattern.compile("^https://docs\\."),                      // docs.* hosts
                Pattern.compile("^https://[^/]+\\.dev/"),                 // .dev TLD
                Pattern.compile("/official/"),
                Pattern.compile("github\\.com/[^/]+/[^/]+/docs/"),        // owner/repo/docs/
                Pattern.compile("^https://[^/]+\\.org/docs/")
        ));
        AUTHORITY_RULES.put(ConfidenceLevel.MEDIUM, List.of(
                Pattern.compile("developer\\.mozilla\\.org"),
                Pattern.compile("stackoverflow\\.com"),
                Pattern.compile("\\.edu/"),
                Pattern.compile("\\.gov/")
        ));
        AUTHORITY_RULES.put(ConfidenceLevel.LOW, List.of(
                Pattern.compile("medium\\.com"),
                Pattern.compile("dev\\.to"),
                Pattern.compile("hashnode\\.dev"),
                Pattern.compile("blog\\.")
        ));
    }

    public ConfidenceLevel classify(String url) {
        return classify(url, false);
    }

    @Override
    public ConfidenceLevel classify(String url, boolean verifiedWithOfficial) {
        if (verifiedWithOfficial) {
            return ConfidenceLevel.HIGH;
        }
        if (url == null || url.isBlank()) {
            return ConfidenceLevel.UNVERIFIED;
        }

        String urlLower = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<ConfidenceLevel, List<Pattern>> tier : AUTHORITY_RULES.entrySet()) {
            for (Pattern pattern : tier.getValue()) {
                if (pattern.matcher(urlLower).find()) {
                    return tier.getKey();
                }
            }
        }
        return ConfidenceLevel.UNVERIFIED;
    }

    /**
     * Builds a {@link Finding} whose confidence is derived from its URL and flag.
     */
    public Finding assess(String content,
                          String title,
                          String sourceUrl,
                          DomainCategory domainCategory,
                          boolean verifiedWithOfficial,
                          AcquisitionMethod method) {
        return new Finding(content, title, sourceUrl, domainCategory, verifiedWithOfficial, method, this);
    }

    public Finding assess(ManualFinding manual) {
        return assess(manual.content(), manual.title(), manual.sourceUrl(),
                manual.domainCategory(), manual.verifiedWithOfficial(), null);
    }
}
