package com.docsight.research.service;

import com.docsight.research.config.ResearchProperties;
import com.docsight.research.exception.AcquireException;
import com.docsight.research.exception.ResearchConfigurationException;
import com.docsight.research.model.AcquiredContent;
import com.docsight.research.model.CandidateUrl;
import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.Finding;
import com.docsight.research.model.ResearchTopic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Researches one topic within one domain category.
 *
 * Candidate URLs are acquired one after another (no fan-out inside a domain), so a
 * domain holds at most one render session at a time. A URL that yields nothing is
 * logged and skipped; the result may be empty but a per-URL failure never escapes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DomainResearcher {

    private final CandidateUrlBuilder candidateUrlBuilder;
    private final ProgressiveContentAcquirer acquirer;
    private final SourceAuthorityClassifier classifier;
    private final ContentDeduplicator deduplicator;
    private final ResearchProperties properties;

    public List<Finding> researchDomain(ResearchTopic researchTopic) {
        if (researchTopic == null || researchTopic.topic() == null || researchTopic.topic().isBlank()) {
            throw ResearchConfigurationException.blankTopic();
        }
        if (researchTopic.domainCategory() == null) {
            throw ResearchConfigurationException.missingDomain();
        }

        DomainCategory domain = researchTopic.domainCategory();
        String topic = resolveTopic(researchTopic);

        List<CandidateUrl> candidates = candidateUrlBuilder.build(topic, domain);
        log.info("[{}] Built {} candidate URLs for \"{}\"", domain, candidates.size(), topic);

        List<Finding> raw = new ArrayList<>();
        for (CandidateUrl candidate : candidates) {
            try {
                AcquiredContent content = acquirer.acquire(candidate.url());
                raw.add(toFinding(content, topic, domain));
                log.info("[{}] Acquired {} ({} method, {} chars)",
                        domain, candidate.url(), content.method().getCode(), content.text().length());
            } catch (AcquireException e) {
                log.warn("[{}] No content from {}: {}", domain, candidate.url(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[{}] Unexpected failure acquiring {}: {}", domain, candidate.url(), e.getMessage(), e);
            }
        }

        List<Finding> findings = postProcess(raw);
        log.info("[{}] Extracted {} findings from {} acquired sources", domain, findings.size(), raw.size());
        return findings;
    }

    /**
     * A locked decision relevant to the domain replaces the topic, so research
     * does not wander into alternatives the caller already ruled out.
     */
    String resolveTopic(ResearchTopic researchTopic) {
        DomainCategory domain = researchTopic.domainCategory();
        String key = properties.getConstraints().getLockedKeys().get(domain);
        if (key == null) {
            return researchTopic.topic().trim();
        }

        String locked = researchTopic.constraints().get(key);
        if (locked != null && !locked.isBlank()) {
            log.info("[{}] Respecting locked decision: {} = {}", domain, key, locked);
            return locked.trim();
        }
        return researchTopic.topic().trim();
    }

    /**
     * Drops blank, non-HTTPS, denylisted and repeated sources, then folds duplicate
     * content. Findings arrive already classified.
     */
    List<Finding> postProcess(List<Finding> raw) {
        List<Finding> accepted = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();

        for (Finding finding : raw) {
            String url = finding.getSourceUrl();
            if (!finding.hasContent() || url == null) {
                continue;
            }
            if (!isSecure(url)) {
                log.debug("Dropping non-HTTPS source {}", url);
                continue;
            }
            if (isDenylisted(url)) {
                log.debug("Dropping low-signal community source {}", url);
                continue;
            }
            if (!seenUrls.add(url)) {
                continue;
            }
            accepted.add(finding);
        }

        return deduplicator.deduplicate(accepted);
    }

    boolean isSecure(String url) {
        return url.toLowerCase(Locale.ROOT).startsWith("https://");
    }

    boolean isDenylisted(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return properties.getFilter().getDenylist().stream()
                .anyMatch(pattern -> lower.contains(pattern.toLowerCase(Locale.ROOT)));
    }

    private Finding toFinding(AcquiredContent content, String topic, DomainCategory domain) {
        int maxLength = properties.getFindings().getMaxContentLength();
        String text = content.text();
        if (text.length() > maxLength) {
            text = text.substring(0, maxLength);
        }
        String title = content.title() != null && !content.title().isBlank() ? content.title() : topic;
        return classifier.assess(text, title, content.url(), domain, false, content.method());
    }
}
