package com.docsight.research.service;

import com.docsight.research.model.Finding;
import com.docsight.research.model.ManualFinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines automated findings with findings the user supplied by hand.
 *
 * Manual input is treated as more trustworthy: when both name the same URL the
 * manual entry wins. If the automated capture of that URL said something else, the
 * URL is also listed among the manual entry's alternates so the divergence stays
 * visible; if it said the same thing, its alternates carry over.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FindingMergeService {

    private final SourceAuthorityClassifier classifier;
    private final ContentDeduplicator deduplicator;

    public List<Finding> mergeManual(List<Finding> automated, List<ManualFinding> manual) {
        List<Finding> classifiedManual = manual == null ? List.of() : manual.stream()
                .filter(Objects::nonNull)
                .map(classifier::assess)
                .toList();
        return merge(automated, classifiedManual);
    }

    /**
     * Deduplicates by source URL first, content second, then orders by confidence
     * (HIGH first, stable within a tier).
     */
    public List<Finding> merge(List<Finding> automated, List<Finding> manual) {
        Map<String, Finding> byUrl = new LinkedHashMap<>();

        for (Finding finding : nullSafe(automated)) {
            if (hasUrl(finding)) {
                byUrl.putIfAbsent(finding.getSourceUrl(), finding);
            }
        }

        int overridden = 0;
        for (Finding finding : nullSafe(manual)) {
            if (!hasUrl(finding)) {
                continue;
            }
            Finding replaced = byUrl.put(finding.getSourceUrl(), finding);
            if (replaced != null && replaced != finding) {
                overridden++;
                if (sameContent(replaced, finding)) {
                    replaced.getAlternateSources().forEach(finding::addAlternateSource);
                } else {
                    finding.addSupersededSource(replaced.getSourceUrl());
                }
            }
        }

        List<Finding> deduplicated = deduplicator.deduplicate(new ArrayList<>(byUrl.values()));
        List<Finding> sorted = new ArrayList<>(deduplicated);
        sorted.sort(Comparator.comparingInt((Finding f) -> f.getConfidenceLevel().getWeight()).reversed());

        log.debug("Merged {} automated and {} manual findings into {} ({} overridden by manual)",
                nullSafe(automated).size(), nullSafe(manual).size(), sorted.size(), overridden);
        return sorted;
    }

    private boolean sameContent(Finding a, Finding b) {
        return ContentDeduplicator.canonicalize(a.getContent())
                .equals(ContentDeduplicator.canonicalize(b.getContent()));
    }

    private static boolean hasUrl(Finding finding) {
        return finding != null && finding.getSourceUrl() != null && !finding.getSourceUrl().isBlank();
    }

    private static List<Finding> nullSafe(List<Finding> findings) {
        return findings == null ? List.of() : findings;
    }
}
