package com.docsight.research.service;

import com.docsight.research.model.Finding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Folds findings with the same content into one, regardless of URL.
 *
 * Versioned, localized and canonical URLs often serve identical text; the first
 * occurrence is kept and later URLs are recorded as its alternate sources.
 */
@Component
@Slf4j
public class ContentDeduplicator {

    /**
     * Returns first occurrences in input order. Findings with blank content are
     * dropped. Kept findings gain the duplicates' URLs as alternate sources.
     */
    public List<Finding> deduplicate(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return List.of();
        }

        Map<String, Finding> seen = new LinkedHashMap<>();
        int considered = 0;

        for (Finding finding : findings) {
            if (finding == null || !finding.hasContent()) {
                continue;
            }
            considered++;

            String key = contentKey(finding.getContent());
            Finding existing = seen.putIfAbsent(key, finding);
            if (existing != null && existing != finding) {
                existing.addAlternateSource(finding.getSourceUrl());
                finding.getAlternateSources().forEach(existing::addAlternateSource);
            }
        }

        List<Finding> deduplicated = new ArrayList<>(seen.values());
        log.debug("Deduplicated {} -> {} findings (removed {} duplicates)",
                considered, deduplicated.size(), considered - deduplicated.size());
        return deduplicated;
    }

    /**
     * SHA-256 hex of the canonical form of {@code content}.
     */
    public String contentKey(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalize(content).getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Lowercase, collapse whitespace runs, trim.
     */
    public static String canonicalize(String content) {
        if (content == null) {
            return "";
        }
        return content.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }
}
