package com.docsight.research.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A piece of reference material tied to the URL it came from.
 *
 * Confidence is derived at construction from the source URL and verified flag;
 * the only mutable part is the list of alternate URLs that carried the same content.
 */
@Getter
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Finding {

    private final String content;
    private final String title;
    private final String sourceUrl;
    private final DomainCategory domainCategory;
    private final ConfidenceLevel confidenceLevel;
    private final boolean verifiedWithOfficial;
    private final AcquisitionMethod method;
    private final List<String> alternateSources = new ArrayList<>();

    public Finding(String content,
                   String title,
                   String sourceUrl,
                   DomainCategory domainCategory,
                   boolean verifiedWithOfficial,
                   AcquisitionMethod method,
                   SourceAuthority authority) {
        this.content = content;
        this.title = title;
        this.sourceUrl = sourceUrl;
        this.domainCategory = domainCategory;
        this.verifiedWithOfficial = verifiedWithOfficial;
        this.method = method;
        this.confidenceLevel = authority.classify(sourceUrl, verifiedWithOfficial);
    }

    public List<String> getAlternateSources() {
        return Collections.unmodifiableList(alternateSources);
    }

    /**
     * Records another URL that carried this content. Blank URLs, this finding's own
     * URL and URLs already recorded are ignored.
     *
     * @return true if the list changed
     */
    public boolean addAlternateSource(String url) {
        if (url == null || url.isBlank() || url.equals(sourceUrl) || alternateSources.contains(url)) {
            return false;
        }
        alternateSources.add(url);
        return true;
    }

    /**
     * Records that a different capture of {@code url} was superseded by this finding.
     * Unlike {@link #addAlternateSource(String)} this accepts this finding's own URL.
     */
    public boolean addSupersededSource(String url) {
        if (url == null || url.isBlank() || alternateSources.contains(url)) {
            return false;
        }
        alternateSources.add(url);
        return true;
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
