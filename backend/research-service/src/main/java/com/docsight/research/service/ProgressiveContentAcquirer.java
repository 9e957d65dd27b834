package com.docsight.research.service;

import com.docsight.research.client.ResearchFetchClient;
import com.docsight.research.config.ResearchProperties;
import com.docsight.research.exception.AcquireException;
import com.docsight.research.model.AcquiredContent;
import com.docsight.research.model.AcquisitionMethod;
import com.docsight.research.render.RenderSession;
import com.docsight.research.render.RenderSessionFactory;
import com.docsight.research.render.RenderedPage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Acquires page text by the cheapest path that works.
 *
 * 1. Static: fetch markup, extract the content regions.
 * 2. Dynamic: only when the static text is shorter than the configured threshold
 *    (or the static path failed), render the page in a browser session opened for
 *    this call alone and extract the same regions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressiveContentAcquirer {

    private final ResearchFetchClient fetchClient;
    private final HtmlContentExtractor extractor;
    private final RenderSessionFactory renderSessionFactory;
    private final ResearchProperties properties;

    /**
     * @throws AcquireException if neither path produced text
     */
    public AcquiredContent acquire(String url) {
        int threshold = properties.getAcquisition().getMinStaticLength();
        String staticFailure;

        try {
            String html = fetchClient.fetchBlocking(url, properties.getFetch().toOptions());
            HtmlContentExtractor.Extraction extraction = extractor.extract(html, url);

            if (extraction.length() >= threshold) {
                log.debug("Static extraction succeeded for {} ({} chars)", url, extraction.length());
                return new AcquiredContent(url, extraction.text(), extraction.title(), AcquisitionMethod.STATIC);
            }
            staticFailure = "static content too short (" + extraction.length() + " chars)";
        } catch (RuntimeException e) {
            staticFailure = "static fetch failed: " + e.getMessage();
        }

        if (!properties.getRender().isEnabled()) {
            throw new AcquireException(url, "Failed to acquire " + url + ": " + staticFailure + ", rendering disabled");
        }

        log.warn("{} for {}, falling back to rendered session", staticFailure, url);
        return acquireRendered(url, staticFailure);
    }

    private AcquiredContent acquireRendered(String url, String staticFailure) {
        try (RenderSession session = renderSessionFactory.open()) {
            RenderedPage page = session.render(url, properties.getRender().getTimeout());
            HtmlContentExtractor.Extraction extraction = extractor.extract(page.html(), url);

            if (extraction.text().isEmpty()) {
                throw new AcquireException(url,
                        "Failed to acquire " + url + ": " + staticFailure + ", rendered page had no content");
            }

            String title = extraction.title().isEmpty() && page.title() != null
                    ? page.title().trim()
                    : extraction.title();
            log.debug("Dynamic extraction succeeded for {} ({} chars)", url, extraction.length());
            return new AcquiredContent(url, extraction.text(), title, AcquisitionMethod.DYNAMIC);
        } catch (AcquireException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AcquireException(url,
                    "Failed to acquire " + url + ": " + staticFailure + ", render failed: " + e.getMessage(), e);
        }
    }
}
