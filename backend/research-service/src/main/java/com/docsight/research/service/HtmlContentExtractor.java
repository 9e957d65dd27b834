package com.docsight.research.service;

import com.docsight.research.config.ResearchProperties;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pulls main-content text out of HTML markup.
 *
 * Only the configured content regions count; a page whose text lives outside them
 * (typically a client-rendered shell) yields little or nothing, which is what
 * triggers the rendered fallback.
 */
@Component
@RequiredArgsConstructor
public class HtmlContentExtractor {

    private static final String NOISE_SELECTOR = "script, style, noscript, template";

    private final ResearchProperties properties;

    public Extraction extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return new Extraction("", "");
        }

        Document doc = Jsoup.parse(html, baseUrl != null ? baseUrl : "");
        doc.select(NOISE_SELECTOR).remove();

        String selector = String.join(", ", properties.getAcquisition().getSelectors());

        // 중첩된 영역(main > article)은 바깥 영역만 사용
        Set<Element> regions = new LinkedHashSet<>();
        for (Element element : doc.select(selector)) {
            if (element.parents().stream().noneMatch(regions::contains)) {
                regions.add(element);
            }
        }

        String text = regions.stream()
                .map(Element::text)
                .collect(Collectors.joining(" "));

        return new Extraction(normalizeText(text), normalizeText(doc.title()));
    }

    /**
     * 공백을 정리하여 텍스트를 정규화
     */
    static String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    public record Extraction(String text, String title) {

        public int length() {
            return text.length();
        }
    }
}
