package com.docsight.research.service;

import com.docsight.research.model.AcquisitionMethod;
import com.docsight.research.model.ConfidenceLevel;
import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.Finding;
import com.docsight.research.model.ManualFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FindingMergeServiceTest {

    private static final String URL_A = "https://docs.example.com/a";

    private final SourceAuthorityClassifier classifier = new SourceAuthorityClassifier();
    private final FindingMergeService mergeService = new FindingMergeService(classifier, new ContentDeduplicator());

    private Finding automated(String content, String url) {
        return classifier.assess(content, "auto", url, DomainCategory.STACK, false, AcquisitionMethod.STATIC);
    }

    @Test
    @DisplayName("같은 URL이면 수동 자료가 이기고 자동 자료는 별도 항목으로 남지 않는다")
    void manualWinsOnSameUrl() {
        // given
        Finding auto = automated("Old capture of the page.", URL_A);
        ManualFinding manual = new ManualFinding("Curated summary.", "manual", URL_A, DomainCategory.STACK, false);

        // when
        List<Finding> merged = mergeService.mergeManual(List.of(auto), List.of(manual));

        // then
        assertThat(merged).singleElement().satisfies(f -> {
            assertThat(f.getContent()).isEqualTo("Curated summary.");
            assertThat(f.getTitle()).isEqualTo("manual");
            assertThat(f.getSourceUrl()).isEqualTo(URL_A);
            assertThat(f.getAlternateSources()).containsExactly(URL_A);
        });
        assertThat(merged).filteredOn(f -> f.getContent().equals("Old capture of the page.")).isEmpty();
    }

    @Test
    @DisplayName("같은 URL, 같은 내용이면 자동 자료의 대체 출처를 이어받는다")
    void sameContentCarriesAlternates() {
        Finding auto = automated("Same words.", URL_A);
        auto.addAlternateSource("https://docs.example.com/a-mirror");
        ManualFinding manual = new ManualFinding("same   WORDS.", "manual", URL_A, DomainCategory.STACK, false);

        List<Finding> merged = mergeService.mergeManual(List.of(auto), List.of(manual));

        assertThat(merged).singleElement().satisfies(f -> {
            assertThat(f.getTitle()).isEqualTo("manual");
            assertThat(f.getAlternateSources()).containsExactly("https://docs.example.com/a-mirror");
        });
    }

    @Test
    @DisplayName("다른 URL의 같은 내용은 하나로 합쳐진다")
    void contentDuplicatesAcrossUrlsFold() {
        Finding auto = automated("Shared text.", URL_A);
        ManualFinding manual = new ManualFinding("Shared text.", "manual",
                "https://docs.example.com/b", DomainCategory.STACK, false);

        List<Finding> merged = mergeService.mergeManual(List.of(auto), List.of(manual));

        assertThat(merged).singleElement().satisfies(f -> {
            assertThat(f.getSourceUrl()).isEqualTo(URL_A);
            assertThat(f.getAlternateSources()).containsExactly("https://docs.example.com/b");
        });
    }

    @Test
    @DisplayName("결과는 신뢰도 순으로 정렬되고 같은 등급은 입력 순서를 유지한다")
    void sortedByConfidence() {
        // given
        Finding low1 = automated("low one", "https://medium.com/@x/1");
        Finding unverified = automated("unverified", "https://example.com/");
        Finding high = automated("high", "https://docs.example.dev/");
        Finding low2 = automated("low two", "https://dev.to/x");
        ManualFinding verified = new ManualFinding("verified note", "note",
                "https://example.net/notes", DomainCategory.PITFALLS, true);

        // when
        List<Finding> merged = mergeService.mergeManual(List.of(low1, unverified, high, low2), List.of(verified));

        // then
        assertThat(merged).extracting(Finding::getConfidenceLevel).containsExactly(
                ConfidenceLevel.HIGH, ConfidenceLevel.HIGH, ConfidenceLevel.LOW, ConfidenceLevel.LOW,
                ConfidenceLevel.UNVERIFIED);
        assertThat(merged).extracting(Finding::getContent)
                .containsExactly("high", "verified note", "low one", "low two", "unverified");
    }

    @Test
    @DisplayName("URL이 없는 항목과 null 입력은 무시한다")
    void ignoresMissingInput() {
        ManualFinding noUrl = new ManualFinding("text", "t", null, DomainCategory.STACK, false);

        assertThat(mergeService.mergeManual(null, null)).isEmpty();
        assertThat(mergeService.mergeManual(List.of(), List.of(noUrl))).isEmpty();
    }
}
