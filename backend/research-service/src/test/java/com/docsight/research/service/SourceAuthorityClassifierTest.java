package com.docsight.research.service;

import com.docsight.research.model.AcquisitionMethod;
import com.docsight.research.model.ConfidenceLevel;
import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.Finding;
import com.docsight.research.model.ManualFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SourceAuthorityClassifierTest {

    private final SourceAuthorityClassifier classifier = new SourceAuthorityClassifier();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "https://docs.example.dev/guide, HIGH",
            "https://react.dev/learn, HIGH",
            "https://github.com/owner/repo/docs/intro.md, HIGH",
            "https://www.python.org/docs/, HIGH",
            "https://vendor.example.com/official/handbook, HIGH",
            "HTTPS://DOCS.EXAMPLE.COM/API, HIGH",
            "https://developer.mozilla.org/en-US/docs/Web/CSS, MEDIUM",
            "https://stackoverflow.com/questions/1, MEDIUM",
            "https://cs.stanford.edu/notes, MEDIUM",
            "https://medium.com/@someone/post, LOW",
            "https://dev.to/someone/post, LOW",
            "https://some-random-blog.example.com/post, LOW",
            "https://example.com/page, UNVERIFIED",
            "http://docs.example.com/, UNVERIFIED"
    })
    @DisplayName("URL 패턴에 따라 신뢰 등급을 결정한다")
    void classifiesByUrl(String url, ConfidenceLevel expected) {
        assertThat(classifier.classify(url)).isEqualTo(expected);
    }

    @Test
    @DisplayName("공식 문서로 검증된 자료는 URL과 무관하게 HIGH")
    void verifiedIsAlwaysHigh() {
        assertThat(classifier.classify("https://medium.com/@someone/post", true)).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(classifier.classify(null, true)).isEqualTo(ConfidenceLevel.HIGH);
    }

    @Test
    @DisplayName("URL이 없으면 UNVERIFIED")
    void missingUrl() {
        assertThat(classifier.classify(null)).isEqualTo(ConfidenceLevel.UNVERIFIED);
        assertThat(classifier.classify("  ")).isEqualTo(ConfidenceLevel.UNVERIFIED);
    }

    @Test
    @DisplayName("assess는 등급이 매겨진 Finding을 만든다")
    void assessBuildsFinding() {
        Finding finding = classifier.assess("Hooks let you use state.", "Hooks",
                "https://react.dev/reference/react", DomainCategory.FEATURES, false, AcquisitionMethod.STATIC);

        assertThat(finding.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(finding.getDomainCategory()).isEqualTo(DomainCategory.FEATURES);
        assertThat(finding.getMethod()).isEqualTo(AcquisitionMethod.STATIC);
        assertThat(finding.getAlternateSources()).isEmpty();
    }

    @Test
    @DisplayName("Finding의 신뢰 등급은 생성 시 출처에서 계산된다")
    void findingDerivesConfidenceFromSource() {
        Finding blogPost = new Finding("Tips.", "Tips", "https://medium.com/@someone/tips",
                DomainCategory.PITFALLS, false, null, classifier);
        Finding verifiedPost = new Finding("Tips.", "Tips", "https://medium.com/@someone/tips",
                DomainCategory.PITFALLS, true, null, classifier);

        assertThat(blogPost.getConfidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
        assertThat(verifiedPost.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
    }

    @Test
    @DisplayName("수동 자료는 수집 방법 없이 평가된다")
    void assessManual() {
        ManualFinding manual = new ManualFinding("Use connection pooling.", "Pooling",
                "https://example.com/notes", DomainCategory.PITFALLS, true);

        Finding finding = classifier.assess(manual);

        assertThat(finding.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(finding.isVerifiedWithOfficial()).isTrue();
        assertThat(finding.getMethod()).isNull();
    }
}
