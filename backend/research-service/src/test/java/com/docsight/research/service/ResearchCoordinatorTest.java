package com.docsight.research.service;

import com.docsight.research.config.ResearchProperties;
import com.docsight.research.exception.ResearchConfigurationException;
import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.DomainResult;
import com.docsight.research.model.Finding;
import com.docsight.research.model.ResearchTopic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchCoordinatorTest {

    private static final List<DomainCategory> ALL = List.of(DomainCategory.values());

    @Mock
    private DomainResearcher domainResearcher;

    private ResearchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new ResearchCoordinator(domainResearcher, new ResearchProperties());
    }

    private static Finding finding(DomainCategory domain) {
        return new SourceAuthorityClassifier().assess("content for " + domain, domain.name(),
                "https://docs.example.dev/" + domain.name(), domain, false, null);
    }

    @Test
    @DisplayName("한 도메인의 실패는 다른 도메인 결과에 영향을 주지 않는다")
    void isolatesFailures() {
        // given
        when(domainResearcher.researchDomain(any())).thenAnswer(invocation -> {
            ResearchTopic topic = invocation.getArgument(0);
            if (topic.domainCategory() == DomainCategory.FEATURES) {
                throw new IllegalStateException("browser crashed");
            }
            return List.of(finding(topic.domainCategory()));
        });

        // when
        Map<DomainCategory, DomainResult> results = coordinator.coordinate("react", ALL, 2, Map.of());

        // then
        assertThat(results).containsOnlyKeys(DomainCategory.values());
        assertThat(results.get(DomainCategory.FEATURES).isFailed()).isTrue();
        assertThat(results.get(DomainCategory.FEATURES).error()).isEqualTo("browser crashed");
        assertThat(results.get(DomainCategory.FEATURES).findings()).isEmpty();
        assertThat(results.values()).filteredOn(r -> !r.isFailed()).hasSize(3)
                .allSatisfy(r -> assertThat(r.findings()).hasSize(1));
    }

    @Test
    @DisplayName("동시성 2로 4개 도메인을 돌리면 두 묶음 시간만큼 걸린다")
    void boundsConcurrency() {
        // given
        long unitMillis = 300;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(domainResearcher.researchDomain(any())).thenAnswer(invocation -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(unitMillis);
            } finally {
                inFlight.decrementAndGet();
            }
            return List.of();
        });

        // when
        long start = System.nanoTime();
        Map<DomainCategory, DomainResult> results = coordinator.coordinate("react", ALL, 2, Map.of());
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        // then
        assertThat(results).hasSize(4);
        assertThat(maxInFlight.get()).isEqualTo(2);
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(2 * unitMillis).isLessThan(4 * unitMillis);
    }

    @Test
    @DisplayName("도메인마다 같은 주제와 제약 조건이 전달되고 중복 도메인은 한 번만 실행된다")
    void passesTopicAndConstraints() {
        // given
        when(domainResearcher.researchDomain(any())).thenReturn(List.of());
        ArgumentCaptor<ResearchTopic> captor = ArgumentCaptor.forClass(ResearchTopic.class);

        // when
        Map<DomainCategory, DomainResult> results = coordinator.coordinate(" react ",
                Arrays.asList(DomainCategory.STACK, DomainCategory.STACK, DomainCategory.PITFALLS),
                Map.of("technology_stack", "react"));

        // then
        verify(domainResearcher, times(2)).researchDomain(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(t -> {
            assertThat(t.topic()).isEqualTo("react");
            assertThat(t.constraints()).containsEntry("technology_stack", "react");
        });
        assertThat(captor.getAllValues()).extracting(ResearchTopic::domainCategory)
                .containsExactlyInAnyOrder(DomainCategory.STACK, DomainCategory.PITFALLS);
        assertThat(results.keySet()).isEqualTo(EnumSet.of(DomainCategory.STACK, DomainCategory.PITFALLS));
        assertThat(results.values()).noneMatch(DomainResult::isFailed);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 11})
    @DisplayName("범위를 벗어난 동시성은 작업 전에 거부된다")
    void rejectsInvalidConcurrency(int concurrency) {
        assertThatThrownBy(() -> coordinator.coordinate("react", ALL, concurrency, Map.of()))
                .isInstanceOf(ResearchConfigurationException.class)
                .hasMessageContaining("Concurrency must be between 1 and 10");
        verifyNoInteractions(domainResearcher);
    }

    @Test
    @DisplayName("빈 주제와 빈 도메인 목록은 거부된다")
    void rejectsBlankTopicAndNoDomains() {
        assertThatThrownBy(() -> coordinator.coordinate(" ", ALL, Map.of()))
                .isInstanceOf(ResearchConfigurationException.class);
        assertThatThrownBy(() -> coordinator.coordinate("react", List.of(), Map.of()))
                .isInstanceOf(ResearchConfigurationException.class);
        assertThatThrownBy(() -> coordinator.coordinate("react", Arrays.asList(DomainCategory.STACK, null), Map.of()))
                .isInstanceOf(ResearchConfigurationException.class);
        verifyNoInteractions(domainResearcher);
    }
}
