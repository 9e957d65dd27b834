package com.docsight.research.service;

import com.docsight.research.config.ResearchProperties;
import com.docsight.research.exception.ResearchConfigurationException;
import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.DomainResult;
import com.docsight.research.model.Finding;
import com.docsight.research.model.ResearchTopic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one {@link DomainResearcher} per category with a bound on how many run at
 * once.
 *
 * Bounding units bounds simultaneous render sessions; more than about five at once
 * risks resource exhaustion. A unit that throws becomes a failed
 * {@link DomainResult} at its own boundary and never affects its siblings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchCoordinator {

    private final DomainResearcher domainResearcher;
    private final ResearchProperties properties;

    /**
     * Researches every category with the configured concurrency.
     */
    public Map<DomainCategory, DomainResult> coordinate(String topic,
                                                         Collection<DomainCategory> categories,
                                                         Map<String, String> constraints) {
        return coordinate(topic, categories, properties.getCoordinator().getConcurrency(), constraints);
    }

    /**
     * Blocks until every unit has settled. Partial results are a normal outcome.
     *
     * @throws ResearchConfigurationException on a blank topic, no categories, or a
     *                                        concurrency outside [1, 10]
     */
    public Map<DomainCategory, DomainResult> coordinate(String topic,
                                                         Collection<DomainCategory> categories,
                                                         int concurrency,
                                                         Map<String, String> constraints) {
        return coordinateAsync(topic, categories, concurrency, constraints).block();
    }

    public Mono<Map<DomainCategory, DomainResult>> coordinateAsync(String topic,
                                                                   Collection<DomainCategory> categories,
                                                                   int concurrency,
                                                                   Map<String, String> constraints) {
        List<DomainCategory> domains = validate(topic, categories, concurrency);
        ResearchTopic base = new ResearchTopic(topic.trim(), null, constraints);

        log.info("[coordinator] Starting multi-domain research for: {}", base.topic());
        log.info("[coordinator] Concurrency limit: {} of {} domains", concurrency, domains.size());

        return Flux.fromIterable(domains)
                .flatMap(domain -> researchUnit(base.withDomain(domain)), concurrency)
                .collectMap(DomainResult::domainCategory, result -> result,
                        () -> new EnumMap<>(DomainCategory.class))
                .doOnNext(results -> {
                    int total = results.values().stream().mapToInt(r -> r.findings().size()).sum();
                    long failed = results.values().stream().filter(DomainResult::isFailed).count();
                    log.info("[coordinator] Completed multi-domain research: {} total findings, {} failed domain(s)",
                            total, failed);
                });
    }

    private Mono<DomainResult> researchUnit(ResearchTopic researchTopic) {
        DomainCategory domain = researchTopic.domainCategory();
        return Mono.fromCallable(() -> {
                    log.info("[{}] Starting research for: {}", domain, researchTopic.topic());
                    List<Finding> findings = domainResearcher.researchDomain(researchTopic);
                    log.info("[{}] Found {} sources", domain, findings.size());
                    return DomainResult.succeeded(domain, findings);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("[{}] Research failed: {}", domain, e.getMessage(), e);
                    String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    return Mono.just(DomainResult.failed(domain, reason));
                });
    }

    private List<DomainCategory> validate(String topic, Collection<DomainCategory> categories, int concurrency) {
        if (topic == null || topic.isBlank()) {
            throw ResearchConfigurationException.blankTopic();
        }
        if (concurrency < ResearchProperties.MIN_CONCURRENCY || concurrency > ResearchProperties.MAX_CONCURRENCY) {
            throw ResearchConfigurationException.invalidConcurrency(
                    concurrency, ResearchProperties.MIN_CONCURRENCY, ResearchProperties.MAX_CONCURRENCY);
        }
        if (categories == null || categories.isEmpty()) {
            throw new ResearchConfigurationException("At least one domain category is required");
        }
        if (categories.stream().anyMatch(Objects::isNull)) {
            throw ResearchConfigurationException.missingDomain();
        }
        return new ArrayList<>(new LinkedHashSet<>(categories));
    }
}
