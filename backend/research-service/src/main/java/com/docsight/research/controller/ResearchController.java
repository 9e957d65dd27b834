package com.docsight.research.controller;

import com.docsight.research.config.ResearchProperties;
import com.docsight.research.dto.ClassificationResponse;
import com.docsight.research.dto.CoordinateRequest;
import com.docsight.research.dto.CoordinateResponse;
import com.docsight.research.dto.DomainResearchRequest;
import com.docsight.research.dto.FindingPayload;
import com.docsight.research.dto.MergeRequest;
import com.docsight.research.model.DomainCategory;
import com.docsight.research.model.Finding;
import com.docsight.research.model.ResearchTopic;
import com.docsight.research.service.DomainResearcher;
import com.docsight.research.service.FindingMergeService;
import com.docsight.research.service.ResearchCoordinator;
import com.docsight.research.service.SourceAuthorityClassifier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
public class ResearchController {

    private final ResearchCoordinator coordinator;
    private final DomainResearcher domainResearcher;
    private final FindingMergeService mergeService;
    private final SourceAuthorityClassifier classifier;
    private final ResearchProperties properties;

    /**
     * POST /api/v1/research/coordinate - 여러 도메인 병렬 리서치
     */
    @PostMapping("/coordinate")
    public Mono<ResponseEntity<CoordinateResponse>> coordinate(@Valid @RequestBody CoordinateRequest request) {
        List<DomainCategory> domains = request.domains().isEmpty()
                ? Arrays.asList(DomainCategory.values())
                : request.domains().stream().map(DomainCategory::fromName).toList();
        int concurrency = request.concurrency() != null
                ? request.concurrency()
                : properties.getCoordinator().getConcurrency();

        return coordinator.coordinateAsync(request.topic(), domains, concurrency, request.constraints())
                .map(results -> ResponseEntity.ok(CoordinateResponse.from(request.topic().trim(), results)));
    }

    /**
     * POST /api/v1/research/domain - 단일 도메인 리서치
     */
    @PostMapping("/domain")
    public Mono<ResponseEntity<List<Finding>>> researchDomain(@Valid @RequestBody DomainResearchRequest request) {
        ResearchTopic topic = new ResearchTopic(
                request.topic(), DomainCategory.fromName(request.domain()), request.constraints());

        return Mono.fromCallable(() -> domainResearcher.researchDomain(topic))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    /**
     * POST /api/v1/research/merge - 수동/자동 결과 병합
     */
    @PostMapping("/merge")
    public ResponseEntity<List<Finding>> merge(@RequestBody MergeRequest request) {
        List<Finding> automated = request.automated().stream()
                .filter(Objects::nonNull)
                .map(this::toFinding)
                .toList();
        return ResponseEntity.ok(mergeService.mergeManual(automated, request.manual()));
    }

    /**
     * GET /api/v1/research/classify - URL 신뢰도 분류
     */
    @GetMapping("/classify")
    public ResponseEntity<ClassificationResponse> classify(
            @RequestParam String url,
            @RequestParam(defaultValue = "false") boolean verified) {
        return ResponseEntity.ok(new ClassificationResponse(url, verified, classifier.classify(url, verified)));
    }

    private Finding toFinding(FindingPayload payload) {
        Finding finding = classifier.assess(payload.content(), payload.title(), payload.sourceUrl(),
                payload.domainCategory(), payload.verifiedWithOfficial(), payload.method());
        payload.alternateSources().forEach(finding::addAlternateSource);
        return finding;
    }
}
