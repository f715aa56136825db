package com.maturityplatform.assessment.service;

import com.maturityplatform.assessment.dto.AssessmentPageDTO;
import com.maturityplatform.assessment.dto.CreateAssessmentRequest;
import com.maturityplatform.assessment.dto.DetailedScoresDTO;
import com.maturityplatform.assessment.dto.DimensionScoreDetail;
import com.maturityplatform.assessment.dto.ResponseItem;
import com.maturityplatform.assessment.dto.SubmitResponsesRequest;
import com.maturityplatform.assessment.dto.SubmitResponsesResult;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.model.Assessment;
import com.maturityplatform.assessment.model.AssessmentResponse;
import com.maturityplatform.assessment.model.OrganizationSize;
import com.maturityplatform.assessment.repository.AssessmentRepository;
import com.maturityplatform.assessment.repository.AssessmentResponseRepository;
import com.maturityplatform.common.classifier.MaturityClassifier;
import com.maturityplatform.common.event.MaturityEvent;
import com.maturityplatform.common.event.MaturityEventPublisher;
import com.maturityplatform.common.event.MaturityEventType;
import com.maturityplatform.common.exception.ConcurrencyException;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentStatus;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.DimensionScores;
import com.maturityplatform.common.model.MaturityLevel;
import com.maturityplatform.common.scoring.DimensionScorer;
import com.maturityplatform.common.weighting.DimensionWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Assessment intake and scoring.
 *
 * <p>Response submission and scoring both write the assessment row under its
 * {@code @Version} column, so a score computation never commits against a
 * response set that changed after it was read. The losing writer gets a
 * {@link StateException} when the row is completed by now, otherwise a
 * retryable {@link ConcurrencyException}.
 */
@Service
public class AssessmentService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final AssessmentRepository assessmentRepository;
    private final AssessmentResponseRepository responseRepository;
    private final DimensionScorer scorer;
    private final MaturityClassifier classifier;
    private final MaturityMapper mapper;
    private final MaturityEventPublisher eventPublisher;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    public AssessmentService(AssessmentRepository assessmentRepository,
                             AssessmentResponseRepository responseRepository,
                             DimensionScorer scorer,
                             MaturityClassifier classifier,
                             MaturityMapper mapper,
                             MaturityEventPublisher eventPublisher,
                             TransactionalOperator transactionalOperator,
                             Clock clock) {
        this.assessmentRepository  = assessmentRepository;
        this.responseRepository    = responseRepository;
        this.scorer                = scorer;
        this.classifier            = classifier;
        this.mapper                = mapper;
        this.eventPublisher        = eventPublisher;
        this.transactionalOperator = transactionalOperator;
        this.clock                 = clock;
    }

    /**
     * Creates an assessment in {@code DRAFT}.
     */
    public Mono<Assessment> create(String tenantId, CreateAssessmentRequest request) {
        return Mono.fromCallable(() -> toNewAssessment(tenantId, request))
            .flatMap(assessmentRepository::save)
            .doOnSuccess(a -> {
                log.info("Assessment created. id={} tenant={} industry={} size={}",
                    a.getId(), tenantId, a.getIndustry(), a.getOrganizationSize());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("organizationName", a.getOrganizationName());
                payload.put("industry", a.getIndustry());
                payload.put("organizationSize", a.getOrganizationSize());
                eventPublisher.publish(new MaturityEvent(MaturityEventType.ASSESSMENT_CREATED,
                    a.getId(), tenantId, payload, clock.instant()));
            })
            .doOnError(e -> log.warn("Assessment create rejected. tenant={} reason={}", tenantId, e.getMessage()));
    }

    public Mono<Assessment> get(String tenantId, Long id) {
        return assessmentRepository.findByIdAndTenantId(id, tenantId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Assessment " + id + " not found")));
    }

    /**
     * Lists the tenant's assessments, newest first.
     *
     * @param status optional filter: draft | in_progress | completed
     * @param page   1-based page number
     */
    public Mono<AssessmentPageDTO> list(String tenantId, String status, int page, int pageSize) {
        if (page < 1 || pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            return Mono.error(new ValidationException("page must be >= 1 and pageSize in 1.." + MAX_PAGE_SIZE));
        }
        Flux<Assessment> rows;
        if (status == null || status.isBlank()) {
            rows = assessmentRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
        } else {
            AssessmentStatus filter;
            try {
                filter = AssessmentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return Mono.error(new ValidationException("Unknown assessment status '" + status
                    + "'. Must be one of: draft, in_progress, completed"));
            }
            rows = assessmentRepository.findByTenantIdAndStatusOrderByCreatedAtDesc(tenantId, filter.name());
        }
        return rows.collectList()
            .map(all -> {
                int from = (int) Math.min((long) (page - 1) * pageSize, all.size());
                int to = Math.min(from + pageSize, all.size());
                return new AssessmentPageDTO(
                    all.subList(from, to).stream().map(mapper::toDTO).toList(),
                    all.size(), page, pageSize);
            });
    }

    /**
     * Stores answers in one transaction. A question answered again replaces its
     * earlier answer. The first submission moves the assessment to {@code IN_PROGRESS}.
     */
    public Mono<SubmitResponsesResult> submitResponses(String tenantId, Long id, SubmitResponsesRequest request) {
        return Mono.fromCallable(() -> validateResponses(request))
            .flatMap(items -> get(tenantId, id).flatMap(a -> {
                if (AssessmentStatus.COMPLETED.name().equals(a.getStatus())) {
                    return Mono.error(new StateException("Assessment " + id
                        + " is completed; responses are immutable"));
                }
                LocalDateTime now = now();
                a.setStatus(AssessmentStatus.IN_PROGRESS.name());
                a.setResponsesUpdatedAt(now);
                a.setUpdatedAt(now);

                List<AssessmentResponse> rows = items.stream().map(i -> toRow(id, i, now)).toList();
                List<String> questionIds = rows.stream().map(AssessmentResponse::getQuestionId).toList();

                Mono<SubmitResponsesResult> write = assessmentRepository.save(a)
                    .flatMap(saved -> responseRepository.deleteByAssessmentIdAndQuestionIds(id, questionIds)
                        .thenMany(responseRepository.saveAll(rows))
                        .then(Mono.just(new SubmitResponsesResult(id, rows.size(),
                            MaturityMapper.statusKey(saved.getStatus())))));
                return write.as(transactionalOperator::transactional);
            }))
            .onErrorResume(OptimisticLockingFailureException.class, e -> conflict(tenantId, id, e))
            .doOnSuccess(r -> log.info("Responses submitted. assessmentId={} tenant={} count={}",
                id, tenantId, r.submittedCount()))
            .doOnError(e -> log.warn("Response submission rejected. assessmentId={} tenant={} reason={}",
                id, tenantId, e.getMessage()));
    }

    /**
     * Scores the assessment from its stored responses and completes it. A second
     * call fails with {@link StateException}; completed scores are never recomputed.
     */
    public Mono<Assessment> score(String tenantId, Long id) {
        return get(tenantId, id)
            .flatMap(a -> responseRepository.findByAssessmentIdOrderByIdAsc(id)
                .map(mapper::toDimensionResponse)
                .collectList()
                .flatMap(responses -> {
                    DimensionScores scores = scorer.score(mapper.toSnapshot(a), responses, mapper.weightsOf(a));
                    MaturityLevel level = classifier.classify(scores.overallScore());
                    LocalDateTime now = now();
                    mapper.applyScores(a, scores, level);
                    a.setStatus(AssessmentStatus.COMPLETED.name());
                    a.setCompletedAt(now);
                    a.setUpdatedAt(now);
                    return assessmentRepository.save(a);
                }))
            .onErrorResume(OptimisticLockingFailureException.class, e -> conflict(tenantId, id, e))
            .doOnSuccess(a -> {
                log.info("Assessment scored. id={} tenant={} overall={} level={}",
                    a.getId(), tenantId, a.getOverallScore(), a.getMaturityLevel());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("overallScore", a.getOverallScore());
                payload.put("maturityLevel", a.getMaturityLevel());
                payload.put("maturityLabel", a.getMaturityLabel());
                payload.put("dimensionScores", mapper.toDTO(a).dimensionScores());
                eventPublisher.publish(new MaturityEvent(MaturityEventType.ASSESSMENT_COMPLETED,
                    a.getId(), tenantId, payload, clock.instant()));
            })
            .doOnError(e -> log.warn("Scoring rejected. assessmentId={} tenant={} reason={}",
                id, tenantId, e.getMessage()));
    }

    /**
     * Per-dimension breakdown with each dimension's own maturity band and response count.
     */
    public Mono<DetailedScoresDTO> detailedScores(String tenantId, Long id) {
        return get(tenantId, id)
            .flatMap(a -> responseRepository.findByAssessmentIdOrderByIdAsc(id)
                .collectList()
                .map(responses -> {
                    Map<Dimension, Integer> counts = new EnumMap<>(Dimension.class);
                    for (AssessmentResponse r : responses) {
                        counts.merge(Dimension.fromKey(r.getDimension()), 1, Integer::sum);
                    }
                    DimensionWeights weights = mapper.weightsOf(a);
                    Map<String, Double> scores = mapper.toDTO(a).dimensionScores();

                    Map<String, DimensionScoreDetail> details = new LinkedHashMap<>();
                    for (Dimension d : Dimension.values()) {
                        Double score = scores == null ? null : scores.get(d.key());
                        MaturityLevel level = score == null ? null : classifier.classify(score);
                        details.put(d.key(), new DimensionScoreDetail(score, weights.weight(d),
                            level == null ? null : level.level(),
                            level == null ? null : level.label(),
                            counts.getOrDefault(d, 0)));
                    }
                    return new DetailedScoresDTO(a.getId(), a.getOrganizationName(),
                        MaturityMapper.statusKey(a.getStatus()), a.getOverallScore(),
                        a.getMaturityLevel(), a.getMaturityLabel(), details, a.getCompletedAt());
                }));
    }

    // ── Concurrency ─────────────────────────────────────────────────────────

    private <T> Mono<T> conflict(String tenantId, Long id, OptimisticLockingFailureException e) {
        return get(tenantId, id).flatMap(current -> {
            if (AssessmentStatus.COMPLETED.name().equals(current.getStatus())) {
                log.info("Lost scoring race; assessment already completed. id={} tenant={}", id, tenantId);
                return Mono.<T>error(new StateException("Assessment " + id
                    + " was completed concurrently; scores are immutable"));
            }
            log.info("Stale assessment version. id={} tenant={}", id, tenantId);
            return Mono.<T>error(new ConcurrencyException("Assessment " + id
                + " was modified concurrently; retry the request", e));
        });
    }

    // ── Validation and mapping ──────────────────────────────────────────────

    private Assessment toNewAssessment(String tenantId, CreateAssessmentRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        List<String> violations = new ArrayList<>();
        if (isBlank(request.organizationName())) {
            violations.add("organizationName is required");
        }
        if (isBlank(request.industry())) {
            violations.add("industry is required");
        }
        OrganizationSize size = null;
        try {
            size = OrganizationSize.fromKey(request.organizationSize());
        } catch (ValidationException e) {
            violations.addAll(e.getViolations());
        }
        DimensionWeights weights = null;
        if (request.dimensionWeights() != null) {
            try {
                weights = DimensionWeights.fromKeys(request.dimensionWeights());
            } catch (ValidationException e) {
                violations.addAll(e.getViolations());
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid assessment", violations);
        }

        LocalDateTime now = now();
        Assessment a = new Assessment();
        a.setTenantId(tenantId);
        a.setOrganizationName(request.organizationName().trim());
        a.setIndustry(request.industry().trim().toLowerCase(Locale.ROOT));
        a.setOrganizationSize(size.key());
        a.setStatus(AssessmentStatus.DRAFT.name());
        a.setDimensionWeights(weights == null ? null : mapper.write(weights.asKeyMap()));
        a.setMetadata(mapper.write(request.metadata() == null ? Map.of() : request.metadata()));
        a.setCreatedAt(now);
        a.setUpdatedAt(now);
        return a;
    }

    private static List<ResponseItem> validateResponses(SubmitResponsesRequest request) {
        if (request == null || request.responses() == null || request.responses().isEmpty()) {
            throw new ValidationException("At least one response is required");
        }
        List<String> violations = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<ResponseItem> items = request.responses();
        for (int i = 0; i < items.size(); i++) {
            ResponseItem item = items.get(i);
            String ref = "Response #" + (i + 1);
            if (isBlank(item.questionId())) {
                violations.add(ref + " has no questionId");
            } else if (!seen.add(item.questionId())) {
                violations.add(ref + " repeats questionId " + item.questionId());
            }
            try {
                Dimension.fromKey(item.dimension());
            } catch (ValidationException e) {
                violations.add(ref + ": " + e.getMessage());
            }
            Double value = item.numericScore();
            if (value == null || value.isNaN() || value < 0.0 || value > 100.0) {
                violations.add(ref + " numericScore " + value + " is outside [0,100]");
            }
            if (item.weight() != null && (item.weight().isNaN() || item.weight() < 0.0)) {
                violations.add(ref + " weight " + item.weight() + " must be non-negative");
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid responses", violations);
        }
        return items;
    }

    private static AssessmentResponse toRow(Long assessmentId, ResponseItem item, LocalDateTime now) {
        AssessmentResponse r = new AssessmentResponse();
        r.setAssessmentId(assessmentId);
        r.setQuestionId(item.questionId().trim());
        r.setDimension(Dimension.fromKey(item.dimension()).key());
        r.setNumericScore(item.numericScore());
        r.setWeight(item.weight());
        r.setResponseValue(item.responseValue());
        r.setCreatedAt(now);
        return r;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
