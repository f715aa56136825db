package com.maturityplatform.assessment.service;

import com.maturityplatform.assessment.dto.GenerateRoadmapRequest;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.model.Roadmap;
import com.maturityplatform.assessment.repository.RoadmapRepository;
import com.maturityplatform.common.event.MaturityEvent;
import com.maturityplatform.common.event.MaturityEventPublisher;
import com.maturityplatform.common.event.MaturityEventType;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.roadmap.RoadmapGenerator;
import com.maturityplatform.common.roadmap.RoadmapPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generates roadmaps from completed assessments and publishes them.
 * Each generation stores a new draft row; earlier roadmaps are kept.
 */
@Service
public class RoadmapService {

    private static final Logger log = LoggerFactory.getLogger(RoadmapService.class);

    private final RoadmapRepository roadmapRepository;
    private final AssessmentService assessmentService;
    private final RoadmapGenerator generator;
    private final MaturityMapper mapper;
    private final MaturityEventPublisher eventPublisher;
    private final Clock clock;
    private final int defaultHorizonMonths;

    public RoadmapService(RoadmapRepository roadmapRepository,
                          AssessmentService assessmentService,
                          RoadmapGenerator generator,
                          MaturityMapper mapper,
                          MaturityEventPublisher eventPublisher,
                          Clock clock,
                          @Value("${maturity.roadmap.horizon-months:18}") int defaultHorizonMonths) {
        this.roadmapRepository    = roadmapRepository;
        this.assessmentService    = assessmentService;
        this.generator            = generator;
        this.mapper               = mapper;
        this.eventPublisher       = eventPublisher;
        this.clock                = clock;
        this.defaultHorizonMonths = defaultHorizonMonths;
    }

    public Mono<Roadmap> generate(String tenantId, GenerateRoadmapRequest request) {
        if (request == null || request.assessmentId() == null) {
            return Mono.error(new ValidationException("assessmentId is required"));
        }
        int horizon = request.horizonMonths() != null ? request.horizonMonths() : defaultHorizonMonths;
        Long assessmentId = request.assessmentId();

        return assessmentService.get(tenantId, assessmentId)
            .flatMap(a -> {
                RoadmapPlan plan = generator.generate(mapper.toSnapshot(a), mapper.weightsOf(a),
                    horizon, clock.instant());
                return roadmapRepository.save(mapper.toEntity(tenantId, plan));
            })
            .doOnSuccess(r -> {
                RoadmapPlan plan = mapper.toPlan(r);
                log.info("Roadmap generated. id={} assessmentId={} tenant={} initiatives={} target={}",
                    r.getId(), assessmentId, tenantId, plan.initiatives().size(), plan.targetMaturityLevel());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("assessmentId", assessmentId);
                payload.put("catalogVersion", r.getCatalogVersion());
                payload.put("initiativeCount", plan.initiatives().size());
                payload.put("quickWinCount", plan.quickWins().size());
                payload.put("targetMaturityLevel", plan.targetMaturityLevel());
                eventPublisher.publish(new MaturityEvent(MaturityEventType.ROADMAP_GENERATED,
                    r.getId(), tenantId, payload, clock.instant()));
            })
            .doOnError(e -> log.warn("Roadmap generation rejected. assessmentId={} tenant={} reason={}",
                assessmentId, tenantId, e.getMessage()));
    }

    public Mono<Roadmap> get(String tenantId, Long id) {
        return roadmapRepository.findByIdAndTenantId(id, tenantId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Roadmap " + id + " not found")));
    }

    /** Most recently generated roadmap of the assessment. */
    public Mono<Roadmap> latestFor(String tenantId, Long assessmentId) {
        return roadmapRepository.findFirstByAssessmentIdAndTenantIdOrderByGeneratedAtDesc(assessmentId, tenantId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException(
                "No roadmap generated for assessment " + assessmentId)));
    }

    /**
     * Flips a draft roadmap to published. Exactly one of several concurrent calls succeeds;
     * the others see {@link StateException}.
     */
    public Mono<Roadmap> publish(String tenantId, Long id) {
        return roadmapRepository.publishDraft(id, tenantId, LocalDateTime.now(clock))
            .flatMap(updated -> {
                if (updated == 0) {
                    return get(tenantId, id).flatMap(r -> Mono.<Roadmap>error(
                        new StateException("Roadmap " + id + " is already published")));
                }
                return get(tenantId, id);
            })
            .doOnSuccess(r -> log.info("Roadmap published. id={} tenant={}", id, tenantId))
            .doOnError(e -> log.warn("Roadmap publish rejected. id={} tenant={} reason={}",
                id, tenantId, e.getMessage()));
    }
}
