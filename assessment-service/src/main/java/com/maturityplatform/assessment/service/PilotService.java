package com.maturityplatform.assessment.service;

import com.maturityplatform.assessment.dto.DesignPilotRequest;
import com.maturityplatform.assessment.dto.ExecutionLogRequest;
import com.maturityplatform.assessment.dto.PilotDTO;
import com.maturityplatform.assessment.dto.PilotStatusRequest;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.model.Pilot;
import com.maturityplatform.assessment.repository.PilotRepository;
import com.maturityplatform.common.event.MaturityEvent;
import com.maturityplatform.common.event.MaturityEventPublisher;
import com.maturityplatform.common.event.MaturityEventType;
import com.maturityplatform.common.exception.ConcurrencyException;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.PilotStatus;
import com.maturityplatform.common.pilot.ExecutionLogEntry;
import com.maturityplatform.common.pilot.ExecutionLogUpdate;
import com.maturityplatform.common.pilot.PilotDesign;
import com.maturityplatform.common.pilot.PilotSnapshot;
import com.maturityplatform.common.pilot.PilotStateMachine;
import com.maturityplatform.common.pilot.PilotTransition;
import com.maturityplatform.common.pilot.PilotValidationReport;
import com.maturityplatform.common.pilot.PilotValidator;
import com.maturityplatform.common.pilot.ReportedHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pilot accelerator workflow: design, gated approval, execution and weekly logging.
 *
 * <p>Every write is version-checked against the pilot row. Two competing transitions
 * on the same observed status cannot both apply; the loser gets a retryable
 * {@link ConcurrencyException}.
 */
@Service
public class PilotService {

    private static final Logger log = LoggerFactory.getLogger(PilotService.class);

    private final PilotRepository pilotRepository;
    private final RoadmapService roadmapService;
    private final PilotValidator validator;
    private final PilotStateMachine stateMachine;
    private final MaturityMapper mapper;
    private final MaturityEventPublisher eventPublisher;
    private final Clock clock;

    public PilotService(PilotRepository pilotRepository,
                        RoadmapService roadmapService,
                        PilotValidator validator,
                        PilotStateMachine stateMachine,
                        MaturityMapper mapper,
                        MaturityEventPublisher eventPublisher,
                        Clock clock) {
        this.pilotRepository = pilotRepository;
        this.roadmapService  = roadmapService;
        this.validator       = validator;
        this.stateMachine    = stateMachine;
        this.mapper          = mapper;
        this.eventPublisher  = eventPublisher;
        this.clock           = clock;
    }

    /**
     * Stores a new pilot in {@code DESIGNED}. A design that fails the approval gate is
     * rejected with {@link ValidationException} and nothing is stored.
     */
    public Mono<Pilot> design(String tenantId, DesignPilotRequest request) {
        return Mono.fromCallable(() -> toDesign(request))
            .flatMap(design -> roadmapService.get(tenantId, request.roadmapId())
                .flatMap(roadmap -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    Pilot p = new Pilot();
                    p.setTenantId(tenantId);
                    p.setAssessmentId(roadmap.getAssessmentId());
                    p.setRoadmapId(roadmap.getId());
                    p.setStatus(PilotStatus.DESIGNED.name());
                    p.setTitle(design.title());
                    p.setDimension(design.dimension().key());
                    p.setDurationWeeks(design.durationWeeks());
                    p.setDesign(mapper.write(design));
                    p.setExecutionLog(mapper.write(List.of()));
                    p.setAtRisk(false);
                    p.setCreatedAt(now);
                    p.setUpdatedAt(now);
                    return pilotRepository.save(p);
                }))
            .doOnSuccess(p -> {
                log.info("Pilot designed. id={} roadmapId={} tenant={} dimension={}",
                    p.getId(), p.getRoadmapId(), tenantId, p.getDimension());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("assessmentId", p.getAssessmentId());
                payload.put("roadmapId", p.getRoadmapId());
                payload.put("dimension", p.getDimension());
                payload.put("durationWeeks", p.getDurationWeeks());
                eventPublisher.publish(new MaturityEvent(MaturityEventType.PILOT_DESIGNED,
                    p.getId(), tenantId, payload, clock.instant()));
            })
            .doOnError(e -> log.warn("Pilot design rejected. tenant={} reason={}", tenantId, e.getMessage()));
    }

    public Mono<Pilot> get(String tenantId, Long id) {
        return pilotRepository.findByIdAndTenantId(id, tenantId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Pilot " + id + " not found")));
    }

    /** Current gate report of the stored design. */
    public Mono<PilotValidationReport> validation(String tenantId, Long id) {
        return get(tenantId, id).map(p -> validator.validate(mapper.designOf(p)));
    }

    public Mono<Pilot> transition(String tenantId, Long id, PilotStatusRequest request) {
        return Mono.fromCallable(() -> {
                if (request == null) {
                    throw new ValidationException("status is required");
                }
                return PilotStatus.fromKey(request.status());
            })
            .flatMap(target -> get(tenantId, id).flatMap(p -> {
                PilotTransition t = stateMachine.transition(mapper.toSnapshot(p), target);
                LocalDateTime now = LocalDateTime.now(clock);
                p.setStatus(t.to().name());
                p.setUpdatedAt(now);
                if (t.to() == PilotStatus.IN_PROGRESS) {
                    p.setStartedAt(now);
                }
                if (t.to().isTerminal()) {
                    p.setClosedAt(now);
                }
                return pilotRepository.save(p).doOnSuccess(saved -> publishStatusChange(saved, t));
            }))
            .onErrorResume(OptimisticLockingFailureException.class, e -> Mono.error(
                new ConcurrencyException("Pilot " + id + " was modified concurrently; retry the request", e)))
            .doOnError(e -> log.warn("Pilot transition rejected. id={} tenant={} reason={}",
                id, tenantId, e.getMessage()));
    }

    /**
     * Appends one weekly entry and recomputes the advisory at-risk flag. The flag
     * never changes the pilot status.
     */
    public Mono<Pilot> logExecution(String tenantId, Long id, ExecutionLogRequest request) {
        if (request == null) {
            return Mono.error(new ValidationException("Request body is required"));
        }
        return get(tenantId, id)
            .flatMap(p -> {
                PilotSnapshot snapshot = mapper.toSnapshot(p);
                Instant now = clock.instant();
                int weekIndex = request.weekIndex() != null
                    ? request.weekIndex()
                    : PilotStateMachine.weekIndexAt(snapshot.startedAt(), now);
                boolean hasBlockers = request.blockers() != null && !request.blockers().isEmpty();
                ReportedHealth health = request.health() != null
                    ? ReportedHealth.fromKey(request.health())
                    : hasBlockers ? ReportedHealth.BLOCKED : ReportedHealth.ON_TRACK;

                ExecutionLogUpdate update = stateMachine.appendLogEntry(snapshot, new ExecutionLogEntry(
                    weekIndex, health, request.metrics(), request.blockers(), request.notes(), now));

                p.setExecutionLog(mapper.write(update.executionLog()));
                p.setAtRisk(update.risk().atRisk());
                p.setUpdatedAt(MaturityMapper.toLocal(now));
                return pilotRepository.save(p).doOnSuccess(saved -> {
                    if (update.risk().atRisk()) {
                        log.warn("Pilot at risk. id={} tenant={} week={} reasons={}",
                            id, tenantId, weekIndex, update.risk().reasons());
                    } else {
                        log.info("Execution logged. id={} tenant={} week={} health={}",
                            id, tenantId, weekIndex, health.key());
                    }
                });
            })
            .onErrorResume(OptimisticLockingFailureException.class, e -> Mono.error(
                new ConcurrencyException("Pilot " + id + " was modified concurrently; retry the request", e)))
            .doOnError(e -> log.warn("Execution log rejected. id={} tenant={} reason={}",
                id, tenantId, e.getMessage()));
    }

    public PilotDTO toDTO(Pilot p) {
        PilotSnapshot snapshot = mapper.toSnapshot(p);
        List<String> allowed = stateMachine.allowedTargets(snapshot.status()).stream()
            .map(PilotStatus::key)
            .toList();
        return new PilotDTO(p.getId(), p.getAssessmentId(), p.getRoadmapId(), snapshot.status().key(),
            snapshot.design(), validator.validate(snapshot.design()), snapshot.executionLog(),
            stateMachine.assessRisk(snapshot.design().successCriteria(), snapshot.executionLog()),
            allowed, p.getCreatedAt(), p.getUpdatedAt(), p.getStartedAt(), p.getClosedAt());
    }

    private void publishStatusChange(Pilot p, PilotTransition t) {
        log.info("Pilot status changed. id={} tenant={} from={} to={}",
            p.getId(), p.getTenantId(), t.from().key(), t.to().key());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("assessmentId", p.getAssessmentId());
        payload.put("roadmapId", p.getRoadmapId());
        payload.put("fromStatus", t.from().key());
        payload.put("toStatus", t.to().key());
        eventPublisher.publish(new MaturityEvent(MaturityEventType.PILOT_STATUS_CHANGED,
            p.getId(), p.getTenantId(), payload, clock.instant()));
    }

    private PilotDesign toDesign(DesignPilotRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        List<String> violations = new ArrayList<>();
        if (request.roadmapId() == null) {
            violations.add("roadmapId is required");
        }
        if (request.title() == null || request.title().isBlank()) {
            violations.add("title is required");
        }
        Dimension dimension = null;
        try {
            dimension = Dimension.fromKey(request.dimension());
        } catch (ValidationException e) {
            violations.add(e.getMessage());
        }
        int duration = request.durationWeeks() != null
            ? request.durationWeeks()
            : PilotDesign.DEFAULT_DURATION_WEEKS;
        if (duration < 1) {
            violations.add("durationWeeks must be >= 1, got " + duration);
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid pilot design", violations);
        }
        PilotDesign design = new PilotDesign(request.title().trim(), dimension, duration,
            request.successCriteria(), request.failureModes(), request.stakeholders(),
            request.resourceRequirements());
        validator.requireValid(design);
        return design;
    }
}
