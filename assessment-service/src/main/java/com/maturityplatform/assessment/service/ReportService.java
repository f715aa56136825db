package com.maturityplatform.assessment.service;

import com.maturityplatform.assessment.dto.GenerateReportRequest;
import com.maturityplatform.assessment.dto.ReportDTO;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.model.Pilot;
import com.maturityplatform.assessment.model.Report;
import com.maturityplatform.assessment.model.Roadmap;
import com.maturityplatform.assessment.repository.ReportRepository;
import com.maturityplatform.common.benchmark.BenchmarkComparison;
import com.maturityplatform.common.event.MaturityEvent;
import com.maturityplatform.common.event.MaturityEventPublisher;
import com.maturityplatform.common.event.MaturityEventType;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.report.MaturityReport;
import com.maturityplatform.common.report.ReportAssembler;
import com.maturityplatform.common.report.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles and stores report data. No layout is produced; the stored content is
 * the computed values a renderer needs.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final ReportRepository reportRepository;
    private final AssessmentService assessmentService;
    private final BenchmarkService benchmarkService;
    private final RoadmapService roadmapService;
    private final PilotService pilotService;
    private final ReportAssembler assembler;
    private final MaturityMapper mapper;
    private final MaturityEventPublisher eventPublisher;
    private final Clock clock;

    public ReportService(ReportRepository reportRepository,
                         AssessmentService assessmentService,
                         BenchmarkService benchmarkService,
                         RoadmapService roadmapService,
                         PilotService pilotService,
                         ReportAssembler assembler,
                         MaturityMapper mapper,
                         MaturityEventPublisher eventPublisher,
                         Clock clock) {
        this.reportRepository  = reportRepository;
        this.assessmentService = assessmentService;
        this.benchmarkService  = benchmarkService;
        this.roadmapService    = roadmapService;
        this.pilotService      = pilotService;
        this.assembler         = assembler;
        this.mapper            = mapper;
        this.eventPublisher    = eventPublisher;
        this.clock             = clock;
    }

    /**
     * Generates a report for a completed assessment. Without a roadmap id the latest
     * roadmap of the assessment is used; the pilot is optional.
     */
    public Mono<Report> generate(String tenantId, GenerateReportRequest request) {
        if (request == null || request.assessmentId() == null) {
            return Mono.error(new ValidationException("assessmentId is required"));
        }
        Long assessmentId = request.assessmentId();

        return Mono.fromCallable(() -> ReportType.fromKey(request.reportType()))
            .flatMap(type -> assessmentService.get(tenantId, assessmentId)
                .map(mapper::toSnapshot)
                .flatMap(snapshot -> {
                    snapshot.requireCompleted("generate report");
                    Mono<Roadmap> roadmap = request.roadmapId() != null
                        ? roadmapService.get(tenantId, request.roadmapId())
                        : roadmapService.latestFor(tenantId, assessmentId);
                    Mono<Optional<Pilot>> pilot = request.pilotId() != null
                        ? pilotService.get(tenantId, request.pilotId()).map(Optional::of)
                        : Mono.just(Optional.empty());
                    return Mono.zip(roadmap, pilot, benchmarkService.compare(snapshot))
                        .map(parts -> assemble(type, snapshot, parts.getT1(), parts.getT2(), parts.getT3()));
                }))
            .flatMap(content -> reportRepository.save(toEntity(tenantId, content)))
            .doOnSuccess(r -> {
                log.info("Report generated. id={} assessmentId={} tenant={} type={}",
                    r.getId(), assessmentId, tenantId, r.getReportType());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("assessmentId", assessmentId);
                payload.put("roadmapId", r.getRoadmapId());
                payload.put("pilotId", r.getPilotId());
                payload.put("reportType", r.getReportType());
                eventPublisher.publish(new MaturityEvent(MaturityEventType.REPORT_GENERATED,
                    r.getId(), tenantId, payload, clock.instant()));
            })
            .doOnError(e -> log.warn("Report generation rejected. assessmentId={} tenant={} reason={}",
                assessmentId, tenantId, e.getMessage()));
    }

    public Mono<Report> get(String tenantId, Long id) {
        return reportRepository.findByIdAndTenantId(id, tenantId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Report " + id + " not found")));
    }

    public ReportDTO toDTO(Report r) {
        return new ReportDTO(r.getId(), mapper.read(r.getContent(), MaturityReport.class), r.getGeneratedAt());
    }

    private MaturityReport assemble(ReportType type, AssessmentSnapshot snapshot, Roadmap roadmap,
                                    Optional<Pilot> pilot,
                                    BenchmarkComparison comparison) {
        return assembler.assemble(type, snapshot, comparison, roadmap.getId(), mapper.toPlan(roadmap),
            pilot.map(mapper::toSnapshot).orElse(null), clock.instant());
    }

    private Report toEntity(String tenantId, MaturityReport content) {
        Report r = new Report();
        r.setTenantId(tenantId);
        r.setAssessmentId(content.assessmentId());
        r.setRoadmapId(content.roadmapId());
        r.setPilotId(content.pilotId());
        r.setReportType(content.reportType().key());
        r.setContent(mapper.write(content));
        r.setGeneratedAt(MaturityMapper.toLocal(content.generatedAt()));
        return r;
    }
}
