package com.maturityplatform.assessment.controller;

import com.maturityplatform.assessment.dto.AssessmentDTO;
import com.maturityplatform.assessment.dto.AssessmentPageDTO;
import com.maturityplatform.assessment.dto.CreateAssessmentRequest;
import com.maturityplatform.assessment.dto.DetailedScoresDTO;
import com.maturityplatform.assessment.dto.SubmitResponsesRequest;
import com.maturityplatform.assessment.dto.SubmitResponsesResult;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.service.AssessmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Assessment intake, response submission and scoring.
 */
@RestController
@RequestMapping("/api/v1/assessments")
public class AssessmentController {

    private static final Logger log = LoggerFactory.getLogger(AssessmentController.class);

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final AssessmentService assessmentService;
    private final MaturityMapper mapper;

    public AssessmentController(AssessmentService assessmentService, MaturityMapper mapper) {
        this.assessmentService = assessmentService;
        this.mapper = mapper;
    }

    @PostMapping
    public Mono<ResponseEntity<AssessmentDTO>> create(@RequestHeader(TENANT_HEADER) String tenantId,
                                                      @RequestBody CreateAssessmentRequest request) {
        log.info("Create assessment requested. tenant={}", tenantId);
        return assessmentService.create(tenantId, request)
            .map(a -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDTO(a)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<AssessmentDTO>> get(@RequestHeader(TENANT_HEADER) String tenantId,
                                                   @PathVariable Long id) {
        return assessmentService.get(tenantId, id)
            .map(a -> ResponseEntity.ok(mapper.toDTO(a)));
    }

    @GetMapping
    public Mono<ResponseEntity<AssessmentPageDTO>> list(@RequestHeader(TENANT_HEADER) String tenantId,
                                                        @RequestParam(required = false) String status,
                                                        @RequestParam(defaultValue = "1") int page,
                                                        @RequestParam(defaultValue = "20") int pageSize) {
        log.info("Assessment list query. tenant={} status={} page={} pageSize={}", tenantId, status, page, pageSize);
        return assessmentService.list(tenantId, status, page, pageSize)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/responses")
    public Mono<ResponseEntity<SubmitResponsesResult>> submitResponses(@RequestHeader(TENANT_HEADER) String tenantId,
                                                                       @PathVariable Long id,
                                                                       @RequestBody SubmitResponsesRequest request) {
        log.info("Response submission received. assessmentId={} tenant={}", id, tenantId);
        return assessmentService.submitResponses(tenantId, id, request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/score")
    public Mono<ResponseEntity<AssessmentDTO>> score(@RequestHeader(TENANT_HEADER) String tenantId,
                                                     @PathVariable Long id) {
        log.info("Scoring requested. assessmentId={} tenant={}", id, tenantId);
        return assessmentService.score(tenantId, id)
            .map(a -> ResponseEntity.ok(mapper.toDTO(a)));
    }

    @GetMapping("/{id}/score")
    public Mono<ResponseEntity<DetailedScoresDTO>> detailedScores(@RequestHeader(TENANT_HEADER) String tenantId,
                                                                  @PathVariable Long id) {
        return assessmentService.detailedScores(tenantId, id)
            .map(ResponseEntity::ok);
    }
}
