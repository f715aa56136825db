package com.maturityplatform.assessment.controller;

import com.maturityplatform.assessment.dto.GenerateReportRequest;
import com.maturityplatform.assessment.dto.ReportDTO;
import com.maturityplatform.assessment.service.ReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import static com.maturityplatform.assessment.controller.AssessmentController.TENANT_HEADER;

@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

    private static final Logger log = LoggerFactory.getLogger(ReportController.class);

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping("/generate")
    public Mono<ResponseEntity<ReportDTO>> generate(@RequestHeader(TENANT_HEADER) String tenantId,
                                                    @RequestBody GenerateReportRequest request) {
        log.info("Report generation requested. tenant={}", tenantId);
        return reportService.generate(tenantId, request)
            .map(r -> ResponseEntity.status(HttpStatus.CREATED).body(reportService.toDTO(r)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ReportDTO>> get(@RequestHeader(TENANT_HEADER) String tenantId,
                                               @PathVariable Long id) {
        return reportService.get(tenantId, id)
            .map(r -> ResponseEntity.ok(reportService.toDTO(r)));
    }
}
