package com.maturityplatform.assessment.controller;

import com.maturityplatform.assessment.dto.BenchmarkCompareRequest;
import com.maturityplatform.assessment.dto.BenchmarkDTO;
import com.maturityplatform.assessment.dto.BenchmarkUpsertRequest;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.service.BenchmarkService;
import com.maturityplatform.common.benchmark.BenchmarkComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static com.maturityplatform.assessment.controller.AssessmentController.TENANT_HEADER;

/**
 * Peer benchmarks. Distributions are shared across tenants; comparisons are tenant-scoped.
 */
@RestController
@RequestMapping("/api/v1/benchmarks")
public class BenchmarkController {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkController.class);

    private final BenchmarkService benchmarkService;
    private final MaturityMapper mapper;

    public BenchmarkController(BenchmarkService benchmarkService, MaturityMapper mapper) {
        this.benchmarkService = benchmarkService;
        this.mapper = mapper;
    }

    @PutMapping
    public Mono<ResponseEntity<BenchmarkDTO>> upsert(@RequestBody BenchmarkUpsertRequest request) {
        log.info("Benchmark upsert received. industry={} metric={}",
            request == null ? null : request.industry(), request == null ? null : request.metric());
        return benchmarkService.upsert(request)
            .map(b -> ResponseEntity.ok(mapper.toDTO(b)));
    }

    @GetMapping("/{industry}")
    public Flux<BenchmarkDTO> listByIndustry(@PathVariable String industry) {
        return benchmarkService.listByIndustry(industry).map(mapper::toDTO);
    }

    @PostMapping("/compare")
    public Mono<ResponseEntity<BenchmarkComparison>> compare(@RequestHeader(TENANT_HEADER) String tenantId,
                                                             @RequestBody BenchmarkCompareRequest request) {
        log.info("Benchmark comparison requested. tenant={}", tenantId);
        return benchmarkService.compare(tenantId, request == null ? null : request.assessmentId())
            .map(ResponseEntity::ok);
    }
}
