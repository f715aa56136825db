package com.maturityplatform.assessment.controller;

import com.maturityplatform.assessment.dto.GenerateRoadmapRequest;
import com.maturityplatform.assessment.dto.RoadmapDTO;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.service.RoadmapService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import static com.maturityplatform.assessment.controller.AssessmentController.TENANT_HEADER;

@RestController
@RequestMapping("/api/v1/roadmaps")
public class RoadmapController {

    private static final Logger log = LoggerFactory.getLogger(RoadmapController.class);

    private final RoadmapService roadmapService;
    private final MaturityMapper mapper;

    public RoadmapController(RoadmapService roadmapService, MaturityMapper mapper) {
        this.roadmapService = roadmapService;
        this.mapper = mapper;
    }

    @PostMapping("/generate")
    public Mono<ResponseEntity<RoadmapDTO>> generate(@RequestHeader(TENANT_HEADER) String tenantId,
                                                     @RequestBody GenerateRoadmapRequest request) {
        log.info("Roadmap generation requested. tenant={}", tenantId);
        return roadmapService.generate(tenantId, request)
            .map(r -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDTO(r)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<RoadmapDTO>> get(@RequestHeader(TENANT_HEADER) String tenantId,
                                                @PathVariable Long id) {
        return roadmapService.get(tenantId, id)
            .map(r -> ResponseEntity.ok(mapper.toDTO(r)));
    }

    @PostMapping("/{id}/publish")
    public Mono<ResponseEntity<RoadmapDTO>> publish(@RequestHeader(TENANT_HEADER) String tenantId,
                                                    @PathVariable Long id) {
        log.info("Roadmap publish requested. id={} tenant={}", id, tenantId);
        return roadmapService.publish(tenantId, id)
            .map(r -> ResponseEntity.ok(mapper.toDTO(r)));
    }
}
