package com.maturityplatform.assessment.controller;

import com.maturityplatform.assessment.dto.DesignPilotRequest;
import com.maturityplatform.assessment.dto.ExecutionLogRequest;
import com.maturityplatform.assessment.dto.PilotDTO;
import com.maturityplatform.assessment.dto.PilotStatusRequest;
import com.maturityplatform.assessment.service.PilotService;
import com.maturityplatform.common.pilot.PilotValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import static com.maturityplatform.assessment.controller.AssessmentController.TENANT_HEADER;

/**
 * Pilot accelerator: design, status transitions and weekly execution logging.
 */
@RestController
@RequestMapping("/api/v1/pilots")
public class PilotController {

    private static final Logger log = LoggerFactory.getLogger(PilotController.class);

    private final PilotService pilotService;

    public PilotController(PilotService pilotService) {
        this.pilotService = pilotService;
    }

    @PostMapping("/design")
    public Mono<ResponseEntity<PilotDTO>> design(@RequestHeader(TENANT_HEADER) String tenantId,
                                                 @RequestBody DesignPilotRequest request) {
        log.info("Pilot design received. tenant={}", tenantId);
        return pilotService.design(tenantId, request)
            .map(p -> ResponseEntity.status(HttpStatus.CREATED).body(pilotService.toDTO(p)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<PilotDTO>> get(@RequestHeader(TENANT_HEADER) String tenantId,
                                              @PathVariable Long id) {
        return pilotService.get(tenantId, id)
            .map(p -> ResponseEntity.ok(pilotService.toDTO(p)));
    }

    @GetMapping("/{id}/validation")
    public Mono<ResponseEntity<PilotValidationReport>> validation(@RequestHeader(TENANT_HEADER) String tenantId,
                                                                  @PathVariable Long id) {
        return pilotService.validation(tenantId, id)
            .map(ResponseEntity::ok);
    }

    @PutMapping("/{id}/status")
    public Mono<ResponseEntity<PilotDTO>> transition(@RequestHeader(TENANT_HEADER) String tenantId,
                                                     @PathVariable Long id,
                                                     @RequestBody PilotStatusRequest request) {
        log.info("Pilot status change requested. id={} tenant={} target={}",
            id, tenantId, request == null ? null : request.status());
        return pilotService.transition(tenantId, id, request)
            .map(p -> ResponseEntity.ok(pilotService.toDTO(p)));
    }

    @PostMapping("/{id}/execution-log")
    public Mono<ResponseEntity<PilotDTO>> logExecution(@RequestHeader(TENANT_HEADER) String tenantId,
                                                       @PathVariable Long id,
                                                       @RequestBody ExecutionLogRequest request) {
        return pilotService.logExecution(tenantId, id, request)
            .map(p -> ResponseEntity.ok(pilotService.toDTO(p)));
    }
}
