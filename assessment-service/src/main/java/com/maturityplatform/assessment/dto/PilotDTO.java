package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.pilot.ExecutionLogEntry;
import com.maturityplatform.common.pilot.PilotDesign;
import com.maturityplatform.common.pilot.PilotValidationReport;
import com.maturityplatform.common.pilot.RiskSignal;

import java.time.LocalDateTime;
import java.util.List;

/**
 * API response record for pilot data, with the current gate report, the
 * advisory risk signal and the statuses reachable from here.
 */
public record PilotDTO(
    @JsonProperty("id")                 Long id,
    @JsonProperty("assessmentId")       Long assessmentId,
    @JsonProperty("roadmapId")          Long roadmapId,
    @JsonProperty("status")             String status,
    @JsonProperty("design")             PilotDesign design,
    @JsonProperty("validation")         PilotValidationReport validation,
    @JsonProperty("executionLog")       List<ExecutionLogEntry> executionLog,
    @JsonProperty("risk")               RiskSignal risk,
    @JsonProperty("allowedTransitions") List<String> allowedTransitions,
    @JsonProperty("createdAt")          LocalDateTime createdAt,
    @JsonProperty("updatedAt")          LocalDateTime updatedAt,
    @JsonProperty("startedAt")          LocalDateTime startedAt,
    @JsonProperty("closedAt")           LocalDateTime closedAt
) {}
