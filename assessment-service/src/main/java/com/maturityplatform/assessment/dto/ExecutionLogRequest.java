package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/pilots/{id}/execution-log.
 *
 * @param weekIndex optional; derived from the pilot start date when omitted
 * @param health    on_track | at_risk | blocked
 */
public record ExecutionLogRequest(
    @JsonProperty("weekIndex") Integer weekIndex,
    @JsonProperty("health")    String health,
    @JsonProperty("metrics")   Map<String, Double> metrics,
    @JsonProperty("blockers")  List<String> blockers,
    @JsonProperty("notes")     String notes
) {}
