package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.pilot.FailureMode;
import com.maturityplatform.common.pilot.SuccessCriterion;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/pilots/design. An incomplete design is stored
 * as {@code designed}; the approval gate runs on the status change to approved.
 *
 * @param durationWeeks optional; defaults to 8
 */
public record DesignPilotRequest(
    @JsonProperty("roadmapId")            Long roadmapId,
    @JsonProperty("title")                String title,
    @JsonProperty("dimension")            String dimension,
    @JsonProperty("durationWeeks")        Integer durationWeeks,
    @JsonProperty("successCriteria")      List<SuccessCriterion> successCriteria,
    @JsonProperty("failureModes")         List<FailureMode> failureModes,
    @JsonProperty("stakeholders")         Map<String, String> stakeholders,
    @JsonProperty("resourceRequirements") Map<String, Object> resourceRequirements
) {}
