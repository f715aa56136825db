package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/reports/generate.
 *
 * @param roadmapId  optional; latest roadmap of the assessment when omitted
 * @param pilotId    optional
 * @param reportType executive_summary (default) | detailed
 */
public record GenerateReportRequest(
    @JsonProperty("assessmentId") Long assessmentId,
    @JsonProperty("roadmapId")    Long roadmapId,
    @JsonProperty("pilotId")      Long pilotId,
    @JsonProperty("reportType")   String reportType
) {}
