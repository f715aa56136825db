package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/roadmaps/generate.
 *
 * @param horizonMonths optional; defaults to {@code maturity.roadmap.horizon-months}
 */
public record GenerateRoadmapRequest(
    @JsonProperty("assessmentId")  Long assessmentId,
    @JsonProperty("horizonMonths") Integer horizonMonths
) {}
