package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for POST /api/v1/assessments.
 *
 * @param dimensionWeights optional override of the default table; must cover all five dimensions
 */
public record CreateAssessmentRequest(
    @JsonProperty("organizationName") String organizationName,
    @JsonProperty("industry")         String industry,
    @JsonProperty("organizationSize") String organizationSize,
    @JsonProperty("dimensionWeights") Map<String, Double> dimensionWeights,
    @JsonProperty("metadata")         Map<String, Object> metadata
) {}
