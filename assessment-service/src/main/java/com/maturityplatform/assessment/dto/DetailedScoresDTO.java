package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * API response for GET /api/v1/assessments/{id}/score.
 */
public record DetailedScoresDTO(
    @JsonProperty("assessmentId")     Long assessmentId,
    @JsonProperty("organizationName") String organizationName,
    @JsonProperty("status")           String status,
    @JsonProperty("overallScore")     Double overallScore,
    @JsonProperty("maturityLevel")    Integer maturityLevel,
    @JsonProperty("maturityLabel")    String maturityLabel,
    @JsonProperty("dimensions")       Map<String, DimensionScoreDetail> dimensions,
    @JsonProperty("completedAt")      LocalDateTime completedAt
) {}
