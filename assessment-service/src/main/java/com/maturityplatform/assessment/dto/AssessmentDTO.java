package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * API response record for assessment data. Score fields are null until scored.
 */
public record AssessmentDTO(
    @JsonProperty("id")               Long id,
    @JsonProperty("tenantId")         String tenantId,
    @JsonProperty("organizationName") String organizationName,
    @JsonProperty("industry")         String industry,
    @JsonProperty("organizationSize") String organizationSize,
    @JsonProperty("status")           String status,
    @JsonProperty("overallScore")     Double overallScore,
    @JsonProperty("maturityLevel")    Integer maturityLevel,
    @JsonProperty("maturityLabel")    String maturityLabel,
    @JsonProperty("dimensionScores")  Map<String, Double> dimensionScores,
    @JsonProperty("dimensionWeights") Map<String, Double> dimensionWeights,
    @JsonProperty("metadata")         Map<String, Object> metadata,
    @JsonProperty("createdAt")        LocalDateTime createdAt,
    @JsonProperty("updatedAt")        LocalDateTime updatedAt,
    @JsonProperty("completedAt")      LocalDateTime completedAt
) {}
