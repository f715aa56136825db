package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-dimension breakdown. {@code score}, {@code level} and {@code label} are null
 * until the assessment is scored.
 */
public record DimensionScoreDetail(
    @JsonProperty("score")         Double score,
    @JsonProperty("weight")        double weight,
    @JsonProperty("level")         Integer level,
    @JsonProperty("label")         String label,
    @JsonProperty("responseCount") int responseCount
) {}
