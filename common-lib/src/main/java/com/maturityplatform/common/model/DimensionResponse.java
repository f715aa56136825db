package com.maturityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One answered question.
 *
 * @param questionId identifier of the question within the questionnaire
 * @param dimension  owning dimension
 * @param value      raw score, expected in [0,100]
 * @param weight     within-dimension weight; {@code null} means equal weight
 */
public record DimensionResponse(
    @JsonProperty("questionId") String questionId,
    @JsonProperty("dimension") Dimension dimension,
    @JsonProperty("value") double value,
    @JsonProperty("weight") Double weight
) {
    public static final double DEFAULT_WEIGHT = 1.0;

    public double effectiveWeight() {
        return weight != null ? weight : DEFAULT_WEIGHT;
    }
}
