package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One answered question.
 *
 * @param numericScore value in [0,100]
 * @param weight       intra-dimension weight; omitted means equal weight
 */
public record ResponseItem(
    @JsonProperty("questionId")    String questionId,
    @JsonProperty("dimension")     String dimension,
    @JsonProperty("numericScore")  Double numericScore,
    @JsonProperty("weight")        Double weight,
    @JsonProperty("responseValue") String responseValue
) {}
