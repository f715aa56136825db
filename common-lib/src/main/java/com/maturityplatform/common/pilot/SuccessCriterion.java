package com.maturityplatform.common.pilot;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Quantifiable target a pilot commits to before approval.
 *
 * @param targetValue {@code null} when the submitted target was not numeric
 */
public record SuccessCriterion(
    @JsonProperty("metricName") String metricName,
    @JsonProperty("targetValue") Double targetValue,
    @JsonProperty("measurementMethod") String measurementMethod
) {}
