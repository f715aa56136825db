package com.maturityplatform.common.classifier;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of the maturity threshold table; {@code lowerBound} is inclusive. */
public record MaturityBand(
    @JsonProperty("level") int level,
    @JsonProperty("label") String label,
    @JsonProperty("lowerBound") double lowerBound
) {}
