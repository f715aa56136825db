package com.maturityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A discrete maturity band, e.g. {@code (3, "Defined")}. */
public record MaturityLevel(
    @JsonProperty("level") int level,
    @JsonProperty("label") String label
) {
    public static final int MAX_LEVEL = 5;
}
