package com.maturityplatform.common.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.model.Dimension;

/** A dimension score positioned against its industry peers. */
public record DimensionComparison(
    @JsonProperty("dimension") Dimension dimension,
    @JsonProperty("standing") PercentileResult standing,
    @JsonProperty("peerMedian") double peerMedian,
    @JsonProperty("gap") double gap,
    @JsonProperty("aboveMedian") boolean aboveMedian
) {}
