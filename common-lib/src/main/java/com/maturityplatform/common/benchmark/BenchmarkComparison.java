package com.maturityplatform.common.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.model.Dimension;

import java.util.List;

/**
 * Full peer comparison of a completed assessment.
 *
 * @param topGaps   up to three dimensions below the peer median, largest gap first
 * @param strengths dimensions at or above the peer median, in declaration order
 */
public record BenchmarkComparison(
    @JsonProperty("assessmentId") Long assessmentId,
    @JsonProperty("industry") String industry,
    @JsonProperty("overall") PercentileResult overall,
    @JsonProperty("overallPeerMedian") double overallPeerMedian,
    @JsonProperty("dimensions") List<DimensionComparison> dimensions,
    @JsonProperty("topGaps") List<Dimension> topGaps,
    @JsonProperty("strengths") List<Dimension> strengths
) {
    public BenchmarkComparison {
        dimensions = List.copyOf(dimensions);
        topGaps = List.copyOf(topGaps);
        strengths = List.copyOf(strengths);
    }
}
