package com.maturityplatform.common.benchmark;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Percentile standing of one score.
 *
 * @param percentile value in [0,100]
 * @param peerCount  number of peer observations the percentile was computed from
 */
@JsonIgnoreProperties(value = "statisticallyWeak", allowGetters = true)
public record PercentileResult(
    @JsonProperty("metric") BenchmarkMetric metric,
    @JsonProperty("score") double score,
    @JsonProperty("percentile") double percentile,
    @JsonProperty("peerCount") int peerCount
) {
    /** Below this many peers a percentile is statistically weak (still reported). */
    public static final int MIN_RELIABLE_PEER_COUNT = 5;

    @JsonProperty("statisticallyWeak")
    public boolean statisticallyWeak() {
        return peerCount < MIN_RELIABLE_PEER_COUNT;
    }
}
