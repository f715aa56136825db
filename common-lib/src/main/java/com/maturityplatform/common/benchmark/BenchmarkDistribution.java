package com.maturityplatform.common.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Peer score distribution for one (industry, metric) pair. Read-only for the
 * engine; refreshed out-of-band.
 */
public record BenchmarkDistribution(
    @JsonProperty("industry") String industry,
    @JsonProperty("metric") BenchmarkMetric metric,
    @JsonProperty("period") String period,
    @JsonProperty("peerScores") List<Double> peerScores
) {
    public BenchmarkDistribution {
        peerScores = peerScores == null ? List.of() : List.copyOf(peerScores);
    }

    public int peerCount() {
        return peerScores.size();
    }

    /** Median of the peer scores; {@code NaN} when there are none. */
    public double median() {
        if (peerScores.isEmpty()) {
            return Double.NaN;
        }
        double[] sorted = peerScores.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
