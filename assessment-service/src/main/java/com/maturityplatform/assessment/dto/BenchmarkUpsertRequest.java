package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for PUT /api/v1/benchmarks. Replaces the distribution of an
 * existing (industry, metric, period) row or inserts a new one.
 */
public record BenchmarkUpsertRequest(
    @JsonProperty("industry")   String industry,
    @JsonProperty("metric")     String metric,
    @JsonProperty("period")     String period,
    @JsonProperty("peerScores") List<Double> peerScores
) {}
