package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record BenchmarkDTO(
    @JsonProperty("id")         Long id,
    @JsonProperty("industry")   String industry,
    @JsonProperty("metric")     String metric,
    @JsonProperty("period")     String period,
    @JsonProperty("peerCount")  int peerCount,
    @JsonProperty("peerMedian") double peerMedian,
    @JsonProperty("peerScores") List<Double> peerScores,
    @JsonProperty("updatedAt")  LocalDateTime updatedAt
) {}
