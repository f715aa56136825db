package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.roadmap.Initiative;

import java.time.LocalDateTime;
import java.util.List;

public record RoadmapDTO(
    @JsonProperty("id")                   Long id,
    @JsonProperty("assessmentId")         Long assessmentId,
    @JsonProperty("status")               String status,
    @JsonProperty("catalogVersion")       String catalogVersion,
    @JsonProperty("currentMaturityLevel") int currentMaturityLevel,
    @JsonProperty("targetMaturityLevel")  int targetMaturityLevel,
    @JsonProperty("horizonMonths")        int horizonMonths,
    @JsonProperty("initiatives")          List<Initiative> initiatives,
    @JsonProperty("quickWins")            List<Initiative> quickWins,
    @JsonProperty("generatedAt")          LocalDateTime generatedAt,
    @JsonProperty("publishedAt")          LocalDateTime publishedAt
) {}
