package com.maturityplatform.common.roadmap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Output of one {@link RoadmapGenerator} run. Initiatives are ordered by
 * descending priority; regeneration produces a new plan.
 *
 * @param targetMaturityLevel overall level the plan works towards (current + 1, capped at the top level)
 */
@JsonIgnoreProperties(value = "quickWins", allowGetters = true)
public record RoadmapPlan(
    @JsonProperty("assessmentId") Long assessmentId,
    @JsonProperty("catalogVersion") String catalogVersion,
    @JsonProperty("currentMaturityLevel") int currentMaturityLevel,
    @JsonProperty("targetMaturityLevel") int targetMaturityLevel,
    @JsonProperty("horizonMonths") int horizonMonths,
    @JsonProperty("initiatives") List<Initiative> initiatives,
    @JsonProperty("generatedAt") Instant generatedAt
) {
    public RoadmapPlan {
        initiatives = List.copyOf(initiatives);
    }

    @JsonProperty("quickWins")
    public List<Initiative> quickWins() {
        return initiatives.stream()
            .filter(i -> i.timeframe() == TimeframeBucket.QUICK_WIN)
            .toList();
    }
}
