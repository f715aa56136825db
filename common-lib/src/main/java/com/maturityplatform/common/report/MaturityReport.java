package com.maturityplatform.common.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.benchmark.BenchmarkComparison;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.DimensionScores;
import com.maturityplatform.common.model.MaturityLevel;
import com.maturityplatform.common.model.PilotStatus;
import com.maturityplatform.common.pilot.RiskSignal;
import com.maturityplatform.common.roadmap.Initiative;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Composed, read-mostly artifact. References its sources by identity and embeds
 * the computed values; regenerable, never edited.
 *
 * @param pilotId     {@code null} when no pilot was included
 * @param pilotStatus {@code null} when no pilot was included
 * @param pilotRisk   {@code null} when no pilot was included
 */
public record MaturityReport(
    @JsonProperty("reportType") ReportType reportType,
    @JsonProperty("assessmentId") Long assessmentId,
    @JsonProperty("tenantId") String tenantId,
    @JsonProperty("roadmapId") Long roadmapId,
    @JsonProperty("pilotId") Long pilotId,
    @JsonProperty("industry") String industry,
    @JsonProperty("scores") DimensionScores scores,
    @JsonProperty("maturityLevel") MaturityLevel maturityLevel,
    @JsonProperty("dimensionLevels") Map<Dimension, MaturityLevel> dimensionLevels,
    @JsonProperty("strongestDimension") Dimension strongestDimension,
    @JsonProperty("weakestDimension") Dimension weakestDimension,
    @JsonProperty("benchmark") BenchmarkComparison benchmark,
    @JsonProperty("targetMaturityLevel") int targetMaturityLevel,
    @JsonProperty("initiatives") List<Initiative> initiatives,
    @JsonProperty("pilotStatus") PilotStatus pilotStatus,
    @JsonProperty("pilotRisk") RiskSignal pilotRisk,
    @JsonProperty("generatedAt") Instant generatedAt
) {
    public MaturityReport {
        dimensionLevels = Collections.unmodifiableMap(new EnumMap<>(dimensionLevels));
        initiatives = List.copyOf(initiatives);
    }
}
