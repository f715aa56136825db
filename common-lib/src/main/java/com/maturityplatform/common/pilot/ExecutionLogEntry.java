package com.maturityplatform.common.pilot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One weekly, append-only execution record.
 *
 * @param metrics  current measurements keyed by success-criterion metric name
 * @param blockers active blocker descriptions; empty when unblocked
 */
public record ExecutionLogEntry(
    @JsonProperty("weekIndex") int weekIndex,
    @JsonProperty("health") ReportedHealth health,
    @JsonProperty("metrics") Map<String, Double> metrics,
    @JsonProperty("blockers") List<String> blockers,
    @JsonProperty("notes") String notes,
    @JsonProperty("recordedAt") Instant recordedAt
) {
    public ExecutionLogEntry {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
    }

    public boolean hasBlockers() {
        return !blockers.isEmpty();
    }
}
