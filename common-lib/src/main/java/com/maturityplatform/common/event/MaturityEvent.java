package com.maturityplatform.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fact published after a state change has been committed.
 *
 * @param entityId id of the entity the event is about (assessment, roadmap, pilot or report)
 * @param payload  event-specific computed fields
 */
public record MaturityEvent(
    @JsonProperty("eventType") MaturityEventType eventType,
    @JsonProperty("entityId") Long entityId,
    @JsonProperty("tenantId") String tenantId,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("occurredAt") Instant occurredAt
) {
    public MaturityEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
