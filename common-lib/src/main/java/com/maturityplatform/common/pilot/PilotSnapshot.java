package com.maturityplatform.common.pilot;

import com.maturityplatform.common.model.PilotStatus;

import java.time.Instant;
import java.util.List;

/** Read-only view of a pilot as the engine sees it. */
public record PilotSnapshot(
    Long id,
    String tenantId,
    Long assessmentId,
    Long roadmapId,
    PilotStatus status,
    PilotDesign design,
    List<ExecutionLogEntry> executionLog,
    Instant startedAt,
    Instant closedAt
) {
    public PilotSnapshot {
        executionLog = executionLog == null ? List.of() : List.copyOf(executionLog);
    }
}
