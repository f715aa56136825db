package com.maturityplatform.common.pilot;

import java.util.List;

/**
 * Result of appending one entry: the full log to persist and the risk signal
 * recomputed over it.
 */
public record ExecutionLogUpdate(
    ExecutionLogEntry appended,
    List<ExecutionLogEntry> executionLog,
    RiskSignal risk
) {
    public ExecutionLogUpdate {
        executionLog = List.copyOf(executionLog);
    }
}
