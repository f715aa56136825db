package com.maturityplatform.common.model;

import com.maturityplatform.common.exception.StateException;

import java.time.Instant;
import java.util.Locale;

/**
 * Read-only view of an assessment as the engine sees it. The persistence layer
 * maps its rows onto this record; the engine never mutates it.
 *
 * @param scores        {@code null} until the assessment is scored
 * @param maturityLevel {@code null} until the assessment is scored
 */
public record AssessmentSnapshot(
    Long id,
    String tenantId,
    String industry,
    AssessmentStatus status,
    DimensionScores scores,
    MaturityLevel maturityLevel,
    Instant createdAt,
    Instant completedAt
) {
    public boolean isCompleted() {
        return status == AssessmentStatus.COMPLETED;
    }

    /**
     * @param operation used in the failure message, e.g. "generate roadmap"
     * @throws StateException when the assessment is not completed or carries no scores
     */
    public void requireCompleted(String operation) {
        if (!isCompleted() || scores == null || maturityLevel == null) {
            throw new StateException("Cannot " + operation + ": assessment " + id
                + " is " + (status == null ? "unknown" : status.name().toLowerCase(Locale.ROOT))
                + ", not completed");
        }
    }
}
