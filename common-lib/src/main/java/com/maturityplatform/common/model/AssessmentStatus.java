package com.maturityplatform.common.model;

public enum AssessmentStatus {
    DRAFT,
    IN_PROGRESS,
    COMPLETED;

    /** Scoring is only reachable from a non-completed status. */
    public boolean isScorable() {
        return this != COMPLETED;
    }
}
