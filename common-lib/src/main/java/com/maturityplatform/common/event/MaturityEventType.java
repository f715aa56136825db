package com.maturityplatform.common.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MaturityEventType {
    ASSESSMENT_CREATED("assessment.created"),
    ASSESSMENT_COMPLETED("assessment.completed"),
    ROADMAP_GENERATED("roadmap.generated"),
    PILOT_DESIGNED("pilot.designed"),
    PILOT_STATUS_CHANGED("pilot.status_changed"),
    REPORT_GENERATED("report.generated");

    private final String wireName;

    MaturityEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
