package com.maturityplatform.common.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.maturityplatform.common.exception.ValidationException;

import java.util.Locale;

public enum ReportType {
    EXECUTIVE_SUMMARY,
    DETAILED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReportType fromKey(String key) {
        if (key == null || key.isBlank()) {
            return EXECUTIVE_SUMMARY;
        }
        for (ReportType t : values()) {
            if (t.key().equalsIgnoreCase(key.trim())) {
                return t;
            }
        }
        throw new ValidationException("Unknown report type '" + key
            + "'. Must be one of: executive_summary, detailed");
    }
}
