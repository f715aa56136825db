package com.maturityplatform.common.pilot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.maturityplatform.common.exception.ValidationException;

import java.util.Locale;

/** Health the pilot team reports with a weekly log entry. */
public enum ReportedHealth {
    ON_TRACK,
    AT_RISK,
    BLOCKED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReportedHealth fromKey(String key) {
        if (key != null) {
            for (ReportedHealth h : values()) {
                if (h.key().equalsIgnoreCase(key.trim())) {
                    return h;
                }
            }
        }
        throw new ValidationException("Unknown reported health '" + key
            + "'. Must be one of: on_track, at_risk, blocked");
    }
}
