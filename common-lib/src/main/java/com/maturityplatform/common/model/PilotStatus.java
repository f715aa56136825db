package com.maturityplatform.common.model;

import com.maturityplatform.common.exception.ValidationException;

import java.util.Locale;

public enum PilotStatus {
    DESIGNED,
    APPROVED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PilotStatus fromKey(String key) {
        if (key != null) {
            for (PilotStatus s : values()) {
                if (s.key().equalsIgnoreCase(key.trim())) {
                    return s;
                }
            }
        }
        throw new ValidationException("Unknown pilot status '" + key + "'");
    }
}
