package com.maturityplatform.common.roadmap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.maturityplatform.common.exception.ValidationException;

import java.util.Locale;

/** Effort metadata carried by an initiative template. Ordered smallest first. */
public enum EffortTier {
    SMALL,
    MEDIUM,
    LARGE;

    /**
     * <pre>
     *   ≤ SMALL → QUICK_WIN
     *   MEDIUM  → MID_TERM
     *   LARGE   → STRATEGIC
     * </pre>
     */
    public TimeframeBucket timeframe() {
        if (compareTo(SMALL) <= 0) {
            return TimeframeBucket.QUICK_WIN;
        }
        return this == MEDIUM ? TimeframeBucket.MID_TERM : TimeframeBucket.STRATEGIC;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EffortTier fromKey(String key) {
        if (key != null) {
            for (EffortTier t : values()) {
                if (t.key().equalsIgnoreCase(key.trim())) {
                    return t;
                }
            }
        }
        throw new ValidationException("Unknown effort tier '" + key + "'");
    }
}
