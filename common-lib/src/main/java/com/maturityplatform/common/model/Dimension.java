package com.maturityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.maturityplatform.common.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The five fixed maturity categories.
 *
 * <p>Declaration order is significant: it is the deterministic tie-break order
 * for roadmap priorities and strongest/weakest dimension selection.
 */
public enum Dimension {
    DATA,
    PROCESS,
    PEOPLE,
    TECHNOLOGY,
    GOVERNANCE;

    /** Lower-case wire key, e.g. {@code "data"}. */
    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Dimension fromKey(String key) {
        if (key != null) {
            for (Dimension d : values()) {
                if (d.key().equalsIgnoreCase(key.trim())) {
                    return d;
                }
            }
        }
        throw new ValidationException("Unknown dimension '" + key + "'. Must be one of: "
            + Arrays.stream(values()).map(Dimension::key).collect(Collectors.joining(", ")));
    }
}
