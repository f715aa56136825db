package com.maturityplatform.common.benchmark;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.Dimension;

import java.util.Locale;

/** What a benchmark distribution measures: the overall score or one dimension. */
public enum BenchmarkMetric {
    OVERALL(null),
    DATA(Dimension.DATA),
    PROCESS(Dimension.PROCESS),
    PEOPLE(Dimension.PEOPLE),
    TECHNOLOGY(Dimension.TECHNOLOGY),
    GOVERNANCE(Dimension.GOVERNANCE);

    private final Dimension dimension;

    BenchmarkMetric(Dimension dimension) {
        this.dimension = dimension;
    }

    /** {@code null} for {@link #OVERALL}. */
    public Dimension dimension() {
        return dimension;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BenchmarkMetric of(Dimension dimension) {
        return valueOf(dimension.name());
    }

    @JsonCreator
    public static BenchmarkMetric fromKey(String key) {
        if (key != null) {
            for (BenchmarkMetric m : values()) {
                if (m.key().equalsIgnoreCase(key.trim())) {
                    return m;
                }
            }
        }
        throw new ValidationException("Unknown benchmark metric '" + key + "'");
    }
}
