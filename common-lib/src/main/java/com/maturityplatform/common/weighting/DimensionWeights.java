package com.maturityplatform.common.weighting;

import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.Dimension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validated per-dimension weight table. Covers all five dimensions, every
 * weight is non-negative and the total is 1.0 within {@value #SUM_TOLERANCE}.
 */
public final class DimensionWeights {

    public static final double SUM_TOLERANCE = 0.001;

    public static final DimensionWeights DEFAULT = of(Map.of(
        Dimension.DATA,       0.25,
        Dimension.PROCESS,    0.20,
        Dimension.PEOPLE,     0.20,
        Dimension.TECHNOLOGY, 0.20,
        Dimension.GOVERNANCE, 0.15
    ));

    private final Map<Dimension, Double> weights;

    private DimensionWeights(Map<Dimension, Double> weights) {
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    /**
     * @throws ValidationException naming every problem with the table
     */
    public static DimensionWeights of(Map<Dimension, Double> weights) {
        if (weights == null) {
            throw new ValidationException("Dimension weights are required");
        }
        List<String> violations = new ArrayList<>();
        double sum = 0.0;
        for (Dimension d : Dimension.values()) {
            Double w = weights.get(d);
            if (w == null) {
                violations.add("Missing weight for dimension '" + d.key() + "'");
            } else if (w.isNaN() || w < 0.0) {
                violations.add("Weight for dimension '" + d.key() + "' must be non-negative, got " + w);
            } else {
                sum += w;
            }
        }
        if (violations.isEmpty() && Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            violations.add(String.format(Locale.ROOT, "Dimension weights must sum to 1.0, got %.3f", sum));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid dimension weights", violations);
        }
        return new DimensionWeights(weights);
    }

    /** Builds from wire keys ({@code "data"}, {@code "process"}, ...). */
    public static DimensionWeights fromKeys(Map<String, Double> byKey) {
        if (byKey == null) {
            throw new ValidationException("Dimension weights are required");
        }
        Map<Dimension, Double> mapped = new EnumMap<>(Dimension.class);
        byKey.forEach((k, v) -> mapped.put(Dimension.fromKey(k), v));
        return of(mapped);
    }

    public double weight(Dimension dimension) {
        return weights.get(dimension);
    }

    public Map<Dimension, Double> asMap() {
        return weights;
    }

    public Map<String, Double> asKeyMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        weights.forEach((d, w) -> out.put(d.key(), w));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DimensionWeights other && weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "DimensionWeights" + asKeyMap();
    }
}
