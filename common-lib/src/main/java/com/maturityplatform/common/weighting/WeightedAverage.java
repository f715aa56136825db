package com.maturityplatform.common.weighting;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared weighted-aggregation utility used by dimension scoring and roadmap
 * prioritisation.
 *
 * <h3>Policies</h3>
 * <pre>
 *   NONE      → Σ(value × weight)                 weights are trusted to sum to 1.0
 *   NORMALIZE → Σ(value × weight) / Σ(weight)     weights are relative
 * </pre>
 *
 * <p>Stateless and thread-safe. Callers validate weights before calling.
 */
public final class WeightedAverage {

    public enum Renormalization {
        NONE,
        NORMALIZE
    }

    private WeightedAverage() {}

    public static <K> double of(Map<K, WeightedValue> values, Renormalization policy) {
        return of(values.values(), policy);
    }

    /**
     * @throws IllegalArgumentException when {@code NORMALIZE} is requested and
     *                                  the total weight is not positive
     */
    public static double of(Collection<WeightedValue> values, Renormalization policy) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (WeightedValue v : values) {
            weightedSum += v.contribution();
            totalWeight += v.weight();
        }
        if (policy == Renormalization.NONE) {
            return weightedSum;
        }
        if (totalWeight <= 0.0) {
            throw new IllegalArgumentException("Total weight must be positive, got " + totalWeight);
        }
        return weightedSum / totalWeight;
    }

    /**
     * Per-category contribution ({@code value × weight}), preserving the map's
     * iteration order.
     */
    public static <K> Map<K, Double> contributions(Map<K, WeightedValue> values) {
        Map<K, Double> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, v.contribution()));
        return out;
    }
}
