package com.maturityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable output of a scoring run: one score per dimension plus the weighted
 * overall score. All values are in [0,100].
 */
public record DimensionScores(
    @JsonProperty("dimensionScores") Map<Dimension, Double> dimensionScores,
    @JsonProperty("overallScore") double overallScore
) {
    public DimensionScores {
        dimensionScores = Collections.unmodifiableMap(new EnumMap<>(dimensionScores));
    }

    public double score(Dimension dimension) {
        Double score = dimensionScores.get(dimension);
        if (score == null) {
            throw new IllegalArgumentException("No score for dimension " + dimension.key());
        }
        return score;
    }
}
