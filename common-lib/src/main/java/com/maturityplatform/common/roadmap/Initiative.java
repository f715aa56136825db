package com.maturityplatform.common.roadmap;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.model.Dimension;

/**
 * One roadmap entry: advance {@code dimension} from {@code currentLevel} to
 * {@code targetLevel} (always {@code currentLevel + 1}).
 *
 * @param priorityScore {@code (5 − currentLevel) × dimensionWeight}
 * @param priorityRank  1-based position in the roadmap
 */
public record Initiative(
    @JsonProperty("dimension") Dimension dimension,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("currentLevel") int currentLevel,
    @JsonProperty("targetLevel") int targetLevel,
    @JsonProperty("priorityScore") double priorityScore,
    @JsonProperty("priorityRank") int priorityRank,
    @JsonProperty("effort") EffortTier effort,
    @JsonProperty("timeframe") TimeframeBucket timeframe
) {}
