package com.maturityplatform.common.roadmap;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.model.Dimension;

/**
 * Catalog entry proposing work that moves {@code dimension} from
 * {@code fromLevel} to {@code fromLevel + 1}.
 */
public record InitiativeTemplate(
    @JsonProperty("dimension") Dimension dimension,
    @JsonProperty("fromLevel") int fromLevel,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("effort") EffortTier effort
) {
    public int targetLevel() {
        return fromLevel + 1;
    }
}
