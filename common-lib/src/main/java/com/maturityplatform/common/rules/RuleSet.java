package com.maturityplatform.common.rules;

import com.maturityplatform.common.classifier.MaturityBand;
import com.maturityplatform.common.roadmap.InitiativeCatalog;
import com.maturityplatform.common.weighting.DimensionWeights;

import java.util.List;

/**
 * Versioned, externally loaded rule tables the engine is driven by.
 * Every component is validated on construction by its own type.
 */
public record RuleSet(
    String version,
    DimensionWeights dimensionWeights,
    List<MaturityBand> maturityBands,
    InitiativeCatalog initiativeCatalog
) {
    public RuleSet {
        maturityBands = List.copyOf(maturityBands);
    }
}
