package com.maturityplatform.common.roadmap;

import com.maturityplatform.common.classifier.MaturityClassifier;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.weighting.DimensionWeights;
import com.maturityplatform.common.weighting.WeightedAverage;
import com.maturityplatform.common.weighting.WeightedValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a prioritised improvement roadmap from a completed assessment.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Classify each dimension score to its own maturity level.</li>
 *   <li>Skip dimensions already at the top level.</li>
 *   <li>{@code priority = (topLevel − level) × dimensionWeight}.</li>
 *   <li>Take the catalog templates registered for {@code level → level + 1} only;
 *       a level is never skipped.</li>
 *   <li>Sort by descending priority; ties by dimension declaration order, then
 *       catalog registration order. Ranks are assigned 1..n after sorting.</li>
 *   <li>Timeframe follows the template's effort tier.</li>
 * </ol>
 *
 * <p>Stateless after construction and thread-safe.
 */
public final class RoadmapGenerator {

    private static final int PRIORITY_SCALE = 4;

    private final MaturityClassifier classifier;
    private final InitiativeCatalog catalog;

    public RoadmapGenerator(MaturityClassifier classifier, InitiativeCatalog catalog) {
        this.classifier = classifier;
        this.catalog = catalog;
    }

    /**
     * @throws com.maturityplatform.common.exception.StateException when the assessment is not completed
     * @throws NotFoundException when the catalog lacks a template for a required step
     */
    public RoadmapPlan generate(AssessmentSnapshot assessment, DimensionWeights weights,
                                int horizonMonths, Instant generatedAt) {
        assessment.requireCompleted("generate roadmap");
        if (horizonMonths < 1) {
            throw new ValidationException("Planning horizon must be at least 1 month, got " + horizonMonths);
        }
        int topLevel = classifier.topLevel();

        Map<Dimension, Integer> levels = new EnumMap<>(Dimension.class);
        Map<Dimension, WeightedValue> gaps = new EnumMap<>(Dimension.class);
        for (Dimension d : Dimension.values()) {
            int level = classifier.classify(assessment.scores().score(d)).level();
            if (level < topLevel) {
                levels.put(d, level);
                gaps.put(d, new WeightedValue(topLevel - level, weights.weight(d)));
            }
        }
        Map<Dimension, Double> priorities = WeightedAverage.contributions(gaps);
        priorities.replaceAll((d, p) -> roundPriority(p));

        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<Dimension, Integer> e : levels.entrySet()) {
            List<InitiativeTemplate> templates = catalog.templatesFor(e.getKey(), e.getValue());
            if (templates.isEmpty()) {
                throw new NotFoundException("No initiative template for " + e.getKey().key()
                    + " level " + e.getValue() + " -> " + (e.getValue() + 1)
                    + " in catalog " + catalog.version());
            }
            for (int i = 0; i < templates.size(); i++) {
                candidates.add(new Candidate(templates.get(i), e.getValue(), priorities.get(e.getKey()), i));
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::priority).reversed()
            .thenComparing(c -> c.template().dimension())
            .thenComparingInt(Candidate::catalogOrder));

        List<Initiative> initiatives = new ArrayList<>();
        for (int rank = 1; rank <= candidates.size(); rank++) {
            Candidate c = candidates.get(rank - 1);
            InitiativeTemplate t = c.template();
            initiatives.add(new Initiative(t.dimension(), t.title(), t.description(), c.level(),
                c.level() + 1, c.priority(), rank, t.effort(), t.effort().timeframe()));
        }

        int overallLevel = assessment.maturityLevel().level();
        return new RoadmapPlan(assessment.id(), catalog.version(), overallLevel,
            Math.min(overallLevel + 1, topLevel), horizonMonths, initiatives, generatedAt);
    }

    // 3 × 0.20 and 4 × 0.15 must tie
    private static double roundPriority(double value) {
        return BigDecimal.valueOf(value).setScale(PRIORITY_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private record Candidate(InitiativeTemplate template, int level, double priority, int catalogOrder) {}
}
