package com.maturityplatform.common.scoring;

import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.DimensionResponse;
import com.maturityplatform.common.model.DimensionScores;
import com.maturityplatform.common.weighting.DimensionWeights;
import com.maturityplatform.common.weighting.WeightedAverage;
import com.maturityplatform.common.weighting.WeightedAverage.Renormalization;
import com.maturityplatform.common.weighting.WeightedValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates per-question responses into five dimension scores and one
 * weighted overall score.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Reject the response set unless every value is in [0,100], every weight
 *       is non-negative and all five dimensions are covered.</li>
 *   <li>Per dimension: {@code Σ(value × weight) / Σ(weight)}; a missing weight
 *       counts as {@value DimensionResponse#DEFAULT_WEIGHT}.</li>
 *   <li>Overall: {@code Σ(dimensionScore × dimensionWeight)}.</li>
 * </ol>
 * Dimension scores and the overall score are rounded half-up to
 * {@value #SCALE} decimals; the overall score is computed from the rounded
 * dimension scores.
 *
 * <p>Pure function. Persisting the result and completing the assessment is the
 * caller's job.
 */
public final class DimensionScorer {

    public static final int SCALE = 2;

    private static final double MIN_VALUE = 0.0;
    private static final double MAX_VALUE = 100.0;

    /**
     * Scores an assessment that has not been completed yet.
     *
     * @throws StateException when the assessment is already completed, regardless of input
     */
    public DimensionScores score(AssessmentSnapshot assessment,
                                 Collection<DimensionResponse> responses,
                                 DimensionWeights weights) {
        if (!assessment.status().isScorable()) {
            throw new StateException("Assessment " + assessment.id()
                + " is already completed; scores are immutable");
        }
        return score(responses, weights);
    }

    public DimensionScores score(Collection<DimensionResponse> responses, DimensionWeights weights) {
        if (weights == null) {
            throw new ValidationException("Dimension weights are required");
        }
        Map<Dimension, List<WeightedValue>> grouped = groupAndValidate(responses);

        Map<Dimension, Double> dimensionScores = new EnumMap<>(Dimension.class);
        Map<Dimension, WeightedValue> weighted = new EnumMap<>(Dimension.class);
        for (Dimension d : Dimension.values()) {
            double score = round(clamp(WeightedAverage.of(grouped.get(d), Renormalization.NORMALIZE)));
            dimensionScores.put(d, score);
            weighted.put(d, new WeightedValue(score, weights.weight(d)));
        }

        double overall = round(clamp(WeightedAverage.of(weighted, Renormalization.NONE)));
        return new DimensionScores(dimensionScores, overall);
    }

    private Map<Dimension, List<WeightedValue>> groupAndValidate(Collection<DimensionResponse> responses) {
        if (responses == null || responses.isEmpty()) {
            throw new ValidationException("Cannot score an assessment with no responses");
        }
        List<String> violations = new ArrayList<>();
        Map<Dimension, List<WeightedValue>> grouped = new EnumMap<>(Dimension.class);
        Map<Dimension, Double> totalWeight = new EnumMap<>(Dimension.class);

        for (DimensionResponse r : responses) {
            if (r.dimension() == null) {
                violations.add("Response " + r.questionId() + " has no dimension");
                continue;
            }
            if (Double.isNaN(r.value()) || r.value() < MIN_VALUE || r.value() > MAX_VALUE) {
                violations.add("Response " + r.questionId() + " value " + r.value() + " is outside [0,100]");
            }
            double weight = r.effectiveWeight();
            if (Double.isNaN(weight) || weight < 0.0) {
                violations.add("Response " + r.questionId() + " weight " + weight + " must be non-negative");
            }
            grouped.computeIfAbsent(r.dimension(), k -> new ArrayList<>())
                .add(new WeightedValue(r.value(), weight));
            totalWeight.merge(r.dimension(), weight, Double::sum);
        }

        List<String> missing = new ArrayList<>();
        for (Dimension d : Dimension.values()) {
            if (!grouped.containsKey(d)) {
                missing.add(d.key());
            } else if (!(totalWeight.get(d) > 0.0)) {
                violations.add("Dimension '" + d.key() + "' has no response with a positive weight");
            }
        }
        if (!missing.isEmpty()) {
            violations.add("Missing responses for dimensions: " + String.join(", ", missing));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Response set cannot be scored", violations);
        }
        return grouped;
    }

    private static double clamp(double value) {
        return Math.max(MIN_VALUE, Math.min(MAX_VALUE, value));
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
