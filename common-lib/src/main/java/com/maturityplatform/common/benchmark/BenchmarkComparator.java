package com.maturityplatform.common.benchmark;

import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.Dimension;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Positions a completed assessment against industry peer distributions.
 *
 * <h3>Midpoint percentile rule</h3>
 * <pre>
 *   percentile = (count(peer &lt; score) + 0.5 × count(peer == score)) / peerCount × 100
 * </pre>
 * e.g. peers [10,20,30,30,40], score 30 → (2 + 0.5·2) / 5 × 100 = 60.
 *
 * <p>Stateless and thread-safe: identical inputs always yield identical outputs.
 */
public final class BenchmarkComparator {

    private static final int TOP_GAP_LIMIT = 3;

    /**
     * Raw midpoint percentile of {@code score} within {@code peerScores}.
     *
     * @throws ValidationException when there are no peer scores
     */
    public static double percentile(double score, List<Double> peerScores) {
        if (peerScores == null || peerScores.isEmpty()) {
            throw new ValidationException("Benchmark has no peer scores");
        }
        int below = 0;
        int equal = 0;
        for (Double peer : peerScores) {
            int cmp = Double.compare(peer, score);
            if (cmp < 0) {
                below++;
            } else if (cmp == 0) {
                equal++;
            }
        }
        return (below + 0.5 * equal) / peerScores.size() * 100.0;
    }

    /**
     * Compares one metric of the assessment against its benchmark.
     *
     * @param benchmark {@code null} when no benchmark exists for the pair
     * @throws com.maturityplatform.common.exception.StateException when the assessment is not completed
     * @throws NotFoundException when {@code benchmark} is {@code null}
     */
    public PercentileResult compare(AssessmentSnapshot assessment, BenchmarkMetric metric,
                                    BenchmarkDistribution benchmark) {
        assessment.requireCompleted("compare against benchmark");
        if (benchmark == null) {
            throw new NotFoundException("No benchmark for industry '" + assessment.industry()
                + "' and metric '" + metric.key() + "'");
        }
        if (benchmark.metric() != metric) {
            throw new ValidationException("Benchmark measures '" + benchmark.metric().key()
                + "', expected '" + metric.key() + "'");
        }
        double score = subjectScore(assessment, metric);
        return new PercentileResult(metric, score, percentile(score, benchmark.peerScores()),
            benchmark.peerCount());
    }

    /**
     * Overall and per-dimension comparison. Every metric must have a benchmark.
     *
     * @param benchmarks distributions of the assessment's industry, keyed by metric
     */
    public BenchmarkComparison compareAll(AssessmentSnapshot assessment,
                                          Map<BenchmarkMetric, BenchmarkDistribution> benchmarks) {
        assessment.requireCompleted("compare against benchmark");
        BenchmarkDistribution overallBenchmark = benchmarks.get(BenchmarkMetric.OVERALL);
        PercentileResult overall = compare(assessment, BenchmarkMetric.OVERALL, overallBenchmark);

        List<DimensionComparison> dimensions = new ArrayList<>();
        for (Dimension d : Dimension.values()) {
            BenchmarkMetric metric = BenchmarkMetric.of(d);
            BenchmarkDistribution benchmark = benchmarks.get(metric);
            PercentileResult standing = compare(assessment, metric, benchmark);
            double median = benchmark.median();
            double gap = round(standing.score() - median);
            dimensions.add(new DimensionComparison(d, standing, median, gap, standing.score() >= median));
        }

        List<Dimension> topGaps = dimensions.stream()
            .filter(c -> !c.aboveMedian())
            .sorted(Comparator.comparingDouble(DimensionComparison::gap)
                .thenComparing(DimensionComparison::dimension))
            .limit(TOP_GAP_LIMIT)
            .map(DimensionComparison::dimension)
            .toList();
        List<Dimension> strengths = dimensions.stream()
            .filter(DimensionComparison::aboveMedian)
            .map(DimensionComparison::dimension)
            .toList();

        return new BenchmarkComparison(assessment.id(), assessment.industry(), overall,
            overallBenchmark.median(), dimensions, topGaps, strengths);
    }

    private static double subjectScore(AssessmentSnapshot assessment, BenchmarkMetric metric) {
        return metric == BenchmarkMetric.OVERALL
            ? assessment.scores().overallScore()
            : assessment.scores().score(metric.dimension());
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
