package com.maturityplatform.common.benchmark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maturityplatform.common.Fixtures;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.Dimension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkComparatorTest {

    private static final List<Double> PEERS = List.of(10.0, 20.0, 30.0, 30.0, 40.0);

    private final BenchmarkComparator comparator = new BenchmarkComparator();

    private static BenchmarkDistribution distribution(BenchmarkMetric metric, List<Double> peers) {
        return new BenchmarkDistribution("financial_services", metric, "2026-Q1", peers);
    }

    private static Map<BenchmarkMetric, BenchmarkDistribution> allMetrics() {
        Map<BenchmarkMetric, BenchmarkDistribution> m = new EnumMap<>(BenchmarkMetric.class);
        for (BenchmarkMetric metric : BenchmarkMetric.values()) {
            m.put(metric, distribution(metric, PEERS));
        }
        return m;
    }

    // ── percentile rule ────────────────────────────────────────────────────

    @Nested
    @DisplayName("percentile(): midpoint rule")
    class Percentile {

        @Test
        @DisplayName("peers [10,20,30,30,40], score 30 → 60")
        void workedExample() {
            assertEquals(60.0, BenchmarkComparator.percentile(30.0, PEERS), 1e-9);
        }

        @Test
        @DisplayName("score below every peer → 0, above every peer → 100")
        void extremes() {
            assertEquals(0.0, BenchmarkComparator.percentile(5.0, PEERS), 1e-9);
            assertEquals(100.0, BenchmarkComparator.percentile(95.0, PEERS), 1e-9);
        }

        @Test
        @DisplayName("single equal peer → 50")
        void singlePeer() {
            assertEquals(50.0, BenchmarkComparator.percentile(42.0, List.of(42.0)), 1e-9);
        }

        @Test
        @DisplayName("no peers is rejected")
        void noPeers() {
            assertThrows(ValidationException.class, () -> BenchmarkComparator.percentile(30.0, List.of()));
        }
    }

    // ── single metric ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("compare(): one metric")
    class SingleMetric {

        @Test
        @DisplayName("overall score positioned against the overall distribution")
        void overall() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(50, 50, 50, 50, 50, 30));

            PercentileResult r = comparator.compare(a, BenchmarkMetric.OVERALL,
                distribution(BenchmarkMetric.OVERALL, PEERS));

            assertEquals(30.0, r.score());
            assertEquals(60.0, r.percentile(), 1e-9);
            assertEquals(5, r.peerCount());
            assertFalse(r.statisticallyWeak());
        }

        @Test
        @DisplayName("dimension metric reads the dimension score")
        void dimension() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(50, 50, 50, 10, 50, 42));

            PercentileResult r = comparator.compare(a, BenchmarkMetric.TECHNOLOGY,
                distribution(BenchmarkMetric.TECHNOLOGY, PEERS));

            assertEquals(10.0, r.score());
            assertEquals(10.0, r.percentile(), 1e-9);
        }

        @Test
        @DisplayName("fewer than 5 peers is reported but flagged weak")
        void weak() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(50, 50, 50, 50, 50, 30));

            PercentileResult r = comparator.compare(a, BenchmarkMetric.OVERALL,
                distribution(BenchmarkMetric.OVERALL, List.of(10.0, 40.0)));

            assertEquals(50.0, r.percentile(), 1e-9);
            assertTrue(r.statisticallyWeak());
        }

        @Test
        @DisplayName("missing benchmark → NotFound")
        void missing() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(50, 50, 50, 50, 50, 30));
            assertThrows(NotFoundException.class, () -> comparator.compare(a, BenchmarkMetric.OVERALL, null));
        }

        @Test
        @DisplayName("distribution for another metric is rejected")
        void mismatchedMetric() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(50, 50, 50, 50, 50, 30));
            assertThrows(ValidationException.class, () -> comparator.compare(a, BenchmarkMetric.OVERALL,
                distribution(BenchmarkMetric.DATA, PEERS)));
        }

        @Test
        @DisplayName("assessment that is not completed → StateException")
        void notCompleted() {
            assertThrows(StateException.class, () -> comparator.compare(Fixtures.inProgress(2L),
                BenchmarkMetric.OVERALL, distribution(BenchmarkMetric.OVERALL, PEERS)));
        }

        @Test
        @DisplayName("same inputs give the same result")
        void idempotent() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(50, 50, 50, 50, 50, 30));
            BenchmarkDistribution b = distribution(BenchmarkMetric.OVERALL, PEERS);

            assertEquals(comparator.compare(a, BenchmarkMetric.OVERALL, b),
                comparator.compare(a, BenchmarkMetric.OVERALL, b));
        }
    }

    // ── full comparison ────────────────────────────────────────────────────

    @Nested
    @DisplayName("compareAll(): overall and per dimension")
    class FullComparison {

        @Test
        @DisplayName("gaps against the median, top gaps largest first, strengths at or above median")
        void gapsAndStrengths() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(30, 50, 20, 10, 35, 30));

            BenchmarkComparison c = comparator.compareAll(a, allMetrics());

            assertEquals(30.0, c.overallPeerMedian());
            assertEquals(60.0, c.overall().percentile(), 1e-9);
            assertEquals(5, c.dimensions().size());
            assertEquals(-20.0, c.dimensions().get(3).gap());
            assertEquals(List.of(Dimension.TECHNOLOGY, Dimension.PEOPLE), c.topGaps());
            assertEquals(List.of(Dimension.DATA, Dimension.PROCESS, Dimension.GOVERNANCE), c.strengths());
        }

        @Test
        @DisplayName("top gaps are capped at three")
        void capped() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(5, 15, 25, 12, 0, 10));

            BenchmarkComparison c = comparator.compareAll(a, allMetrics());

            assertEquals(List.of(Dimension.GOVERNANCE, Dimension.DATA, Dimension.TECHNOLOGY), c.topGaps());
            assertTrue(c.strengths().isEmpty());
        }

        @Test
        @DisplayName("dimensions and metrics are written as lower-case keys and read back")
        void wireKeys() throws Exception {
            ObjectMapper json = new ObjectMapper();
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(30, 50, 20, 10, 35, 30));
            BenchmarkComparison c = comparator.compareAll(a, allMetrics());

            JsonNode tree = json.readTree(json.writeValueAsString(c));

            assertEquals("overall", tree.path("overall").path("metric").asText());
            assertEquals("data", tree.path("dimensions").get(0).path("dimension").asText());
            assertEquals("data", tree.path("dimensions").get(0).path("standing").path("metric").asText());
            assertEquals("technology", tree.path("topGaps").get(0).asText());
            assertEquals(c, json.treeToValue(tree, BenchmarkComparison.class));
        }

        @Test
        @DisplayName("any missing metric → NotFound")
        void missingMetric() {
            AssessmentSnapshot a = Fixtures.completed(1L, Fixtures.scores(30, 50, 20, 10, 35, 30));
            Map<BenchmarkMetric, BenchmarkDistribution> partial = allMetrics();
            partial.remove(BenchmarkMetric.GOVERNANCE);

            assertThrows(NotFoundException.class, () -> comparator.compareAll(a, partial));
        }
    }
}
