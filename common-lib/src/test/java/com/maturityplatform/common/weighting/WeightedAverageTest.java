package com.maturityplatform.common.weighting;

import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.weighting.WeightedAverage.Renormalization;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WeightedAverageTest {

    @Nested
    @DisplayName("WeightedAverage")
    class Aggregation {

        @Test
        @DisplayName("NONE sums value × weight")
        void noneIsWeightedSum() {
            double result = WeightedAverage.of(List.of(
                new WeightedValue(80, 0.5), new WeightedValue(40, 0.5)), Renormalization.NONE);
            assertEquals(60.0, result, 1e-9);
        }

        @Test
        @DisplayName("NORMALIZE divides by the total weight")
        void normalizeDividesByTotalWeight() {
            double result = WeightedAverage.of(List.of(
                new WeightedValue(90, 3), new WeightedValue(30, 1)), Renormalization.NORMALIZE);
            assertEquals(75.0, result, 1e-9);
        }

        @Test
        @DisplayName("NORMALIZE with zero total weight is rejected")
        void normalizeRejectsZeroWeight() {
            assertThrows(IllegalArgumentException.class, () -> WeightedAverage.of(
                List.of(new WeightedValue(50, 0)), Renormalization.NORMALIZE));
        }

        @Test
        @DisplayName("contributions keep map order")
        void contributionsKeepOrder() {
            Map<String, WeightedValue> in = new LinkedHashMap<>();
            in.put("b", new WeightedValue(2, 0.5));
            in.put("a", new WeightedValue(4, 0.25));
            Map<String, Double> out = WeightedAverage.contributions(in);
            assertEquals(List.of("b", "a"), List.copyOf(out.keySet()));
            assertEquals(1.0, out.get("b"), 1e-9);
            assertEquals(1.0, out.get("a"), 1e-9);
        }
    }

    @Nested
    @DisplayName("DimensionWeights")
    class Weights {

        @Test
        @DisplayName("default table matches the published weights")
        void defaults() {
            assertEquals(0.25, DimensionWeights.DEFAULT.weight(Dimension.DATA));
            assertEquals(0.15, DimensionWeights.DEFAULT.weight(Dimension.GOVERNANCE));
        }

        @Test
        @DisplayName("sum within 0.001 of 1.0 is accepted")
        void toleranceAccepted() {
            Map<Dimension, Double> w = new EnumMap<>(DimensionWeights.DEFAULT.asMap());
            w.put(Dimension.DATA, 0.2505);
            assertDoesNotThrow(() -> DimensionWeights.of(w));
        }

        @Test
        @DisplayName("sum off by more than 0.001 is rejected")
        void badSumRejected() {
            Map<Dimension, Double> w = new EnumMap<>(DimensionWeights.DEFAULT.asMap());
            w.put(Dimension.DATA, 0.30);
            ValidationException e = assertThrows(ValidationException.class, () -> DimensionWeights.of(w));
            assertTrue(e.getViolations().get(0).contains("1.050"));
        }

        @Test
        @DisplayName("missing and negative weights are all reported")
        void missingAndNegativeReported() {
            Map<String, Double> w = new LinkedHashMap<>();
            w.put("data", -0.1);
            w.put("process", 0.5);
            ValidationException e = assertThrows(ValidationException.class, () -> DimensionWeights.fromKeys(w));
            assertEquals(4, e.getViolations().size());
        }

        @Test
        @DisplayName("unknown dimension key is rejected")
        void unknownKey() {
            assertThrows(ValidationException.class,
                () -> DimensionWeights.fromKeys(Map.of("strategy", 1.0)));
        }
    }
}
