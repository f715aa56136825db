package com.maturityplatform.common.classifier;

import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.MaturityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaturityClassifierTest {

    private final MaturityClassifier classifier = new MaturityClassifier();

    @ParameterizedTest(name = "{0} → level {1} {2}")
    @CsvSource({
        "0,     1, Initial",
        "19,    1, Initial",
        "19.99, 1, Initial",
        "20,    2, Developing",
        "39.99, 2, Developing",
        "40,    3, Defined",
        "59,    3, Defined",
        "60,    4, Managed",
        "79.99, 4, Managed",
        "80,    5, Optimizing",
        "100,   5, Optimizing"
    })
    @DisplayName("band boundaries are inclusive-low, top band inclusive-high")
    void boundaries(double score, int level, String label) {
        assertEquals(new MaturityLevel(level, label), classifier.classify(score));
    }

    @Test
    @DisplayName("scores outside [0,100] are rejected")
    void outOfRange() {
        assertThrows(ValidationException.class, () -> classifier.classify(-0.01));
        assertThrows(ValidationException.class, () -> classifier.classify(100.01));
        assertThrows(ValidationException.class, () -> classifier.classify(Double.NaN));
    }

    @Test
    @DisplayName("custom band table is honoured")
    void customBands() {
        MaturityClassifier three = new MaturityClassifier(List.of(
            new MaturityBand(1, "Low", 0),
            new MaturityBand(3, "High", 70),
            new MaturityBand(2, "Mid", 35)));

        assertEquals(new MaturityLevel(2, "Mid"), three.classify(35));
        assertEquals(3, three.topLevel());
        assertEquals("High", three.labelFor(3));
    }

    @Test
    @DisplayName("band table not starting at 0 or with gaps in levels is rejected")
    void invalidTables() {
        assertThrows(ValidationException.class, () -> new MaturityClassifier(List.of(
            new MaturityBand(1, "Low", 10))));
        assertThrows(ValidationException.class, () -> new MaturityClassifier(List.of(
            new MaturityBand(1, "Low", 0),
            new MaturityBand(3, "High", 50))));
    }
}
