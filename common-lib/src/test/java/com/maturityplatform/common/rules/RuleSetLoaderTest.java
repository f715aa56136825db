package com.maturityplatform.common.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maturityplatform.common.classifier.MaturityClassifier;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.weighting.DimensionWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RuleSetLoaderTest {

    private final RuleSetLoader loader = new RuleSetLoader(new ObjectMapper());

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    /** One template per dimension and level, all small. */
    private static String fullCatalog() {
        StringBuilder sb = new StringBuilder("[");
        for (Dimension d : Dimension.values()) {
            for (int level = 1; level <= 4; level++) {
                if (sb.length() > 1) {
                    sb.append(',');
                }
                sb.append("{\"dimension\":\"").append(d.key()).append("\",\"fromLevel\":").append(level)
                    .append(",\"title\":\"").append(d.key()).append(' ').append(level)
                    .append("\",\"description\":\"\",\"effort\":\"small\"}");
            }
        }
        return sb.append(']').toString();
    }

    @Test
    @DisplayName("bundled rule table loads with default weights and bands")
    void bundled() {
        RuleSet rules = loader.loadBundled();

        assertEquals("2024.1", rules.version());
        assertEquals(DimensionWeights.DEFAULT, rules.dimensionWeights());
        assertEquals(MaturityClassifier.DEFAULT_BANDS, rules.maturityBands());
        assertEquals(21, rules.initiativeCatalog().size());
        assertEquals(2, rules.initiativeCatalog().templatesFor(Dimension.DATA, 1).size());
    }

    @Test
    @DisplayName("omitted weights and bands fall back to defaults")
    void defaults() {
        RuleSet rules = loader.load(json("{\"version\":\"t1\",\"initiatives\":" + fullCatalog() + "}"));

        assertEquals(DimensionWeights.DEFAULT, rules.dimensionWeights());
        assertEquals(20, rules.initiativeCatalog().size());
    }

    @Test
    @DisplayName("custom weights must sum to 1.0")
    void badWeights() {
        String doc = "{\"version\":\"t1\",\"dimensionWeights\":{\"data\":0.5,\"process\":0.5,"
            + "\"people\":0.5,\"technology\":0.0,\"governance\":0.0},\"initiatives\":" + fullCatalog() + "}";

        assertThrows(ValidationException.class, () -> loader.load(json(doc)));
    }

    @Test
    @DisplayName("catalog without full single-step coverage is rejected")
    void incompleteCatalog() {
        String doc = "{\"version\":\"t1\",\"initiatives\":[{\"dimension\":\"data\",\"fromLevel\":1,"
            + "\"title\":\"x\",\"description\":\"\",\"effort\":\"small\"}]}";

        ValidationException e = assertThrows(ValidationException.class, () -> loader.load(json(doc)));
        assertEquals(19, e.getViolations().size());
    }

    @Test
    @DisplayName("a band table that stops short of level 5 is rejected")
    void shortBandTable() {
        String doc = "{\"version\":\"t1\",\"maturityBands\":["
            + "{\"level\":1,\"label\":\"Initial\",\"lowerBound\":0},"
            + "{\"level\":2,\"label\":\"Developing\",\"lowerBound\":25},"
            + "{\"level\":3,\"label\":\"Defined\",\"lowerBound\":50},"
            + "{\"level\":4,\"label\":\"Managed\",\"lowerBound\":75}],"
            + "\"initiatives\":" + fullCatalog() + "}";

        ValidationException e = assertThrows(ValidationException.class, () -> loader.load(json(doc)));
        assertTrue(e.getMessage().contains("level 5"));
    }

    @Test
    @DisplayName("unknown effort tier is rejected")
    void unknownEffort() {
        String doc = "{\"version\":\"t1\",\"initiatives\":" + fullCatalog().replaceFirst("small", "huge") + "}";

        assertThrows(ValidationException.class, () -> loader.load(json(doc)));
    }

    @Test
    @DisplayName("malformed JSON surfaces as UncheckedIOException")
    void malformed() {
        assertThrows(UncheckedIOException.class, () -> loader.load(json("{not json")));
    }
}
