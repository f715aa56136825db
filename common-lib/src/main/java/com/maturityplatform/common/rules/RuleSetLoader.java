package com.maturityplatform.common.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maturityplatform.common.classifier.MaturityBand;
import com.maturityplatform.common.classifier.MaturityClassifier;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.MaturityLevel;
import com.maturityplatform.common.roadmap.EffortTier;
import com.maturityplatform.common.roadmap.InitiativeCatalog;
import com.maturityplatform.common.roadmap.InitiativeTemplate;
import com.maturityplatform.common.weighting.DimensionWeights;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link RuleSet} from its JSON document:
 * <pre>
 * {
 *   "version": "2024.1",
 *   "dimensionWeights": { "data": 0.25, ... },
 *   "maturityBands": [ { "level": 1, "label": "Initial", "lowerBound": 0 }, ... ],
 *   "initiatives": [ { "dimension": "data", "fromLevel": 1, "title": "...",
 *                      "description": "...", "effort": "small" }, ... ]
 * }
 * </pre>
 * A missing {@code dimensionWeights} or {@code maturityBands} falls back to the
 * built-in defaults; the initiative catalog is always required.
 */
public final class RuleSetLoader {

    /** Classpath location of the rule table bundled with this library. */
    public static final String BUNDLED_RULES = "rules/maturity-rules-v1.json";

    private final ObjectMapper objectMapper;

    public RuleSetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ValidationException  when the document violates any table invariant
     * @throws UncheckedIOException when the stream cannot be read or parsed
     */
    public RuleSet load(InputStream in) {
        RuleDocument doc;
        try {
            doc = objectMapper.readValue(in, RuleDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable rule document", e);
        }
        if (doc == null) {
            throw new ValidationException("Rule document is empty");
        }
        DimensionWeights weights = doc.dimensionWeights() == null
            ? DimensionWeights.DEFAULT
            : DimensionWeights.fromKeys(doc.dimensionWeights());
        List<MaturityBand> bands = doc.maturityBands() == null
            ? MaturityClassifier.DEFAULT_BANDS
            : new MaturityClassifier(doc.maturityBands()).bands();
        int topLevel = bands.get(bands.size() - 1).level();
        if (topLevel != MaturityLevel.MAX_LEVEL) {
            throw new ValidationException("Maturity band table must end at level " + MaturityLevel.MAX_LEVEL
                + ", got " + topLevel);
        }
        List<InitiativeTemplate> templates = doc.initiatives() == null
            ? List.of()
            : doc.initiatives().stream().map(RuleSetLoader::toTemplate).toList();
        return new RuleSet(doc.version(), weights, bands, InitiativeCatalog.of(doc.version(), templates));
    }

    /** Loads {@link #BUNDLED_RULES} from this library's classpath. */
    public RuleSet loadBundled() {
        try (InputStream in = RuleSetLoader.class.getClassLoader().getResourceAsStream(BUNDLED_RULES)) {
            if (in == null) {
                throw new IllegalStateException("Bundled rule table " + BUNDLED_RULES + " is missing");
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static InitiativeTemplate toTemplate(TemplateDocument t) {
        return new InitiativeTemplate(Dimension.fromKey(t.dimension()), t.fromLevel(), t.title(),
            t.description(), t.effort() == null ? null : EffortTier.fromKey(t.effort()));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleDocument(
        @JsonProperty("version") String version,
        @JsonProperty("dimensionWeights") Map<String, Double> dimensionWeights,
        @JsonProperty("maturityBands") List<MaturityBand> maturityBands,
        @JsonProperty("initiatives") List<TemplateDocument> initiatives
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TemplateDocument(
        @JsonProperty("dimension") String dimension,
        @JsonProperty("fromLevel") int fromLevel,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("effort") String effort
    ) {}
}
