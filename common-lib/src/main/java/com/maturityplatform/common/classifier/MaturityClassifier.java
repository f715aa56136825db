package com.maturityplatform.common.classifier;

import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.MaturityLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a score in [0,100] to a discrete {@link MaturityLevel} using a band table.
 *
 * <p>Bands are inclusive-low / exclusive-high except the top band, which also
 * includes 100. Default table:
 * <pre>
 *   [0,20)   → 1 Initial
 *   [20,40)  → 2 Developing
 *   [40,60)  → 3 Defined
 *   [60,80)  → 4 Managed
 *   [80,100] → 5 Optimizing
 * </pre>
 *
 * <p>Stateless after construction and thread-safe.
 */
public final class MaturityClassifier {

    public static final List<MaturityBand> DEFAULT_BANDS = List.of(
        new MaturityBand(1, "Initial",     0.0),
        new MaturityBand(2, "Developing", 20.0),
        new MaturityBand(3, "Defined",    40.0),
        new MaturityBand(4, "Managed",    60.0),
        new MaturityBand(5, "Optimizing", 80.0)
    );

    private static final double MIN_SCORE = 0.0;
    private static final double MAX_SCORE = 100.0;

    private final List<MaturityBand> bands;

    public MaturityClassifier() {
        this(DEFAULT_BANDS);
    }

    public MaturityClassifier(List<MaturityBand> bands) {
        this.bands = validate(bands);
    }

    /**
     * @throws ValidationException when the score is NaN or outside [0,100]
     */
    public MaturityLevel classify(double score) {
        if (Double.isNaN(score) || score < MIN_SCORE || score > MAX_SCORE) {
            throw new ValidationException("Score " + score + " is outside [0,100]");
        }
        MaturityBand match = bands.get(0);
        for (MaturityBand band : bands) {
            if (score >= band.lowerBound()) {
                match = band;
            }
        }
        return new MaturityLevel(match.level(), match.label());
    }

    /** Label for a level number, used when a stored level is rendered. */
    public String labelFor(int level) {
        return bands.stream()
            .filter(b -> b.level() == level)
            .map(MaturityBand::label)
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown maturity level " + level));
    }

    public int topLevel() {
        return bands.get(bands.size() - 1).level();
    }

    public List<MaturityBand> bands() {
        return bands;
    }

    private static List<MaturityBand> validate(List<MaturityBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new ValidationException("Maturity band table is empty");
        }
        List<MaturityBand> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(MaturityBand::lowerBound));

        List<String> violations = new ArrayList<>();
        if (sorted.get(0).lowerBound() != MIN_SCORE) {
            violations.add("Lowest band must start at 0, got " + sorted.get(0).lowerBound());
        }
        for (int i = 0; i < sorted.size(); i++) {
            MaturityBand band = sorted.get(i);
            if (band.level() != i + 1) {
                violations.add("Band levels must be contiguous from 1; found level " + band.level()
                    + " at position " + (i + 1));
            }
            if (band.label() == null || band.label().isBlank()) {
                violations.add("Band " + band.level() + " has no label");
            }
            if (i > 0 && band.lowerBound() == sorted.get(i - 1).lowerBound()) {
                violations.add("Duplicate lower bound " + band.lowerBound());
            }
            if (band.lowerBound() > MAX_SCORE) {
                violations.add("Band " + band.level() + " starts above 100");
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid maturity band table", violations);
        }
        return List.copyOf(sorted);
    }
}
