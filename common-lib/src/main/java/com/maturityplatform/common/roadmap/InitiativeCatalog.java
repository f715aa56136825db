package com.maturityplatform.common.roadmap;

import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.MaturityLevel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Versioned table of initiative templates keyed by (dimension, fromLevel).
 * Registration order is preserved within a key.
 */
public final class InitiativeCatalog {

    private final String version;
    private final Map<Dimension, Map<Integer, List<InitiativeTemplate>>> templates;

    private InitiativeCatalog(String version, Map<Dimension, Map<Integer, List<InitiativeTemplate>>> templates) {
        this.version = version;
        this.templates = templates;
    }

    /**
     * @throws ValidationException when a template is malformed or a single-step
     *                             progression (dimension, level 1..4) has no template
     */
    public static InitiativeCatalog of(String version, List<InitiativeTemplate> entries) {
        List<String> violations = new ArrayList<>();
        if (version == null || version.isBlank()) {
            violations.add("Catalog version is required");
        }
        Map<Dimension, Map<Integer, List<InitiativeTemplate>>> byKey = new EnumMap<>(Dimension.class);
        for (InitiativeTemplate t : entries == null ? List.<InitiativeTemplate>of() : entries) {
            if (t.dimension() == null || t.effort() == null || t.title() == null || t.title().isBlank()) {
                violations.add("Template '" + t.title() + "' needs a dimension, a title and an effort tier");
                continue;
            }
            if (t.fromLevel() < 1 || t.fromLevel() >= MaturityLevel.MAX_LEVEL) {
                violations.add("Template '" + t.title() + "' has fromLevel " + t.fromLevel()
                    + "; must be in 1.." + (MaturityLevel.MAX_LEVEL - 1));
                continue;
            }
            byKey.computeIfAbsent(t.dimension(), k -> new TreeMap<>())
                .computeIfAbsent(t.fromLevel(), k -> new ArrayList<>())
                .add(t);
        }
        for (Dimension d : Dimension.values()) {
            for (int level = 1; level < MaturityLevel.MAX_LEVEL; level++) {
                if (byKey.getOrDefault(d, Map.of()).getOrDefault(level, List.of()).isEmpty()) {
                    violations.add("No template for " + d.key() + " level " + level + " -> " + (level + 1));
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid initiative catalog", violations);
        }
        byKey.replaceAll((d, levels) -> {
            levels.replaceAll((l, list) -> List.copyOf(list));
            return levels;
        });
        return new InitiativeCatalog(version, byKey);
    }

    public String version() {
        return version;
    }

    /** Templates registered for moving {@code dimension} from {@code fromLevel} one level up. */
    public List<InitiativeTemplate> templatesFor(Dimension dimension, int fromLevel) {
        return templates.getOrDefault(dimension, Map.of()).getOrDefault(fromLevel, List.of());
    }

    public int size() {
        return templates.values().stream()
            .flatMap(levels -> levels.values().stream())
            .mapToInt(List::size)
            .sum();
    }
}
