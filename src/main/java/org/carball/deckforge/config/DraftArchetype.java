package org.carball.deckforge.config;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 40-card limited archetype profiles used by the archetype-targeted constructor.
 */
@Getter
public enum DraftArchetype {

    AGGRO("aggro", "Aggro", 16, 18, 2.5, 16,
            Map.of(1, 4, 2, 8, 3, 5, 4, 1, 5, 0),
            "Aggro: Fast, creature-heavy decks that aim to win early (16-18 creatures, low curve)"),

    MIDRANGE("midrange", "Midrange", 14, 16, 3.0, 17,
            Map.of(1, 2, 2, 5, 3, 5, 4, 3, 5, 2),
            "Midrange: Balanced decks with good creatures and removal (14-16 creatures)"),

    CONTROL("control", "Control", 10, 12, 3.5, 18,
            Map.of(1, 1, 2, 4, 3, 4, 4, 3, 5, 3),
            "Control: Slower decks focused on removal and card advantage (10-12 creatures, higher curve)");

    /** Curve buckets stop here; higher costs count as this CMC. */
    public static final int CURVE_CAP = 5;

    private final String key;
    private final String displayName;
    private final int creatureMin;
    private final int creatureMax;
    private final double maxAverageCmc;
    private final int landCount;
    private final Map<Integer, Integer> preferredCurve;
    private final String description;

    DraftArchetype(String key, String displayName, int creatureMin, int creatureMax, double maxAverageCmc,
                   int landCount, Map<Integer, Integer> preferredCurve, String description) {
        this.key = key;
        this.displayName = displayName;
        this.creatureMin = creatureMin;
        this.creatureMax = creatureMax;
        this.maxAverageCmc = maxAverageCmc;
        this.landCount = landCount;
        this.preferredCurve = preferredCurve;
        this.description = description;
    }

    public int preferredAt(int cmc) {
        return preferredCurve.getOrDefault(Math.min(cmc, CURVE_CAP), 0);
    }

    public boolean isCreatureHeavy() {
        return creatureMax >= 16;
    }

    public boolean isSpellHeavy() {
        return creatureMax <= 12;
    }

    /**
     * Finds an archetype by key (case-insensitive).
     */
    public static DraftArchetype fromName(String name) {
        for (DraftArchetype archetype : values()) {
            if (archetype.getKey().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return archetype;
            }
        }
        throw new IllegalArgumentException("unknown archetype: " + name +
                ". Available archetypes: " + String.join(", ", getAvailableArchetypes()));
    }

    public static List<String> getAvailableArchetypes() {
        return Arrays.stream(values()).map(DraftArchetype::getKey).collect(Collectors.toList());
    }

    public static String getArchetypeHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Draft Archetypes:\n\n");
        for (DraftArchetype archetype : values()) {
            help.append(String.format("  %-10s %s\n", archetype.getKey(), archetype.getDescription()));
        }
        return help.toString();
    }
}
