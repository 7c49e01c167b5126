package org.carball.deckforge.config;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 60-card constructed archetype profiles used when generating a complete deck.
 */
@Getter
public enum ConstructedArchetype {

    AGGRO("aggro", "Aggro", 20, Map.of(1, 8, 2, 14, 3, 10, 4, 4, 5, 4, 6, 0), 0.70, 4, 2,
            "Low curve, lots of creatures, wins before the opponent stabilizes",
            "Curve out with cheap creatures and keep attacking. Use removal to clear blockers.",
            "Keep hands with two lands and at least two plays costing 2 or less."),

    MIDRANGE("midrange", "Midrange", 24, Map.of(1, 4, 2, 8, 3, 10, 4, 8, 5, 4, 6, 2), 0.55, 6, 4,
            "Efficient threats backed by removal, strong in the mid game",
            "Trade early, land value creatures on turns 3 to 5 and grind the opponent out.",
            "Keep hands with three lands and a mix of early interaction and threats."),

    CONTROL("control", "Control", 26, Map.of(1, 2, 2, 6, 3, 8, 4, 8, 5, 6, 6, 4), 0.25, 10, 8,
            "Answers first, few powerful finishers, wins the long game",
            "Answer every threat, draw cards and close the game with a few big finishers.",
            "Keep hands with three or four lands and early answers. Avoid hands of only finishers.");

    private final String key;
    private final String displayName;
    private final int landCount;
    private final Map<Integer, Integer> curveTargets;
    private final double creatureRatio;
    private final int removalCount;
    private final int cardAdvantage;
    private final String description;
    private final String gamePlan;
    private final String mulligan;

    ConstructedArchetype(String key, String displayName, int landCount, Map<Integer, Integer> curveTargets,
                         double creatureRatio, int removalCount, int cardAdvantage,
                         String description, String gamePlan, String mulligan) {
        this.key = key;
        this.displayName = displayName;
        this.landCount = landCount;
        this.curveTargets = curveTargets;
        this.creatureRatio = creatureRatio;
        this.removalCount = removalCount;
        this.cardAdvantage = cardAdvantage;
        this.description = description;
        this.gamePlan = gamePlan;
        this.mulligan = mulligan;
    }

    public int nonlandSlots(int deckSize) {
        return deckSize - landCount;
    }

    public static ConstructedArchetype fromName(String name) {
        for (ConstructedArchetype archetype : values()) {
            if (archetype.getKey().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return archetype;
            }
        }
        throw new IllegalArgumentException("unknown archetype: " + name +
                ". Available archetypes: " + String.join(", ", getAvailableArchetypes()));
    }

    public static List<String> getAvailableArchetypes() {
        return Arrays.stream(values()).map(ConstructedArchetype::getKey).collect(Collectors.toList());
    }
}
