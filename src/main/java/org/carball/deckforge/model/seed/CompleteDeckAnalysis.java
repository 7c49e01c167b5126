package org.carball.deckforge.model.seed;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

@Data
public class CompleteDeckAnalysis {
    private int totalCards;
    private int spellCount;
    private int landCount;
    private int creatureCount;
    private double averageCmc;
    private Map<Integer, Integer> manaCurve = new TreeMap<>();
    private Map<String, Integer> colorDistribution = new LinkedHashMap<>();
    private int ownedCards;
    private int missingCards;
    private Map<String, Integer> wildcardCost = new LinkedHashMap<>();
    /** Display name of the best-matching archetype, or null when nothing matched. */
    private String archetypeMatch;
}
