package org.carball.deckforge.model.seed;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
public class SeedDeckAnalysis {
    private List<String> colorIdentity = new ArrayList<>();
    private List<String> keywords = new ArrayList<>();
    private List<String> themes = new ArrayList<>();
    private Map<Integer, Integer> idealCurve = new TreeMap<>();
    private int suggestedLandCount;
    private int totalCards;
    private int inCollectionCount;
    private int missingCount;
    /** Lowercase rarity to number of missing cards. */
    private Map<String, Integer> missingWildcardCost = new LinkedHashMap<>();
}
