package org.carball.deckforge.model.seed;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
public class LiveDeckAnalysis {
    private List<String> colorIdentity = new ArrayList<>();
    private List<String> keywords = new ArrayList<>();
    private List<String> themes = new ArrayList<>();
    private Map<Integer, Integer> currentCurve = new TreeMap<>();
    private int recommendedLandCount;
    private int totalCards;
    private int inCollectionCount;
}
