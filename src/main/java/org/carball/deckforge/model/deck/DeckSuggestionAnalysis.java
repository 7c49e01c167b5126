package org.carball.deckforge.model.deck;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
public class DeckSuggestionAnalysis {
    private int creatureCount;
    /** Non-creature spells. */
    private int spellCount;
    private double averageCmc;
    private Map<Integer, Integer> manaCurve = new TreeMap<>();
    private Map<String, Integer> colorDistribution = new LinkedHashMap<>();
    private List<String> topCards = new ArrayList<>();
    private List<String> synergies = new ArrayList<>();
    private int playableCount;

    public int countAtCmc(int cmc) {
        return manaCurve.getOrDefault(cmc, 0);
    }
}
