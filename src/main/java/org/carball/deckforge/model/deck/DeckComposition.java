package org.carball.deckforge.model.deck;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate statistics of a card list. Derived on demand and never persisted.
 */
@Data
public class DeckComposition {
    private Map<String, Integer> colors = new LinkedHashMap<>();
    private Map<Integer, Integer> manaCurve = new TreeMap<>();
    private Map<String, Integer> cardTypes = new LinkedHashMap<>();
    private Map<String, Integer> keywords = new LinkedHashMap<>();
    private Map<String, Integer> creatureTypes = new LinkedHashMap<>();
    private int totalCards;
    private int totalNonLands;
    private double averageCmc;
    private List<String> colorIdentity = new ArrayList<>();
    private List<String> primaryColors = new ArrayList<>();

    public int countAtCmc(int cmc) {
        return manaCurve.getOrDefault(cmc, 0);
    }

    public int keywordCount(String keyword) {
        return keywords.getOrDefault(keyword, 0);
    }

    public int creatureTypeCount(String creatureType) {
        return creatureTypes.getOrDefault(creatureType, 0);
    }
}
