package org.carball.deckforge.builder;

import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.ColorCombination;
import org.carball.deckforge.model.deck.SuggestedLand;
import org.carball.deckforge.ontology.BasicLand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a land count across the basic lands of a color combination in proportion to the
 * colored mana symbols of the chosen spells. The result always sums to the requested total.
 */
public final class LandAllocator {

    private LandAllocator() {
    }

    public static List<SuggestedLand> allocate(List<Card> spells, ColorCombination combo, int totalLands) {
        Map<String, Integer> pips = countPips(spells, combo);
        int totalPips = pips.values().stream().mapToInt(Integer::intValue).sum();

        List<SuggestedLand> lands = new ArrayList<>();
        if (totalPips == 0) {
            // even split, remainder to the earliest colors
            int base = totalLands / combo.size();
            int remainder = totalLands % combo.size();
            for (int i = 0; i < combo.size(); i++) {
                int count = base + (i < remainder ? 1 : 0);
                if (count > 0) {
                    addBasic(lands, combo.colors().get(i), count);
                }
            }
            return lands;
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        int allocated = 0;
        for (Map.Entry<String, Integer> entry : pips.entrySet()) {
            int count = (int) (totalLands * ((double) entry.getValue() / totalPips));
            counts.put(entry.getKey(), count);
            allocated += count;
        }

        int remaining = totalLands - allocated;
        if (remaining > 0) {
            String maxColor = combo.colors().get(0);
            int maxPips = 0;
            for (Map.Entry<String, Integer> entry : pips.entrySet()) {
                if (entry.getValue() > maxPips) {
                    maxPips = entry.getValue();
                    maxColor = entry.getKey();
                }
            }
            counts.merge(maxColor, remaining, Integer::sum);
        }

        counts.forEach((color, count) -> {
            if (count > 0) {
                addBasic(lands, color, count);
            }
        });
        return lands;
    }

    /**
     * Occurrences of "{C}" in the mana costs, per combination color, in combination order.
     */
    static Map<String, Integer> countPips(List<Card> spells, ColorCombination combo) {
        Map<String, Integer> pips = new LinkedHashMap<>();
        for (String color : combo.colors()) {
            pips.put(color, 0);
        }
        for (Card card : spells) {
            if (card.getManaCost() == null) {
                continue;
            }
            for (String color : combo.colors()) {
                pips.merge(color, countOccurrences(card.getManaCost(), "{" + color + "}"), Integer::sum);
            }
        }
        return pips;
    }

    private static int countOccurrences(String text, String symbol) {
        int count = 0;
        int idx = text.indexOf(symbol);
        while (idx != -1) {
            count++;
            idx = text.indexOf(symbol, idx + symbol.length());
        }
        return count;
    }

    private static void addBasic(List<SuggestedLand> lands, String color, int count) {
        BasicLand.forColor(color).ifPresent(basic -> lands.add(basic.suggest(count)));
    }
}
