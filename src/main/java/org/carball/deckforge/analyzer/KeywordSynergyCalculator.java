package org.carball.deckforge.analyzer;

import org.carball.deckforge.model.synergy.KeywordCategory;
import org.carball.deckforge.model.synergy.KeywordInfo;
import org.carball.deckforge.model.synergy.KeywordSynergy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword overlap between two keyword lists. Exact matches add the mean of both weights, a
 * different keyword of the same category adds a quarter of the summed weights. The total is
 * normalized by the number of keyword pairs and capped at 1.
 */
public final class KeywordSynergyCalculator {

    private KeywordSynergyCalculator() {
    }

    public static double calculate(List<KeywordInfo> first, List<KeywordInfo> second) {
        return calculateDetailed(first, second).score();
    }

    public static KeywordSynergy calculateDetailed(List<KeywordInfo> first, List<KeywordInfo> second) {
        if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
            return KeywordSynergy.none();
        }

        Map<KeywordCategory, List<KeywordInfo>> firstByCategory = new EnumMap<>(KeywordCategory.class);
        for (KeywordInfo info : first) {
            firstByCategory.computeIfAbsent(info.category(), c -> new ArrayList<>()).add(info);
        }

        Set<String> matched = new LinkedHashSet<>();
        double total = 0.0;
        int matchCount = 0;

        for (KeywordInfo other : second) {
            for (KeywordInfo info : first) {
                if (info.keyword().equals(other.keyword())) {
                    total += (info.weight() + other.weight()) / 2;
                    matchCount++;
                    matched.add(info.keyword());
                }
            }

            for (KeywordInfo info : firstByCategory.getOrDefault(other.category(), List.of())) {
                if (!info.keyword().equals(other.keyword())) {
                    total += (info.weight() + other.weight()) / 4;
                    matchCount++;
                }
            }
        }

        if (matchCount == 0) {
            return KeywordSynergy.none();
        }

        double normalized = total / (first.size() * second.size());
        return new KeywordSynergy(Math.min(normalized, 1.0), List.copyOf(matched));
    }
}
