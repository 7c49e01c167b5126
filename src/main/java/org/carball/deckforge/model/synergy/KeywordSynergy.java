package org.carball.deckforge.model.synergy;

import java.util.List;

/**
 * Keyword overlap between two keyword sets: a score in [0, 1] and the exactly matched keywords.
 */
public record KeywordSynergy(double score, List<String> matchedKeywords) {

    public static KeywordSynergy none() {
        return new KeywordSynergy(0.0, List.of());
    }
}
