package org.carball.deckforge.model.synergy;

/**
 * An oracle-text pattern (with at most one honored {@code .*} wildcard) that implies a keyword.
 */
public record ThemePattern(String pattern, String keyword, KeywordCategory category, double weight) {

    public KeywordInfo toKeywordInfo() {
        return new KeywordInfo(keyword, category, weight);
    }
}
