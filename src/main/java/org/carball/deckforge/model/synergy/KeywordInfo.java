package org.carball.deckforge.model.synergy;

/**
 * A keyword from the ontology with its category and synergy weight in (0, 1].
 */
public record KeywordInfo(String keyword, KeywordCategory category, double weight) {

    public boolean isTheme() {
        return category == KeywordCategory.THEME;
    }
}
