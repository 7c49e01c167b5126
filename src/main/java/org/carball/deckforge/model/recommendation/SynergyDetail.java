package org.carball.deckforge.model.recommendation;

/**
 * One reason a card synergizes with its target: the kind of match, what matched, and a sentence for display.
 */
public record SynergyDetail(SynergyType type, String name, String description) {

    public enum SynergyType {
        KEYWORD,
        TRIBAL,
        THEME
    }
}
