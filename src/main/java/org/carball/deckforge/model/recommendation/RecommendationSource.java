package org.carball.deckforge.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The factor that contributed most to a recommendation.
 */
public enum RecommendationSource {
    COLOR_FIT("color-fit"),
    MANA_CURVE("mana-curve"),
    QUALITY("quality"),
    SYNERGY("synergy"),
    PLAYABILITY("playability");

    private final String label;

    RecommendationSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
