package org.carball.deckforge.model.archetype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Archetype {
    AGGRO("Aggro", "Fast, aggressive deck that wins by dealing damage quickly"),
    CONTROL("Control", "Reactive deck that answers threats and wins in the late game"),
    MIDRANGE("Midrange", "Flexible deck with efficient threats and removal"),
    COMBO("Combo", "Deck built around specific card combinations"),
    TEMPO("Tempo", "Deck that deploys threats while disrupting the opponent"),
    RAMP("Ramp", "Deck that accelerates mana to cast big spells early"),
    TRIBAL("Tribal", "Deck focused on creature type synergies"),
    TOKENS("Tokens", "Deck that creates many creature tokens"),
    ARTIFACTS("Artifacts", "Deck built around artifact synergies");

    private final String displayName;
    private final String description;

    Archetype(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAggressive() {
        return this == AGGRO || this == TEMPO;
    }

    public boolean isControlling() {
        return this == CONTROL;
    }
}
