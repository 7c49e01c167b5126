package org.carball.deckforge.model.deck;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Viability {
    STRONG("strong"),
    VIABLE("viable"),
    WEAK("weak");

    private final String label;

    Viability(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
