package org.carball.deckforge.model.synergy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TribalSupport {
    STRONG("strong"),
    MODERATE("moderate"),
    WEAK("weak");

    private final String label;

    TribalSupport(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
