package org.carball.deckforge.model.synergy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum KeywordCategory {
    COMBAT("combat"),
    ABILITY("ability"),
    MECHANIC("mechanic"),
    THEME("theme"),
    TRIGGER("trigger"),
    ACTIVATED("activated"),
    PROTECTION("protection");

    private final String tag;

    KeywordCategory(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
