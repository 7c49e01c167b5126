package org.carball.deckforge.model.seed;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which sets build-around candidates come from.
 */
public enum SetRestriction {
    /** The seed card's own set. */
    SINGLE("single"),
    /** The sets named in the request. */
    MULTIPLE("multiple"),
    /** Every standard-legal set. */
    ALL("all");

    private final String value;

    SetRestriction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unknown or blank values fall back to {@link #ALL}.
     */
    @JsonCreator
    public static SetRestriction fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        for (SetRestriction restriction : values()) {
            if (restriction.value.equals(value.trim().toLowerCase(Locale.ROOT))) {
                return restriction;
            }
        }
        return ALL;
    }
}
