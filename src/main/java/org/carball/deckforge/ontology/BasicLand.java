package org.carball.deckforge.ontology;

import org.carball.deckforge.model.deck.SuggestedLand;

import java.util.Optional;

/**
 * Basic lands by the color they produce, with their Arena card ids.
 */
public enum BasicLand {
    PLAINS("W", 81716, "Plains"),
    ISLAND("U", 81717, "Island"),
    SWAMP("B", 81718, "Swamp"),
    MOUNTAIN("R", 81719, "Mountain"),
    FOREST("G", 81720, "Forest");

    private final String color;
    private final int cardId;
    private final String landName;

    BasicLand(String color, int cardId, String landName) {
        this.color = color;
        this.cardId = cardId;
        this.landName = landName;
    }

    public SuggestedLand suggest(int quantity) {
        return new SuggestedLand(cardId, landName, quantity, color);
    }

    public static Optional<BasicLand> forColor(String color) {
        for (BasicLand land : values()) {
            if (land.color.equals(color)) {
                return Optional.of(land);
            }
        }
        return Optional.empty();
    }
}
