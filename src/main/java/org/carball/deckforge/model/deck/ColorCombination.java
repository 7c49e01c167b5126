package org.carball.deckforge.model.deck;

import java.util.List;

/**
 * An ordered set of one to three color symbols with its display name, e.g. [W, U] "Azorius".
 */
public record ColorCombination(List<String> colors, String name) {

    public ColorCombination {
        colors = List.copyOf(colors);
    }

    public int size() {
        return colors.size();
    }
}
