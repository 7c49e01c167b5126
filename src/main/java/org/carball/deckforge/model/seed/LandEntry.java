package org.carball.deckforge.model.seed;

import java.util.List;

public record LandEntry(int cardId, String name, int quantity, List<String> colors, boolean basic, boolean entersTapped) {
}
