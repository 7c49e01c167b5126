package org.carball.deckforge.builder;

import org.carball.deckforge.model.deck.SuggestedCard;
import org.carball.deckforge.model.deck.SuggestedDeck;
import org.carball.deckforge.model.deck.SuggestedLand;

import java.util.Map;
import java.util.TreeMap;

/**
 * Plain-text decklist that MTG Arena can import.
 */
public final class ArenaExporter {

    private ArenaExporter() {
    }

    /**
     * A header, one "count name" line per distinct spell sorted by name, a blank line, then the lands.
     */
    public static String toArenaFormat(SuggestedDeck deck) {
        if (deck == null) {
            return "";
        }

        StringBuilder out = new StringBuilder();
        out.append(String.format("Deck: %s Draft\n", deck.getColorCombo().name()));
        out.append("\n");

        Map<String, Integer> counts = new TreeMap<>();
        for (SuggestedCard spell : deck.getSpells()) {
            counts.merge(spell.getName(), 1, Integer::sum);
        }
        counts.forEach((name, count) -> out.append(String.format("%d %s\n", count, name)));

        out.append("\n");
        for (SuggestedLand land : deck.getLands()) {
            if (land.quantity() > 0) {
                out.append(String.format("%d %s\n", land.quantity(), land.name()));
            }
        }
        return out.toString();
    }
}
