package org.carball.deckforge.ontology;

import org.carball.deckforge.model.deck.ColorCombination;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed universe of color identities a draft deck is built in: five mono-color,
 * ten two-color and ten three-color combinations.
 */
public final class ColorCombinations {

    /** Canonical WUBRG order. */
    public static final List<String> COLOR_ORDER = List.of("W", "U", "B", "R", "G");

    private static final List<ColorCombination> ALL = List.of(
            // Mono
            combo("Mono-White", "W"),
            combo("Mono-Blue", "U"),
            combo("Mono-Black", "B"),
            combo("Mono-Red", "R"),
            combo("Mono-Green", "G"),
            // Allied pairs
            combo("Azorius", "W", "U"),
            combo("Dimir", "U", "B"),
            combo("Rakdos", "B", "R"),
            combo("Gruul", "R", "G"),
            combo("Selesnya", "G", "W"),
            // Enemy pairs
            combo("Orzhov", "W", "B"),
            combo("Izzet", "U", "R"),
            combo("Golgari", "B", "G"),
            combo("Boros", "R", "W"),
            combo("Simic", "G", "U"),
            // Shards
            combo("Esper", "W", "U", "B"),
            combo("Grixis", "U", "B", "R"),
            combo("Jund", "B", "R", "G"),
            combo("Naya", "R", "G", "W"),
            combo("Bant", "G", "W", "U"),
            // Wedges
            combo("Abzan", "W", "B", "G"),
            combo("Jeskai", "U", "R", "W"),
            combo("Sultai", "B", "G", "U"),
            combo("Mardu", "R", "W", "B"),
            combo("Temur", "G", "U", "R"));

    private ColorCombinations() {
    }

    private static ColorCombination combo(String name, String... colors) {
        return new ColorCombination(List.of(colors), name);
    }

    public static List<ColorCombination> all() {
        return ALL;
    }

    /**
     * The named combination holding exactly these colors, in any order.
     */
    public static Optional<ColorCombination> forColors(Collection<String> colors) {
        Set<String> wanted = new HashSet<>(colors);
        return ALL.stream()
                .filter(combo -> combo.size() == wanted.size() && wanted.containsAll(combo.colors()))
                .findFirst();
    }

    /**
     * Sorts color symbols into WUBRG order; unknown symbols go last in their original order.
     */
    public static List<String> inColorOrder(Iterable<String> colors) {
        List<String> sorted = new ArrayList<>();
        colors.forEach(sorted::add);
        sorted.sort(Comparator.comparingInt(c -> {
            int index = COLOR_ORDER.indexOf(c);
            return index < 0 ? COLOR_ORDER.size() : index;
        }));
        return sorted;
    }
}
