package org.carball.deckforge.ontology;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Helpers for free-text type lines such as "Legendary Creature — Elf Wizard".
 */
public final class TypeLines {

    private static final String EM_DASH = "—";
    private static final String HYPHEN = "-";

    private static final List<String> MAIN_TYPES = List.of(
            "Creature", "Artifact", "Enchantment", "Instant", "Sorcery", "Land", "Planeswalker");
    private static final List<String> SUPERTYPES = List.of("Legendary", "Basic", "Snow", "World");

    private TypeLines() {
    }

    public static boolean containsType(String typeLine, String type) {
        if (typeLine == null || type == null) {
            return false;
        }
        return typeLine.toLowerCase(Locale.ROOT).contains(type.toLowerCase(Locale.ROOT));
    }

    /**
     * Main card types followed by supertypes found before the dash, e.g. [Creature, Legendary].
     */
    public static List<String> extractTypes(String typeLine) {
        List<String> types = new ArrayList<>();
        if (typeLine == null || typeLine.isEmpty()) {
            return types;
        }

        String typePart = typeLine.split(EM_DASH, -1)[0].trim().toLowerCase(Locale.ROOT);
        for (String type : MAIN_TYPES) {
            if (typePart.contains(type.toLowerCase(Locale.ROOT))) {
                types.add(type);
            }
        }
        for (String supertype : SUPERTYPES) {
            if (typePart.contains(supertype.toLowerCase(Locale.ROOT))) {
                types.add(supertype);
            }
        }
        return types;
    }

    /**
     * Subtypes after the em-dash, or after a plain hyphen when no em-dash is present.
     */
    public static Set<String> extractCreatureTypes(String typeLine) {
        Set<String> types = new LinkedHashSet<>();
        if (typeLine == null) {
            return types;
        }

        String[] parts = typeLine.split(EM_DASH, -1);
        if (parts.length < 2) {
            parts = typeLine.split(HYPHEN, -1);
        }
        if (parts.length >= 2) {
            String subtypes = parts[1].trim();
            if (!subtypes.isEmpty()) {
                for (String type : subtypes.split("\\s+")) {
                    types.add(type);
                }
            }
        }
        return types;
    }
}
