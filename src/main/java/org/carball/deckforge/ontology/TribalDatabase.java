package org.carball.deckforge.ontology;

import org.carball.deckforge.model.synergy.TribalInfo;
import org.carball.deckforge.model.synergy.TribalSupport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Creature types with known tribal support, keyed by exact type name.
 */
public final class TribalDatabase {

    public static final String RESOURCE = "/registry/tribes.yaml";

    private static final double NEUTRAL_WEIGHT = 1.0;

    private final Map<String, TribalInfo> tribes;

    public TribalDatabase(List<TribalInfo> entries) {
        Map<String, TribalInfo> byType = new LinkedHashMap<>();
        for (TribalInfo info : entries) {
            byType.put(info.getType(), info);
        }
        this.tribes = Collections.unmodifiableMap(byType);
    }

    public static TribalDatabase defaults() {
        return Holder.INSTANCE;
    }

    public Optional<TribalInfo> find(String creatureType) {
        return Optional.ofNullable(tribes.get(creatureType));
    }

    /** Unknown types are neutral. */
    public double synergyWeight(String creatureType) {
        return find(creatureType).map(TribalInfo::getSynergyWeight).orElse(NEUTRAL_WEIGHT);
    }

    public List<String> relatedTypes(String creatureType) {
        return find(creatureType).map(TribalInfo::getRelatedTypes).orElse(List.of());
    }

    public boolean isStrongSupport(String creatureType) {
        return find(creatureType).map(info -> info.getSupport() == TribalSupport.STRONG).orElse(false);
    }

    public List<String> commonKeywords(String creatureType) {
        return find(creatureType).map(TribalInfo::getCommonKeywords).orElse(List.of());
    }

    /**
     * Whether the card counts as every creature type.
     */
    public static boolean isChangeling(String oracleText) {
        if (oracleText == null || oracleText.isEmpty()) {
            return false;
        }
        String text = oracleText.toLowerCase(Locale.ROOT);
        return PatternMatcher.containsPattern(text, "changeling")
                || PatternMatcher.containsPattern(text, "is every creature type");
    }

    public List<String> allTribes() {
        return tribes.keySet().stream().sorted().collect(Collectors.toList());
    }

    public List<String> strongTribes() {
        return tribes.values().stream()
                .filter(info -> info.getSupport() == TribalSupport.STRONG)
                .map(TribalInfo::getType)
                .sorted()
                .collect(Collectors.toList());
    }

    private static final class Holder {
        private static final TribalDatabase INSTANCE =
                new TribalDatabase(RegistryLoader.loadList(RESOURCE, TribalInfo.class));
    }
}
