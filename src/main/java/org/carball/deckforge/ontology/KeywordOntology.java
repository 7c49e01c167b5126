package org.carball.deckforge.ontology;

import org.carball.deckforge.model.synergy.KeywordCategory;
import org.carball.deckforge.model.synergy.KeywordInfo;
import org.carball.deckforge.model.synergy.ThemePattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.carball.deckforge.model.synergy.KeywordCategory.ACTIVATED;
import static org.carball.deckforge.model.synergy.KeywordCategory.THEME;
import static org.carball.deckforge.model.synergy.KeywordCategory.TRIGGER;

/**
 * Static keyword dictionary and theme patterns used to read oracle text.
 * <p>
 * Dictionary entries match as plain substrings of the lowercased text. Theme patterns go through
 * {@link PatternMatcher}, so a single {@code .*} wildcard is honored. Both tables are immutable.
 */
public final class KeywordOntology {

    private static final double UNKNOWN_KEYWORD_WEIGHT = 0.5;

    private static final Map<String, KeywordInfo> DICTIONARY;
    private static final List<ThemePattern> THEME_PATTERNS;

    private static final Map<String, String> FRIENDLY_THEME_NAMES = Map.of(
            "flying", "Flying",
            "tokens", "Tokens",
            "+1/+1 counters", "+1/+1 Counters",
            "graveyard", "Graveyard",
            "sacrifice", "Sacrifice",
            "card draw", "Card Draw",
            "lifegain", "Lifegain",
            "ETB", "Enter the Battlefield",
            "cast triggers", "Spells Matter",
            "death triggers", "Death Triggers");

    static {
        Map<String, KeywordInfo> dictionary = new LinkedHashMap<>();
        // Combat keywords
        keyword(dictionary, "flying", KeywordCategory.COMBAT, 0.8);
        keyword(dictionary, "first strike", KeywordCategory.COMBAT, 0.7);
        keyword(dictionary, "double strike", KeywordCategory.COMBAT, 0.9);
        keyword(dictionary, "deathtouch", KeywordCategory.COMBAT, 0.8);
        keyword(dictionary, "haste", KeywordCategory.COMBAT, 0.6);
        keyword(dictionary, "lifelink", KeywordCategory.COMBAT, 0.7);
        keyword(dictionary, "menace", KeywordCategory.COMBAT, 0.7);
        keyword(dictionary, "reach", KeywordCategory.COMBAT, 0.5);
        keyword(dictionary, "trample", KeywordCategory.COMBAT, 0.7);
        keyword(dictionary, "vigilance", KeywordCategory.COMBAT, 0.6);

        // Protection and evasion
        keyword(dictionary, "hexproof", KeywordCategory.PROTECTION, 0.8);
        keyword(dictionary, "indestructible", KeywordCategory.PROTECTION, 0.9);
        keyword(dictionary, "ward", KeywordCategory.PROTECTION, 0.7);
        keyword(dictionary, "shroud", KeywordCategory.PROTECTION, 0.7);
        keyword(dictionary, "protection", KeywordCategory.PROTECTION, 0.7);

        // Static abilities
        keyword(dictionary, "flash", KeywordCategory.ABILITY, 0.6);
        keyword(dictionary, "defender", KeywordCategory.ABILITY, 0.3);
        keyword(dictionary, "prowess", KeywordCategory.ABILITY, 0.8);
        keyword(dictionary, "convoke", KeywordCategory.ABILITY, 0.7);

        // Set mechanics
        keyword(dictionary, "flashback", KeywordCategory.MECHANIC, 0.8);
        keyword(dictionary, "kicker", KeywordCategory.MECHANIC, 0.6);
        keyword(dictionary, "adventure", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "transform", KeywordCategory.MECHANIC, 0.6);
        keyword(dictionary, "disturb", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "exploit", KeywordCategory.MECHANIC, 0.8);
        keyword(dictionary, "escape", KeywordCategory.MECHANIC, 0.8);
        keyword(dictionary, "madness", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "cycling", KeywordCategory.MECHANIC, 0.6);
        keyword(dictionary, "cascade", KeywordCategory.MECHANIC, 0.9);
        keyword(dictionary, "mutate", KeywordCategory.MECHANIC, 0.8);
        keyword(dictionary, "foretell", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "learn", KeywordCategory.MECHANIC, 0.6);
        keyword(dictionary, "ninjutsu", KeywordCategory.MECHANIC, 0.8);
        keyword(dictionary, "channel", KeywordCategory.MECHANIC, 0.6);
        keyword(dictionary, "bargain", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "craft", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "descend", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "threshold", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "delirium", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "affinity", KeywordCategory.MECHANIC, 0.8);
        keyword(dictionary, "modular", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "equip", KeywordCategory.MECHANIC, 0.6);
        keyword(dictionary, "crew", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "offspring", KeywordCategory.MECHANIC, 0.7);
        keyword(dictionary, "valiant", KeywordCategory.MECHANIC, 0.7);
        DICTIONARY = Collections.unmodifiableMap(dictionary);

        List<ThemePattern> themes = new ArrayList<>();
        // Tokens
        themes.add(new ThemePattern("create a token", "tokens", THEME, 0.9));
        themes.add(new ThemePattern("create a.*token", "tokens", THEME, 0.9));
        themes.add(new ThemePattern("creates a token", "tokens", THEME, 0.9));
        themes.add(new ThemePattern("create two", "tokens", THEME, 0.9));
        themes.add(new ThemePattern("create three", "tokens", THEME, 0.9));

        // Counters
        themes.add(new ThemePattern("+1/+1 counter", "+1/+1 counters", THEME, 0.9));
        themes.add(new ThemePattern("put a counter", "counters", THEME, 0.7));
        themes.add(new ThemePattern("put counters", "counters", THEME, 0.7));
        themes.add(new ThemePattern("-1/-1 counter", "-1/-1 counters", THEME, 0.8));
        themes.add(new ThemePattern("loyalty counter", "planeswalkers", THEME, 0.7));
        themes.add(new ThemePattern("charge counter", "artifacts", THEME, 0.6));

        // Graveyard
        themes.add(new ThemePattern("from your graveyard", "graveyard", THEME, 0.9));
        themes.add(new ThemePattern("from a graveyard", "graveyard", THEME, 0.9));
        themes.add(new ThemePattern("in your graveyard", "graveyard", THEME, 0.8));
        themes.add(new ThemePattern("return.*from.*graveyard", "graveyard", THEME, 0.9));
        themes.add(new ThemePattern("mill", "mill", THEME, 0.8));
        themes.add(new ThemePattern("self-mill", "mill", THEME, 0.9));

        // Sacrifice
        themes.add(new ThemePattern("sacrifice a", "sacrifice", THEME, 0.9));
        themes.add(new ThemePattern("sacrifice another", "sacrifice", THEME, 0.9));
        themes.add(new ThemePattern("sacrificed", "sacrifice", THEME, 0.8));
        themes.add(new ThemePattern("when.*dies", "death triggers", THEME, 0.8));
        themes.add(new ThemePattern("whenever.*dies", "death triggers", THEME, 0.8));
        themes.add(new ThemePattern("whenever another creature you control dies", "death payoff", THEME, 0.95));
        themes.add(new ThemePattern("whenever a creature you control dies", "death payoff", THEME, 0.9));
        themes.add(new ThemePattern("whenever a nontoken creature", "death triggers", THEME, 0.85));
        themes.add(new ThemePattern("sacrifice a token", "token sacrifice", THEME, 0.9));
        themes.add(new ThemePattern("sacrifices a token", "token sacrifice", THEME, 0.9));
        themes.add(new ThemePattern("when you sacrifice", "sacrifice payoff", THEME, 0.9));
        themes.add(new ThemePattern("whenever you sacrifice", "sacrifice payoff", THEME, 0.9));
        themes.add(new ThemePattern("whenever you sacrifice a", "sacrifice payoff", THEME, 0.9));
        themes.add(new ThemePattern("as an additional cost", "sacrifice", THEME, 0.7));
        themes.add(new ThemePattern("blood token", "blood tokens", THEME, 0.8));
        themes.add(new ThemePattern("food token", "food tokens", THEME, 0.8));
        themes.add(new ThemePattern("treasure token", "treasure tokens", THEME, 0.8));
        themes.add(new ThemePattern("clue token", "clue tokens", THEME, 0.8));
        themes.add(new ThemePattern("map token", "map tokens", THEME, 0.8));

        // Card advantage
        themes.add(new ThemePattern("draw a card", "card draw", THEME, 0.7));
        themes.add(new ThemePattern("draw cards", "card draw", THEME, 0.8));
        themes.add(new ThemePattern("draw two", "card draw", THEME, 0.8));
        themes.add(new ThemePattern("draw three", "card draw", THEME, 0.9));
        themes.add(new ThemePattern("scry", "scry", THEME, 0.6));
        themes.add(new ThemePattern("surveil", "surveil", THEME, 0.7));
        themes.add(new ThemePattern("whenever you draw your second card", "second draw", THEME, 0.9));
        themes.add(new ThemePattern("draw your second card", "second draw", THEME, 0.9));
        themes.add(new ThemePattern("draw an additional card", "card advantage", THEME, 0.8));
        themes.add(new ThemePattern("you may draw an additional card", "card advantage", THEME, 0.8));
        themes.add(new ThemePattern("draw two additional cards", "card advantage", THEME, 0.9));

        // Life
        themes.add(new ThemePattern("gain life", "lifegain", THEME, 0.7));
        themes.add(new ThemePattern("gains life", "lifegain", THEME, 0.7));
        themes.add(new ThemePattern("whenever you gain life", "lifegain payoff", THEME, 0.9));
        themes.add(new ThemePattern("lose life", "drain", THEME, 0.7));
        themes.add(new ThemePattern("pay life", "pay life", THEME, 0.6));

        // Combat triggers
        themes.add(new ThemePattern("deals combat damage", "combat damage", THEME, 0.8));
        themes.add(new ThemePattern("whenever.*attacks", "attack triggers", THEME, 0.8));
        themes.add(new ThemePattern("whenever.*blocks", "block triggers", THEME, 0.7));
        themes.add(new ThemePattern("can't be blocked", "evasion", THEME, 0.8));

        // Enters triggers
        themes.add(new ThemePattern("when.*enters", "enters triggers", TRIGGER, 0.8));
        themes.add(new ThemePattern("when.*enters the battlefield", "ETB", TRIGGER, 0.9));
        themes.add(new ThemePattern("whenever.*enters", "enters triggers", TRIGGER, 0.8));

        // Cast triggers
        themes.add(new ThemePattern("whenever you cast", "cast triggers", TRIGGER, 0.8));
        themes.add(new ThemePattern("when you cast", "cast triggers", TRIGGER, 0.8));

        // Beginning-of-phase triggers
        themes.add(new ThemePattern("at the beginning of", "upkeep triggers", TRIGGER, 0.7));
        themes.add(new ThemePattern("at the beginning of your upkeep", "upkeep", TRIGGER, 0.7));
        themes.add(new ThemePattern("at the beginning of your end step", "end step", TRIGGER, 0.7));

        // Activated abilities
        themes.add(new ThemePattern("{t}:", "tap abilities", ACTIVATED, 0.7));
        themes.add(new ThemePattern("{t},", "tap abilities", ACTIVATED, 0.7));
        themes.add(new ThemePattern("tap:", "tap abilities", ACTIVATED, 0.7));

        // Spells matter
        themes.add(new ThemePattern("instant or sorcery", "spells matter", THEME, 0.8));
        themes.add(new ThemePattern("noncreature spell", "spells matter", THEME, 0.8));
        themes.add(new ThemePattern("whenever you cast a noncreature spell", "spells matter", THEME, 0.9));
        themes.add(new ThemePattern("whenever you cast an instant or sorcery", "spells matter", THEME, 0.9));
        themes.add(new ThemePattern("whenever you cast your first instant or sorcery", "spells matter", THEME, 0.85));
        themes.add(new ThemePattern("magecraft", "spells matter", THEME, 0.9));
        themes.add(new ThemePattern("copy target instant or sorcery", "spell copy", THEME, 0.8));
        themes.add(new ThemePattern("copy that spell", "spell copy", THEME, 0.8));

        // Artifacts and enchantments
        themes.add(new ThemePattern("artifact you control", "artifacts matter", THEME, 0.8));
        themes.add(new ThemePattern("enchantment you control", "enchantments matter", THEME, 0.8));
        themes.add(new ThemePattern("aura", "auras", THEME, 0.7));
        themes.add(new ThemePattern("equipment", "equipment", THEME, 0.7));
        themes.add(new ThemePattern("whenever an artifact enters", "artifacts ETB", THEME, 0.85));
        themes.add(new ThemePattern("whenever an artifact enters the battlefield", "artifacts ETB", THEME, 0.9));
        themes.add(new ThemePattern("whenever an artifact leaves", "artifacts matter", THEME, 0.8));
        themes.add(new ThemePattern("whenever an artifact or creature you control", "artifacts matter", THEME, 0.8));
        themes.add(new ThemePattern("whenever an enchantment enters", "enchantments ETB", THEME, 0.85));
        themes.add(new ThemePattern("whenever an enchantment enters the battlefield", "enchantments ETB", THEME, 0.9));

        // Pump
        themes.add(new ThemePattern("gets +", "pump", THEME, 0.6));
        themes.add(new ThemePattern("get +", "pump", THEME, 0.6));
        themes.add(new ThemePattern("target creature gets", "pump", THEME, 0.6));

        // Removal
        themes.add(new ThemePattern("destroy target", "removal", THEME, 0.8));
        themes.add(new ThemePattern("exile target", "removal", THEME, 0.8));
        themes.add(new ThemePattern("deals.*damage to", "damage", THEME, 0.7));
        themes.add(new ThemePattern("fight", "fight", THEME, 0.7));
        themes.add(new ThemePattern("bite", "fight", THEME, 0.7));

        // Discard
        themes.add(new ThemePattern("discard a card", "discard", THEME, 0.7));
        themes.add(new ThemePattern("discards a card", "discard", THEME, 0.7));
        themes.add(new ThemePattern("whenever you discard", "discard payoff", THEME, 0.85));
        themes.add(new ThemePattern("whenever a player discards", "discard payoff", THEME, 0.8));
        themes.add(new ThemePattern("discard your hand", "discard", THEME, 0.8));
        themes.add(new ThemePattern("discarded this turn", "discard payoff", THEME, 0.8));

        // Blink
        themes.add(new ThemePattern("exile.*then return", "blink", THEME, 0.9));
        themes.add(new ThemePattern("exile target creature you control, then return", "blink", THEME, 0.9));
        themes.add(new ThemePattern("exile it, then return", "blink", THEME, 0.85));
        themes.add(new ThemePattern("exile up to one", "blink", THEME, 0.8));

        // Go wide
        themes.add(new ThemePattern("whenever a creature you control attacks", "go wide", THEME, 0.85));
        themes.add(new ThemePattern("whenever one or more creatures you control", "go wide", THEME, 0.8));
        themes.add(new ThemePattern("creatures you control get", "anthem", THEME, 0.9));
        themes.add(new ThemePattern("other creatures you control get", "anthem", THEME, 0.9));
        themes.add(new ThemePattern("creatures you control have", "anthem", THEME, 0.85));

        // Landfall
        themes.add(new ThemePattern("whenever a land enters the battlefield under your control", "landfall", THEME, 0.9));
        themes.add(new ThemePattern("landfall", "landfall", THEME, 0.9));

        // Mana
        themes.add(new ThemePattern("add one mana", "mana ramp", THEME, 0.6));
        themes.add(new ThemePattern("add two mana", "mana ramp", THEME, 0.7));
        themes.add(new ThemePattern("search your library for a.*land", "land ramp", THEME, 0.8));
        themes.add(new ThemePattern("search your library for a basic land", "land ramp", THEME, 0.8));

        // Historic
        themes.add(new ThemePattern("historic", "historic", THEME, 0.7));
        themes.add(new ThemePattern("legendary", "legends matter", THEME, 0.6));
        themes.add(new ThemePattern("whenever you cast a legendary", "legends matter", THEME, 0.85));

        // Type-specific
        themes.add(new ThemePattern("whenever another.*enters", "type ETB", THEME, 0.75));
        themes.add(new ThemePattern("for each creature you control", "go wide", THEME, 0.85));
        themes.add(new ThemePattern("equal to the number of creatures you control", "go wide", THEME, 0.85));

        // Control
        themes.add(new ThemePattern("can't be countered", "uncounterable", THEME, 0.7));
        themes.add(new ThemePattern("this spell can't be countered", "uncounterable", THEME, 0.7));
        themes.add(new ThemePattern("counter target spell", "control", THEME, 0.8));
        themes.add(new ThemePattern("return target", "bounce", THEME, 0.7));

        // Energy
        themes.add(new ThemePattern("energy counter", "energy", THEME, 0.9));
        themes.add(new ThemePattern("{e}", "energy", THEME, 0.9));
        THEME_PATTERNS = List.copyOf(themes);
    }

    private KeywordOntology() {
    }

    private static void keyword(Map<String, KeywordInfo> dictionary, String keyword, KeywordCategory category, double weight) {
        dictionary.put(keyword, new KeywordInfo(keyword, category, weight));
    }

    public static Map<String, KeywordInfo> dictionary() {
        return DICTIONARY;
    }

    public static List<ThemePattern> themePatterns() {
        return THEME_PATTERNS;
    }

    /**
     * Every dictionary keyword and theme keyword found in the text.
     */
    public static Set<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return keywords;
        }

        String lowerText = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, KeywordInfo> entry : DICTIONARY.entrySet()) {
            if (lowerText.contains(entry.getKey())) {
                keywords.add(entry.getValue().keyword());
            }
        }
        for (ThemePattern theme : THEME_PATTERNS) {
            if (PatternMatcher.containsPattern(lowerText, theme.pattern())) {
                keywords.add(theme.keyword());
            }
        }
        return keywords;
    }

    /**
     * Like {@link #extractKeywords(String)} but keeps category and weight. Each keyword appears once;
     * dictionary hits come before theme hits, and the first theme pattern for a keyword wins.
     */
    public static List<KeywordInfo> extractKeywordsWithInfo(String text) {
        List<KeywordInfo> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }

        Set<String> seen = new LinkedHashSet<>();
        String lowerText = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, KeywordInfo> entry : DICTIONARY.entrySet()) {
            KeywordInfo info = entry.getValue();
            if (lowerText.contains(entry.getKey()) && seen.add(info.keyword())) {
                result.add(info);
            }
        }
        for (ThemePattern theme : THEME_PATTERNS) {
            if (PatternMatcher.containsPattern(lowerText, theme.pattern()) && seen.add(theme.keyword())) {
                result.add(theme.toKeywordInfo());
            }
        }
        return result;
    }

    public static double weightOf(String keyword) {
        KeywordInfo info = DICTIONARY.get(keyword.toLowerCase(Locale.ROOT));
        if (info != null) {
            return info.weight();
        }
        return THEME_PATTERNS.stream()
                .filter(t -> t.keyword().equals(keyword))
                .map(ThemePattern::weight)
                .findFirst()
                .orElse(UNKNOWN_KEYWORD_WEIGHT);
    }

    public static KeywordCategory categoryOf(String keyword) {
        KeywordInfo info = DICTIONARY.get(keyword.toLowerCase(Locale.ROOT));
        if (info != null) {
            return info.category();
        }
        return THEME_PATTERNS.stream()
                .filter(t -> t.keyword().equals(keyword))
                .map(ThemePattern::category)
                .findFirst()
                .orElse(KeywordCategory.ABILITY);
    }

    /**
     * Display name for a detected theme, e.g. "ETB" becomes "Enter the Battlefield".
     */
    public static String friendlyThemeName(String keyword) {
        return FRIENDLY_THEME_NAMES.getOrDefault(keyword, keyword);
    }
}
