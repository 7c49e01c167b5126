package org.carball.deckforge.seed;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.builder.LandAllocator;
import org.carball.deckforge.classifier.ArchetypeClassifier;
import org.carball.deckforge.config.ConstructedArchetype;
import org.carball.deckforge.config.SeedBuilderTuning;
import org.carball.deckforge.model.archetype.Archetype;
import org.carball.deckforge.model.archetype.ArchetypeScore;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.ColorCombination;
import org.carball.deckforge.model.deck.SuggestedLand;
import org.carball.deckforge.model.recommendation.ScoredCard;
import org.carball.deckforge.model.seed.CardWithOwnership;
import org.carball.deckforge.model.seed.CardWithQuantity;
import org.carball.deckforge.model.seed.CompleteDeckAnalysis;
import org.carball.deckforge.model.seed.DeckStrategy;
import org.carball.deckforge.model.seed.GenerateCompleteDeckRequest;
import org.carball.deckforge.model.seed.GenerateCompleteDeckResponse;
import org.carball.deckforge.model.seed.LandEntry;
import org.carball.deckforge.model.seed.SeedCardAnalysis;
import org.carball.deckforge.model.seed.SetRestriction;
import org.carball.deckforge.ontology.ColorCombinations;
import org.carball.deckforge.ontology.KeywordOntology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates a full 60-card list around a seed card for a constructed archetype.
 */
@Slf4j
public class CompleteDeckGenerator {

    private static final int CURVE_CAP = 6;
    private static final int KEY_SUGGESTIONS = 3;
    private static final int SYNERGY_STRENGTH_COUNT = 8;

    private final SeedDeckBuilder seedDeckBuilder;
    private final ArchetypeClassifier classifier;

    public CompleteDeckGenerator(SeedDeckBuilder seedDeckBuilder) {
        this(seedDeckBuilder, new ArchetypeClassifier());
    }

    public CompleteDeckGenerator(SeedDeckBuilder seedDeckBuilder, ArchetypeClassifier classifier) {
        this.seedDeckBuilder = seedDeckBuilder;
        this.classifier = classifier;
    }

    public GenerateCompleteDeckResponse generateCompleteDeck(GenerateCompleteDeckRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is nil");
        }
        ConstructedArchetype profile = request.getArchetype() == null || request.getArchetype().isBlank()
                ? ConstructedArchetype.MIDRANGE
                : ConstructedArchetype.fromName(request.getArchetype());
        Card seed = seedDeckBuilder.requireSeed(request.getSeedCardId());
        SeedBuilderTuning tuning = seedDeckBuilder.tuning();
        SetRestriction restriction = request.getSetRestriction() == null ? SetRestriction.ALL : request.getSetRestriction();

        log.info("Generating {} deck around {} ({})", profile.getDisplayName(), seed.getName(), seed.getId());

        SeedCardAnalysis seedAnalysis = SeedCardScorer.analyzeSeed(seed);
        List<Card> candidates = seedDeckBuilder.candidates(restriction, request.getAllowedSets(), seed.getSetCode())
                .stream()
                .filter(card -> card.getId() != seed.getId() && !card.isLand())
                .collect(Collectors.toList());

        List<ScoredCard> ranked = seedDeckBuilder.rank(candidates, seedAnalysis);
        Map<Integer, Integer> collection = seedDeckBuilder.collectionCounts();
        if (request.isBudgetMode()) {
            ranked = SeedDeckBuilder.ownedOnly(ranked, collection);
        }

        int nonlandSlots = profile.nonlandSlots(tuning.getConstructedDeckSize());
        int seedCopies = Math.min(tuning.getMaxCopies(), nonlandSlots);
        Map<ScoredCard, Integer> picks = selectSpells(ranked, profile, seed, seedCopies, nonlandSlots, tuning.getMaxCopies());

        List<CardWithQuantity> spells = new ArrayList<>();
        CardWithOwnership seedCard = seedDeckBuilder.withOwnership(seed, 1.0, "This is your build-around card.", collection);
        spells.add(CardWithQuantity.builder()
                .card(seedCard)
                .quantity(seedCopies)
                .synergyDetails(new ArrayList<>())
                .build());
        picks.forEach((scored, quantity) -> spells.add(CardWithQuantity.builder()
                .card(seedDeckBuilder.withOwnership(scored.getCard(), scored.getScore(), scored.getReasoning(), collection))
                .quantity(quantity)
                .scoreBreakdown(scored.getBreakdown())
                .synergyDetails(scored.getSynergyDetails())
                .build()));

        List<Card> spellCopies = new ArrayList<>(Collections.nCopies(seedCopies, seed));
        picks.forEach((scored, quantity) -> spellCopies.addAll(Collections.nCopies(quantity, scored.getCard())));

        List<LandEntry> lands = buildLands(spellCopies, profile.getLandCount());
        Optional<Archetype> playstyle = classifier.primaryArchetype(spellCopies).map(ArchetypeScore::getArchetype);
        CompleteDeckAnalysis analysis = analyze(spells, spellCopies, lands, playstyle);
        DeckStrategy strategy = buildStrategy(profile, seed, spells, spellCopies, analysis, playstyle);

        log.info("Generated {} deck: {} spells, {} lands, archetype match {}", profile.getDisplayName(),
                analysis.getSpellCount(), analysis.getLandCount(), analysis.getArchetypeMatch());

        return GenerateCompleteDeckResponse.builder()
                .seedCard(seedCard)
                .archetype(profile.getKey())
                .spells(spells)
                .lands(lands)
                .strategy(strategy)
                .analysis(analysis)
                .build();
    }

    /**
     * Two passes over the ranked candidates: first up to the profile's curve targets, then any CMC
     * until the nonland slots are full. Copy counts follow the iterative heuristics.
     */
    Map<ScoredCard, Integer> selectSpells(List<ScoredCard> ranked, ConstructedArchetype profile, Card seed,
                                          int seedCopies, int nonlandSlots, int maxCopies) {
        Map<ScoredCard, Integer> picks = new LinkedHashMap<>();
        Map<Integer, Integer> curve = new HashMap<>();
        curve.merge(bucket(seed), seedCopies, Integer::sum);
        int remaining = nonlandSlots - seedCopies;

        for (ScoredCard scored : ranked) {
            if (remaining <= 0) {
                break;
            }
            int bucket = bucket(scored.getCard());
            int room = profile.getCurveTargets().getOrDefault(bucket, 0) - curve.getOrDefault(bucket, 0);
            if (room <= 0) {
                continue;
            }
            int copies = Math.min(SeedDeckBuilder.recommendedCopies(scored.getCard(), scored.getScore(), 0, maxCopies),
                    Math.min(room, remaining));
            picks.put(scored, copies);
            curve.merge(bucket, copies, Integer::sum);
            remaining -= copies;
        }

        for (ScoredCard scored : ranked) {
            if (remaining <= 0) {
                break;
            }
            int already = picks.getOrDefault(scored, 0);
            if (already >= maxCopies) {
                continue;
            }
            int copies = Math.min(maxCopies - already, remaining);
            picks.merge(scored, copies, Integer::sum);
            remaining -= copies;
        }

        if (remaining > 0) {
            log.warn("Only filled {} of {} nonland slots", nonlandSlots - remaining, nonlandSlots);
        }
        return picks;
    }

    private List<LandEntry> buildLands(List<Card> spellCopies, int landCount) {
        Set<String> colors = new LinkedHashSet<>();
        spellCopies.forEach(card -> colors.addAll(card.getColors()));
        List<String> ordered = ColorCombinations.inColorOrder(colors);
        if (ordered.isEmpty()) {
            log.warn("Colorless deck, no basic lands allocated");
            return new ArrayList<>();
        }

        ColorCombination combo = ColorCombinations.forColors(ordered)
                .orElseGet(() -> new ColorCombination(ordered, String.join("", ordered)));
        List<LandEntry> lands = new ArrayList<>();
        for (SuggestedLand land : LandAllocator.allocate(spellCopies, combo, landCount)) {
            lands.add(new LandEntry(land.cardId(), land.name(), land.quantity(), List.of(land.color()), true, false));
        }
        return lands;
    }

    private CompleteDeckAnalysis analyze(List<CardWithQuantity> spells, List<Card> spellCopies, List<LandEntry> lands,
                                         Optional<Archetype> playstyle) {
        CompleteDeckAnalysis analysis = new CompleteDeckAnalysis();
        int landCount = lands.stream().mapToInt(LandEntry::quantity).sum();

        analysis.setSpellCount(spellCopies.size());
        analysis.setLandCount(landCount);
        analysis.setTotalCards(spellCopies.size() + landCount);
        analysis.setCreatureCount((int) spellCopies.stream().filter(Card::isCreature).count());
        analysis.setAverageCmc(spellCopies.stream().mapToDouble(Card::getCmc).average().orElse(0.0));

        Map<String, Integer> colorCounts = new HashMap<>();
        for (Card card : spellCopies) {
            analysis.getManaCurve().merge(card.getWholeCmc(), 1, Integer::sum);
            card.getColors().forEach(color -> colorCounts.merge(color, 1, Integer::sum));
        }
        for (String color : ColorCombinations.inColorOrder(colorCounts.keySet())) {
            analysis.getColorDistribution().put(color, colorCounts.get(color));
        }

        for (CardWithQuantity entry : spells) {
            int owned = Math.min(entry.getCard().getOwnedCount(), entry.getQuantity());
            int missing = entry.getQuantity() - owned;
            analysis.setOwnedCards(analysis.getOwnedCards() + owned);
            analysis.setMissingCards(analysis.getMissingCards() + missing);
            if (missing > 0) {
                analysis.getWildcardCost().merge(SeedDeckBuilder.rarityKey(entry.getCard().getRarity()), missing, Integer::sum);
            }
        }

        analysis.setArchetypeMatch(playstyle.map(Archetype::getDisplayName).orElse(null));
        return analysis;
    }

    private DeckStrategy buildStrategy(ConstructedArchetype profile, Card seed, List<CardWithQuantity> spells,
                                       List<Card> spellCopies, CompleteDeckAnalysis analysis,
                                       Optional<Archetype> playstyle) {
        DeckStrategy strategy = new DeckStrategy();
        String colorName = ColorCombinations.forColors(analysis.getColorDistribution().keySet())
                .map(ColorCombination::name)
                .orElse(analysis.getColorDistribution().isEmpty() ? "Colorless" : "Multicolor");

        strategy.setSummary(String.format("%s %s deck built around %s.", colorName, profile.getDisplayName(), seed.getName()));
        strategy.setGamePlan(profile.getGamePlan());
        strategy.setMulligan(profile.getMulligan());

        strategy.getKeyCards().add(seed.getName());
        spells.stream()
                .skip(1)
                .limit(KEY_SUGGESTIONS)
                .map(entry -> entry.getCard().getName())
                .forEach(strategy.getKeyCards()::add);

        if (analysis.getAverageCmc() <= 2.5) {
            strategy.getStrengths().add("Low curve pressures opponents early");
        } else if (analysis.getAverageCmc() >= 3.5) {
            strategy.getWeaknesses().add("High curve can stumble against fast starts");
        }

        double creatureTarget = profile.getCreatureRatio() * analysis.getSpellCount();
        if (analysis.getCreatureCount() >= creatureTarget) {
            strategy.getStrengths().add(String.format("Creature count fits the %s plan", profile.getDisplayName()));
        } else {
            strategy.getWeaknesses().add(String.format("Fewer creatures than a typical %s list", profile.getDisplayName()));
        }

        int colorCount = analysis.getColorDistribution().size();
        if (colorCount == 1) {
            strategy.getStrengths().add("Consistent mana from a single color");
        } else if (colorCount >= 3) {
            strategy.getWeaknesses().add("Three or more colors strain the mana base");
        }

        long synergyCards = spells.stream()
                .filter(entry -> entry.getSynergyDetails() != null && !entry.getSynergyDetails().isEmpty())
                .count();
        if (synergyCards >= SYNERGY_STRENGTH_COUNT) {
            strategy.getStrengths().add(String.format("Many cards synergize with %s", seed.getName()));
        }

        long removal = spellCopies.stream().filter(CompleteDeckGenerator::isRemoval).count();
        if (removal < profile.getRemovalCount()) {
            strategy.getWeaknesses().add(String.format("Light on removal (%d of %d for %s)",
                    removal, profile.getRemovalCount(), profile.getDisplayName()));
        }
        long cardDraw = spellCopies.stream().filter(CompleteDeckGenerator::drawsCards).count();
        if (cardDraw < profile.getCardAdvantage()) {
            strategy.getWeaknesses().add(String.format("Little card advantage (%d of %d for %s)",
                    cardDraw, profile.getCardAdvantage(), profile.getDisplayName()));
        }

        // Card mix pulling against the requested profile
        playstyle.filter(style -> profile == ConstructedArchetype.CONTROL ? style.isAggressive()
                        : profile == ConstructedArchetype.AGGRO && style.isControlling())
                .ifPresent(style -> strategy.getWeaknesses().add(String.format(
                        "Card mix plays more like %s than %s", style.getDisplayName(), profile.getDisplayName())));

        if (analysis.getMissingCards() > 0) {
            strategy.getWeaknesses().add(String.format("Needs %d more cards to complete", analysis.getMissingCards()));
        }
        return strategy;
    }

    private static boolean isRemoval(Card card) {
        return KeywordOntology.extractKeywords(card.getOracleText()).contains("removal");
    }

    private static boolean drawsCards(Card card) {
        return card.hasOracleText() && card.getOracleText().toLowerCase(Locale.ROOT).contains("draw");
    }

    private static int bucket(Card card) {
        return Math.min(card.getWholeCmc(), CURVE_CAP);
    }
}
