package org.carball.deckforge.seed;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.config.SeedBuilderTuning;
import org.carball.deckforge.lookup.BulkCardFetcher;
import org.carball.deckforge.lookup.CardLookup;
import org.carball.deckforge.lookup.CollectionLookup;
import org.carball.deckforge.lookup.LookupException;
import org.carball.deckforge.lookup.SetCardsLookup;
import org.carball.deckforge.lookup.StandardSetsLookup;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.SuggestedLand;
import org.carball.deckforge.model.recommendation.ScoredCard;
import org.carball.deckforge.model.seed.CardWithOwnership;
import org.carball.deckforge.model.seed.IterativeBuildAroundRequest;
import org.carball.deckforge.model.seed.IterativeBuildAroundResponse;
import org.carball.deckforge.model.seed.LiveDeckAnalysis;
import org.carball.deckforge.model.seed.SeedCardAnalysis;
import org.carball.deckforge.model.seed.SeedDeckAnalysis;
import org.carball.deckforge.model.seed.SeedDeckBuilderRequest;
import org.carball.deckforge.model.seed.SeedDeckBuilderResponse;
import org.carball.deckforge.model.seed.SetRestriction;
import org.carball.deckforge.model.synergy.KeywordInfo;
import org.carball.deckforge.ontology.BasicLand;
import org.carball.deckforge.ontology.ColorCombinations;
import org.carball.deckforge.ontology.TypeLines;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Suggests cards for a constructed deck, either around one seed card or for a deck in progress.
 */
@Slf4j
public class SeedDeckBuilder {

    private static final String SEED_REASONING = "This is your build-around card.";
    private static final int CURVE_BUCKET_CAP = 7;
    private static final double LAND_GAP_SCORE = 0.5;
    private static final double AT_IDEAL_SCORE = 0.4;
    private static final double OVER_IDEAL_SCORE = 0.3;

    private final SetCardsLookup setCardsLookup;
    private final CollectionLookup collectionLookup;
    private final StandardSetsLookup standardSetsLookup;
    private final CardLookup cardLookup;
    private final SeedBuilderTuning tuning;
    private final SeedCardScorer scorer;

    public SeedDeckBuilder(SetCardsLookup setCardsLookup, CollectionLookup collectionLookup,
                           StandardSetsLookup standardSetsLookup, CardLookup cardLookup) {
        this(setCardsLookup, collectionLookup, standardSetsLookup, cardLookup, SeedBuilderTuning.defaults());
    }

    public SeedDeckBuilder(SetCardsLookup setCardsLookup, CollectionLookup collectionLookup,
                           StandardSetsLookup standardSetsLookup, CardLookup cardLookup,
                           SeedBuilderTuning tuning) {
        this.setCardsLookup = setCardsLookup;
        this.collectionLookup = collectionLookup;
        this.standardSetsLookup = standardSetsLookup;
        this.cardLookup = cardLookup;
        this.tuning = tuning;
        this.scorer = new SeedCardScorer(tuning);
    }

    public SeedDeckBuilderResponse buildAroundSeed(SeedDeckBuilderRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is nil");
        }
        Card seed = requireSeed(request.getSeedCardId());
        int maxResults = request.getMaxResults() > 0 ? request.getMaxResults() : tuning.getDefaultMaxResults();
        SetRestriction restriction = request.getSetRestriction() == null ? SetRestriction.ALL : request.getSetRestriction();

        log.info("Building around {} ({}) from {} sets", seed.getName(), seed.getId(), restriction.getValue());

        SeedCardAnalysis seedAnalysis = SeedCardScorer.analyzeSeed(seed);
        List<Card> candidates = candidates(restriction, request.getAllowedSets(), seed.getSetCode()).stream()
                .filter(card -> card.getId() != seed.getId())
                .collect(Collectors.toList());

        List<ScoredCard> ranked = rank(candidates, seedAnalysis);
        Map<Integer, Integer> collection = collectionCounts();
        if (request.isBudgetMode()) {
            ranked = ownedOnly(ranked, collection);
        }
        if (ranked.size() > maxResults) {
            ranked = ranked.subList(0, maxResults);
        }

        List<CardWithOwnership> suggestions = ranked.stream()
                .map(scored -> withOwnership(scored.getCard(), scored.getScore(), scored.getReasoning(), collection))
                .collect(Collectors.toList());
        List<SuggestedLand> lands = suggestLands(seedAnalysis.getColors(), suggestions, tuning.getLandTotal());

        log.info("Suggested {} cards and {} basic lands for {}", suggestions.size(),
                lands.stream().mapToInt(SuggestedLand::quantity).sum(), seed.getName());

        return SeedDeckBuilderResponse.builder()
                .seedCard(withOwnership(seed, 1.0, SEED_REASONING, collection))
                .suggestions(suggestions)
                .landSuggestions(lands)
                .analysis(buildAnalysis(seedAnalysis, suggestions, lands))
                .build();
    }

    /**
     * Next-card suggestions for a deck in progress, scored against the whole deck.
     */
    public IterativeBuildAroundResponse suggestNextCards(IterativeBuildAroundRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is nil");
        }
        if (request.getDeckCardIds() == null || request.getDeckCardIds().isEmpty()) {
            throw new IllegalArgumentException("deck card list is empty");
        }
        int maxResults = request.getMaxResults() > 0 ? request.getMaxResults() : tuning.getDefaultIterativeResults();
        SetRestriction restriction = request.getSetRestriction() == null ? SetRestriction.ALL : request.getSetRestriction();

        List<Card> deckCards = resolveDeck(request.getDeckCardIds());
        if (deckCards.isEmpty()) {
            throw new IllegalArgumentException("could not load any deck cards");
        }
        log.info("Suggesting next cards for a {}-card deck", deckCards.size());

        Map<Integer, Integer> copiesInDeck = new HashMap<>();
        deckCards.forEach(card -> copiesInDeck.merge(card.getId(), 1, Integer::sum));

        SeedCardAnalysis deckAnalysis = SeedCardScorer.analyzeDeck(deckCards);
        Map<Integer, Integer> currentCurve = currentCurve(deckCards);

        String seedSet = seedSetCode(request.getSeedCardId(), deckCards);
        List<ScoredCard> ranked = new ArrayList<>();
        for (Card card : candidates(restriction, request.getAllowedSets(), seedSet)) {
            if (copiesInDeck.getOrDefault(card.getId(), 0) >= tuning.getMaxCopies()
                    || TypeLines.containsType(card.getTypeLine(), "Basic")
                    || !sharesColor(card, deckAnalysis)) {
                continue;
            }
            double gap = gapScore(card, currentCurve);
            ScoredCard scored = scorer.score(card, deckAnalysis, gap,
                    String.format("fills a gap at %d CMC", card.getWholeCmc()));
            if (scored.getScore() >= tuning.getMinimumScore()) {
                ranked.add(scored);
            }
        }
        ranked.sort(Comparator.comparingDouble(ScoredCard::getScore).reversed());

        Map<Integer, Integer> collection = collectionCounts();
        if (request.isBudgetMode()) {
            ranked = ownedOnly(ranked, collection);
        }
        if (ranked.size() > maxResults) {
            ranked = ranked.subList(0, maxResults);
        }

        List<CardWithOwnership> suggestions = new ArrayList<>();
        for (ScoredCard scored : ranked) {
            int copies = recommendedCopies(scored.getCard(), scored.getScore(),
                    copiesInDeck.getOrDefault(scored.getCardId(), 0), tuning.getMaxCopies());
            suggestions.add(withOwnership(scored.getCard(), scored.getScore(), scored.getReasoning(), collection)
                    .toBuilder()
                    .recommendedCopies(copies)
                    .build());
        }

        int landCount = recommendedLandCount(averageCmc(deckCards));
        long spellCount = deckCards.stream().filter(card -> !card.isLand()).count();
        int slotsRemaining = Math.max(tuning.getConstructedDeckSize() - (int) spellCount - landCount, 0);

        LiveDeckAnalysis analysis = new LiveDeckAnalysis();
        analysis.setColorIdentity(deckAnalysis.getColors());
        analysis.setKeywords(keywordNames(deckAnalysis));
        analysis.setThemes(deckAnalysis.getThemes());
        analysis.setCurrentCurve(currentCurve);
        analysis.setRecommendedLandCount(landCount);
        analysis.setTotalCards(deckCards.size());
        analysis.setInCollectionCount((int) suggestions.stream().filter(CardWithOwnership::isInCollection).count());

        log.info("Suggested {} cards, {} slots remaining", suggestions.size(), slotsRemaining);

        return IterativeBuildAroundResponse.builder()
                .suggestions(suggestions)
                .deckAnalysis(analysis)
                .slotsRemaining(slotsRemaining)
                .landSuggestions(suggestLands(deckAnalysis.getColors(), suggestions, landCount))
                .build();
    }

    Card requireSeed(int seedCardId) {
        if (seedCardId <= 0) {
            throw new IllegalArgumentException("seed card ID is required");
        }
        Optional<Card> seed;
        try {
            seed = cardLookup.findCard(seedCardId);
        } catch (LookupException e) {
            log.warn("Seed card lookup failed for {}: {}", seedCardId, e.getMessage());
            seed = Optional.empty();
        }
        return seed.orElseThrow(() -> new IllegalArgumentException("seed card not found: " + seedCardId));
    }

    /**
     * Candidate cards from the restricted sets, deduplicated by id. Sets that fail to load are skipped.
     */
    List<Card> candidates(SetRestriction restriction, List<String> allowedSets, String seedSetCode) {
        List<String> setCodes;
        switch (restriction) {
            case SINGLE:
                setCodes = seedSetCode == null ? List.of() : List.of(seedSetCode);
                break;
            case MULTIPLE:
                setCodes = allowedSets == null ? List.of() : allowedSets;
                break;
            case ALL:
            default:
                setCodes = standardSets();
                break;
        }

        Map<Integer, Card> candidates = new LinkedHashMap<>();
        for (String setCode : setCodes) {
            try {
                for (Card card : setCardsLookup.getCardsBySet(setCode)) {
                    candidates.putIfAbsent(card.getId(), card);
                }
            } catch (LookupException e) {
                log.warn("Skipping set {}: {}", setCode, e.getMessage());
            }
        }
        log.debug("Loaded {} candidates from sets {}", candidates.size(), setCodes);
        return new ArrayList<>(candidates.values());
    }

    /**
     * Candidates scoring at least the minimum score, best first. Ties keep candidate order.
     */
    List<ScoredCard> rank(List<Card> candidates, SeedCardAnalysis target) {
        List<ScoredCard> ranked = new ArrayList<>();
        for (Card card : candidates) {
            ScoredCard scored = scorer.score(card, target);
            if (scored.getScore() >= tuning.getMinimumScore()) {
                ranked.add(scored);
            }
        }
        ranked.sort(Comparator.comparingDouble(ScoredCard::getScore).reversed());
        return ranked;
    }

    Map<Integer, Integer> collectionCounts() {
        if (collectionLookup == null) {
            return Map.of();
        }
        try {
            Map<Integer, Integer> counts = collectionLookup.getCollectionCounts();
            return counts == null ? Map.of() : counts;
        } catch (LookupException e) {
            log.warn("Collection unavailable, continuing without ownership: {}", e.getMessage());
            return Map.of();
        }
    }

    static List<ScoredCard> ownedOnly(List<ScoredCard> ranked, Map<Integer, Integer> collection) {
        return ranked.stream()
                .filter(scored -> collection.getOrDefault(scored.getCardId(), 0) > 0)
                .collect(Collectors.toList());
    }

    CardWithOwnership withOwnership(Card card, double score, String reasoning, Map<Integer, Integer> collection) {
        int owned = collection.getOrDefault(card.getId(), 0);
        return CardWithOwnership.builder()
                .cardId(card.getId())
                .name(card.getName())
                .manaCost(card.getManaCost())
                .cmc(card.getWholeCmc())
                .colors(card.getColors())
                .typeLine(card.getTypeLine())
                .rarity(card.getRarity())
                .imageUri(card.getImageUri())
                .score(score)
                .reasoning(reasoning)
                .inCollection(owned > 0)
                .ownedCount(owned)
                .neededCount(Math.max(tuning.getMaxCopies() - owned, 0))
                .build();
    }

    /**
     * Basic lands in proportion to weighted color counts: target colors weigh 4, the top 20
     * suggestions 2 and the rest 1. Every represented color gets at least one land.
     */
    List<SuggestedLand> suggestLands(List<String> targetColors, List<CardWithOwnership> suggestions, int totalLands) {
        Map<String, Integer> colorCounts = new HashMap<>();
        for (String color : targetColors) {
            colorCounts.merge(color, tuning.getSeedColorWeight(), Integer::sum);
        }
        for (int i = 0; i < suggestions.size(); i++) {
            int weight = i < tuning.getTopSuggestionCount() ? tuning.getTopSuggestionWeight() : 1;
            List<String> colors = suggestions.get(i).getColors();
            if (colors != null) {
                colors.forEach(color -> colorCounts.merge(color, weight, Integer::sum));
            }
        }

        int totalWeight = colorCounts.values().stream().mapToInt(Integer::intValue).sum();
        List<SuggestedLand> lands = new ArrayList<>();
        if (totalWeight == 0) {
            return lands;
        }

        for (String color : ColorCombinations.inColorOrder(colorCounts.keySet())) {
            Optional<BasicLand> basic = BasicLand.forColor(color);
            if (basic.isEmpty()) {
                continue;
            }
            double proportion = (double) colorCounts.get(color) / totalWeight;
            int quantity = Math.max((int) (proportion * totalLands + 0.5), 1);
            lands.add(basic.get().suggest(quantity));
        }
        return lands;
    }

    /**
     * Copies to play: planeswalkers 2 (3 when strong), legends 2, cheap strong spells 4, otherwise by
     * CMC and score. Never more than the copies still allowed, never below 1.
     */
    static int recommendedCopies(Card card, double score, int alreadyInDeck, int maxCopies) {
        int cmc = card.getWholeCmc();
        int copies;
        if (TypeLines.containsType(card.getTypeLine(), "Planeswalker")) {
            copies = score >= 0.8 ? 3 : 2;
        } else if (TypeLines.containsType(card.getTypeLine(), "Legendary")) {
            copies = 2;
        } else if (cmc <= 2 && score >= 0.7) {
            copies = 4;
        } else if (cmc <= 3) {
            copies = score >= 0.75 ? 4 : 3;
        } else if (cmc <= 4) {
            copies = score >= 0.75 ? 3 : 2;
        } else {
            copies = score >= 0.8 ? 2 : 1;
        }
        return Math.max(Math.min(copies, maxCopies - alreadyInDeck), 1);
    }

    static int recommendedLandCount(double averageCmc) {
        if (averageCmc < 2.5) {
            return 22;
        }
        if (averageCmc < 3.5) {
            return 24;
        }
        return 26;
    }

    /**
     * Curve-gap score: larger shortfalls against the ideal curve score higher.
     */
    double gapScore(Card card, Map<Integer, Integer> currentCurve) {
        if (card.isLand()) {
            return LAND_GAP_SCORE;
        }
        int bucket = Math.min(card.getWholeCmc(), CURVE_BUCKET_CAP);
        int ideal = tuning.getIterativeIdealCurve().getOrDefault(bucket, 0);
        int gap = ideal - currentCurve.getOrDefault(bucket, 0);
        if (gap > 0) {
            return Math.min(0.5 + 0.1 * gap, 1.0);
        }
        return gap == 0 ? AT_IDEAL_SCORE : OVER_IDEAL_SCORE;
    }

    private List<Card> resolveDeck(List<Integer> deckCardIds) {
        try (BulkCardFetcher fetcher = new BulkCardFetcher(cardLookup)) {
            return fetcher.fetchAllOrdered(deckCardIds);
        }
    }

    private String seedSetCode(int seedCardId, List<Card> deckCards) {
        if (seedCardId > 0) {
            for (Card card : deckCards) {
                if (card.getId() == seedCardId) {
                    return card.getSetCode();
                }
            }
        }
        return deckCards.get(0).getSetCode();
    }

    private static boolean sharesColor(Card card, SeedCardAnalysis deckAnalysis) {
        if (card.isColorless() || deckAnalysis.getColors().isEmpty()) {
            return true;
        }
        return card.getColors().stream().anyMatch(deckAnalysis.getColors()::contains);
    }

    private static Map<Integer, Integer> currentCurve(List<Card> deckCards) {
        Map<Integer, Integer> curve = new TreeMap<>();
        for (Card card : deckCards) {
            if (!card.isLand()) {
                curve.merge(Math.min(card.getWholeCmc(), CURVE_BUCKET_CAP), 1, Integer::sum);
            }
        }
        return curve;
    }

    private static double averageCmc(List<Card> deckCards) {
        return deckCards.stream()
                .filter(card -> !card.isLand())
                .mapToDouble(Card::getCmc)
                .average()
                .orElse(0.0);
    }

    private SeedDeckAnalysis buildAnalysis(SeedCardAnalysis seedAnalysis, List<CardWithOwnership> suggestions,
                                           List<SuggestedLand> lands) {
        SeedDeckAnalysis analysis = new SeedDeckAnalysis();
        int totalLands = lands.stream().mapToInt(SuggestedLand::quantity).sum();

        for (CardWithOwnership card : suggestions) {
            if (card.isInCollection()) {
                analysis.setInCollectionCount(analysis.getInCollectionCount() + 1);
            } else {
                analysis.setMissingCount(analysis.getMissingCount() + 1);
                analysis.getMissingWildcardCost().merge(rarityKey(card.getRarity()), 1, Integer::sum);
            }
        }

        analysis.setColorIdentity(seedAnalysis.getColors());
        analysis.setKeywords(keywordNames(seedAnalysis));
        analysis.setThemes(seedAnalysis.getThemes());
        analysis.setIdealCurve(new TreeMap<>(tuning.getReportedIdealCurve()));
        analysis.setSuggestedLandCount(totalLands);
        // seed copies count toward the total
        analysis.setTotalCards(suggestions.size() + totalLands + tuning.getMaxCopies());
        return analysis;
    }

    static String rarityKey(String rarity) {
        return rarity == null ? "" : rarity.toLowerCase(Locale.ROOT);
    }

    private static List<String> keywordNames(SeedCardAnalysis analysis) {
        return analysis.getKeywords().stream().map(KeywordInfo::keyword).collect(Collectors.toList());
    }

    private List<String> standardSets() {
        if (standardSetsLookup == null) {
            return List.of();
        }
        try {
            return standardSetsLookup.getStandardSets();
        } catch (LookupException e) {
            log.warn("Standard sets unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    SeedBuilderTuning tuning() {
        return tuning;
    }
}
