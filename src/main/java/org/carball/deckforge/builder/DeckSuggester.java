package org.carball.deckforge.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.analyzer.QualityScorer;
import org.carball.deckforge.config.DeckConstructionTuning;
import org.carball.deckforge.config.DraftArchetype;
import org.carball.deckforge.lookup.BulkCardFetcher;
import org.carball.deckforge.lookup.CardLookup;
import org.carball.deckforge.lookup.RatingsLookup;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.ColorCombination;
import org.carball.deckforge.model.deck.DeckSuggestionAnalysis;
import org.carball.deckforge.model.deck.SuggestDecksResponse;
import org.carball.deckforge.model.deck.SuggestedCard;
import org.carball.deckforge.model.deck.SuggestedDeck;
import org.carball.deckforge.model.deck.SuggestedLand;
import org.carball.deckforge.model.deck.Viability;
import org.carball.deckforge.model.recommendation.ScoredCard;
import org.carball.deckforge.ontology.ColorCombinations;
import org.carball.deckforge.ontology.KeywordOntology;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds complete 40-card limited decks from a draft pool, across all 25 color combinations.
 */
@Slf4j
public class DeckSuggester {

    private static final int SELECTION_CURVE_CAP = 7;
    private static final int TOP_CARD_COUNT = 3;
    private static final int SYNERGY_THEME_MINIMUM = 3;

    private final CardLookup cardLookup;
    private final QualityScorer qualityScorer;
    private final DeckConstructionTuning tuning;

    public DeckSuggester(CardLookup cardLookup, RatingsLookup ratingsLookup) {
        this(cardLookup, ratingsLookup, DeckConstructionTuning.defaults());
    }

    public DeckSuggester(CardLookup cardLookup, RatingsLookup ratingsLookup, DeckConstructionTuning tuning) {
        this.cardLookup = cardLookup;
        this.qualityScorer = new QualityScorer(ratingsLookup);
        this.tuning = tuning;
    }

    /**
     * Every viable deck of the pool, best first. Problems with the pool are reported on the response.
     */
    public SuggestDecksResponse suggestDecks(List<Integer> draftPool, String setCode, String draftFormat) {
        if (draftPool == null || draftPool.isEmpty()) {
            return SuggestDecksResponse.failed("No cards in draft pool");
        }

        List<Card> poolCards = loadPool(draftPool);
        if (poolCards.isEmpty()) {
            return SuggestDecksResponse.failed("Could not load any cards from draft pool");
        }
        log.info("Suggesting decks from a pool of {} cards", poolCards.size());

        List<SuggestedDeck> suggestions = new ArrayList<>();
        for (ColorCombination combo : ColorCombinations.all()) {
            SuggestedDeck deck = evaluateColorCombination(combo, poolCards, setCode, draftFormat);
            if (deck != null) {
                suggestions.add(deck);
            }
        }
        suggestions.sort(Comparator.comparingDouble(SuggestedDeck::getScore).reversed());

        SuggestDecksResponse response = new SuggestDecksResponse();
        response.setSuggestions(suggestions);
        response.setTotalCombos(ColorCombinations.all().size());
        response.setViableCombos(suggestions.size());
        if (!suggestions.isEmpty()) {
            response.setBestCombo(suggestions.get(0).getColorCombo());
        }

        log.info("Found {} viable color combinations", suggestions.size());
        return response;
    }

    /**
     * The best deck of the pool for one limited archetype.
     *
     * @throws IllegalArgumentException for an unknown archetype or an unusable pool
     * @throws NoViableDeckException when no combination supports the archetype
     */
    public SuggestedDeck suggestDeckByArchetype(List<Integer> draftPool, String setCode, String draftFormat,
                                                String archetypeKey) {
        DraftArchetype archetype = DraftArchetype.fromName(archetypeKey);

        if (draftPool == null || draftPool.isEmpty()) {
            throw new IllegalArgumentException("no cards in draft pool");
        }
        List<Card> poolCards = loadPool(draftPool);
        if (poolCards.isEmpty()) {
            throw new IllegalArgumentException("could not load any cards from draft pool");
        }
        log.info("Building {} deck from a pool of {} cards", archetype.getDisplayName(), poolCards.size());

        SuggestedDeck best = null;
        double bestScore = 0.0;
        for (ColorCombination combo : ColorCombinations.all()) {
            List<Card> candidates = filterByColorFit(poolCards, combo);
            if (!isViableForArchetype(candidates, archetype)) {
                continue;
            }

            SuggestedDeck deck = buildArchetypeDeck(combo, candidates, setCode, draftFormat, archetype);
            if (deck != null && deck.getScore() > bestScore) {
                bestScore = deck.getScore();
                best = deck;
            }
        }

        if (best == null) {
            throw new NoViableDeckException(String.format("no viable %s deck found in pool", archetype.getDisplayName()));
        }
        log.info("Best {} deck is {} with score {}", archetype.getDisplayName(), best.getColorCombo().name(),
                String.format("%.3f", best.getScore()));
        return best;
    }

    public String exportToArenaFormat(SuggestedDeck deck) {
        return ArenaExporter.toArenaFormat(deck);
    }

    /**
     * Nonland cards whose colors all lie in the combination, plus every colorless nonland card.
     */
    public static List<Card> filterByColorFit(List<Card> poolCards, ColorCombination combo) {
        return poolCards.stream()
                .filter(card -> !card.isLand())
                .filter(card -> card.isColorless() || combo.colors().containsAll(card.getColors()))
                .collect(Collectors.toList());
    }

    private List<Card> loadPool(List<Integer> draftPool) {
        try (BulkCardFetcher fetcher = new BulkCardFetcher(cardLookup)) {
            return fetcher.fetchAllOrdered(draftPool);
        }
    }

    boolean isViable(List<Card> candidates) {
        return candidates.size() >= tuning.getMinimumCandidates()
                && creatureCount(candidates) >= tuning.getMinimumCreatures();
    }

    boolean isViableForArchetype(List<Card> candidates, DraftArchetype archetype) {
        return candidates.size() >= tuning.getMinimumCandidates()
                && creatureCount(candidates) >= archetype.getCreatureMin() - tuning.getArchetypeCreatureSlack();
    }

    private SuggestedDeck evaluateColorCombination(ColorCombination combo, List<Card> poolCards,
                                                   String setCode, String draftFormat) {
        List<Card> candidates = filterByColorFit(poolCards, combo);
        if (!isViable(candidates)) {
            log.debug("{}: not viable with {} candidates", combo.name(), candidates.size());
            return null;
        }

        DeckCardScorer scorer = new DeckCardScorer(qualityScorer, tuning, candidates, setCode, draftFormat);
        List<ScoredCard> scored = candidates.stream().map(scorer::scoreForDeck).collect(Collectors.toList());

        List<ScoredCard> selected = CurveSelector.select(scored, tuning.getSpellCount(),
                tuning.getSelectionCurve(), SELECTION_CURVE_CAP);
        List<SuggestedLand> lands = LandAllocator.allocate(cardsOf(selected), combo, tuning.getLandCount());

        DeckSuggestionAnalysis analysis = analyze(selected, candidates);
        double score = deckScore(selected, analysis, combo);
        Viability viability = viability(score, analysis);
        log.debug("{}: score {} ({})", combo.name(), String.format("%.3f", score), viability.getLabel());

        return toDeck(combo, selected, lands, score, viability, analysis);
    }

    private SuggestedDeck buildArchetypeDeck(ColorCombination combo, List<Card> candidates, String setCode,
                                             String draftFormat, DraftArchetype archetype) {
        DeckCardScorer scorer = new DeckCardScorer(qualityScorer, tuning, candidates, setCode, draftFormat);
        List<ScoredCard> scored = candidates.stream()
                .map(card -> scorer.scoreForArchetype(card, archetype))
                .collect(Collectors.toList());

        int nonlandCount = tuning.getDeckSize() - archetype.getLandCount();
        List<ScoredCard> selected = CurveSelector.select(scored, nonlandCount,
                archetype.getPreferredCurve(), DraftArchetype.CURVE_CAP);
        if (selected.size() < nonlandCount - tuning.getFillTolerance()) {
            log.debug("{}: only {} of {} {} slots filled", combo.name(), selected.size(), nonlandCount,
                    archetype.getKey());
            return null;
        }

        List<SuggestedLand> lands = LandAllocator.allocate(cardsOf(selected), combo, archetype.getLandCount());
        DeckSuggestionAnalysis analysis = analyze(selected, candidates);
        double score = archetypeScore(selected, analysis, combo, archetype);

        Viability viability = Viability.WEAK;
        if (score >= tuning.getStrongScore()) {
            viability = Viability.STRONG;
        } else if (score >= tuning.getViableScore()) {
            viability = Viability.VIABLE;
        }
        return toDeck(combo, selected, lands, score, viability, analysis);
    }

    private SuggestedDeck toDeck(ColorCombination combo, List<ScoredCard> selected, List<SuggestedLand> lands,
                                 double score, Viability viability, DeckSuggestionAnalysis analysis) {
        List<SuggestedCard> spells = selected.stream().map(DeckSuggester::toSuggestedCard).collect(Collectors.toList());
        int landTotal = lands.stream().mapToInt(SuggestedLand::quantity).sum();
        return SuggestedDeck.builder()
                .colorCombo(combo)
                .spells(spells)
                .lands(lands)
                .totalCards(spells.size() + landTotal)
                .score(score)
                .viability(viability)
                .analysis(analysis)
                .build();
    }

    private static SuggestedCard toSuggestedCard(ScoredCard scored) {
        Card card = scored.getCard();
        return SuggestedCard.builder()
                .cardId(card.getId())
                .name(card.getName())
                .typeLine(card.getTypeLine())
                .manaCost(card.getManaCost() == null ? "" : card.getManaCost())
                .imageUri(card.getImageUri() == null ? "" : card.getImageUri())
                .cmc(card.getWholeCmc())
                .colors(card.getColors())
                .rarity(card.getRarity())
                .score(scored.getScore())
                .reasoning(scored.getReasoning())
                .build();
    }

    DeckSuggestionAnalysis analyze(List<ScoredCard> selected, List<Card> candidates) {
        DeckSuggestionAnalysis analysis = new DeckSuggestionAnalysis();
        analysis.setPlayableCount(candidates.size());

        double totalCmc = 0.0;
        Map<String, Integer> keywordCounts = new LinkedHashMap<>();
        for (ScoredCard scored : selected) {
            Card card = scored.getCard();
            if (card.isCreature()) {
                analysis.setCreatureCount(analysis.getCreatureCount() + 1);
            } else {
                analysis.setSpellCount(analysis.getSpellCount() + 1);
            }
            analysis.getManaCurve().merge(card.getWholeCmc(), 1, Integer::sum);
            totalCmc += card.getCmc();
            for (String color : card.getColors()) {
                analysis.getColorDistribution().merge(color, 1, Integer::sum);
            }
            if (card.hasOracleText()) {
                for (String keyword : KeywordOntology.extractKeywords(card.getOracleText())) {
                    keywordCounts.merge(keyword, 1, Integer::sum);
                }
            }
        }

        if (!selected.isEmpty()) {
            analysis.setAverageCmc(totalCmc / selected.size());
        }
        for (int i = 0; i < TOP_CARD_COUNT && i < selected.size(); i++) {
            analysis.getTopCards().add(selected.get(i).getCard().getName());
        }
        keywordCounts.forEach((keyword, count) -> {
            if (count >= SYNERGY_THEME_MINIMUM) {
                analysis.getSynergies().add(String.format("%s (%d cards)", KeywordOntology.friendlyThemeName(keyword), count));
            }
        });
        return analysis;
    }

    double deckScore(List<ScoredCard> selected, DeckSuggestionAnalysis analysis, ColorCombination combo) {
        if (selected.isEmpty()) {
            return 0.0;
        }

        double average = averageScore(selected);

        // Factor 2: creature ratio
        double ratio = (double) analysis.getCreatureCount() / tuning.getSpellCount();
        double creatureScore;
        if (ratio >= 0.6 && ratio <= 0.75) {
            creatureScore = 1.0;
        } else if (ratio >= 0.5 && ratio <= 0.8) {
            creatureScore = 0.7;
        } else {
            creatureScore = 0.4;
        }

        // Factor 3: curve completeness
        boolean twoDrops = analysis.countAtCmc(2) >= 3;
        boolean threeDrops = analysis.countAtCmc(3) >= 3;
        boolean fourDrops = analysis.countAtCmc(4) >= 2;
        double curveScore;
        if (twoDrops && threeDrops && fourDrops) {
            curveScore = 1.0;
        } else if (twoDrops && threeDrops) {
            curveScore = 0.7;
        } else if (twoDrops || threeDrops) {
            curveScore = 0.5;
        } else {
            curveScore = 0.3;
        }

        return average * tuning.getAverageScoreWeight()
                + creatureScore * tuning.getCreatureRatioWeight()
                + curveScore * tuning.getCurveCompletenessWeight()
                + manaConsistency(combo) * tuning.getManaConsistencyWeight();
    }

    double archetypeScore(List<ScoredCard> selected, DeckSuggestionAnalysis analysis, ColorCombination combo,
                          DraftArchetype archetype) {
        if (selected.isEmpty()) {
            return 0.0;
        }

        int creatures = analysis.getCreatureCount();
        double creatureScore;
        if (creatures >= archetype.getCreatureMin() && creatures <= archetype.getCreatureMax()) {
            creatureScore = 1.0;
        } else if (creatures >= archetype.getCreatureMin() - 2 && creatures <= archetype.getCreatureMax() + 2) {
            creatureScore = 0.7;
        } else {
            creatureScore = 0.4;
        }

        double cmcScore;
        if (analysis.getAverageCmc() <= archetype.getMaxAverageCmc()) {
            cmcScore = 1.0;
        } else if (analysis.getAverageCmc() <= archetype.getMaxAverageCmc() + 0.3) {
            cmcScore = 0.7;
        } else {
            cmcScore = 0.4;
        }

        return averageScore(selected) * 0.40 + creatureScore * 0.20 + cmcScore * 0.20 + manaConsistency(combo) * 0.20;
    }

    Viability viability(double score, DeckSuggestionAnalysis analysis) {
        if (score >= tuning.getStrongScore() && analysis.getCreatureCount() >= tuning.getStrongCreatures()
                && analysis.getPlayableCount() >= tuning.getStrongPlayables()) {
            return Viability.STRONG;
        } else if (score >= tuning.getViableScore() && analysis.getCreatureCount() >= tuning.getViableCreatures()) {
            return Viability.VIABLE;
        }
        return Viability.WEAK;
    }

    /** One color is perfectly consistent; every extra color costs consistency. */
    static double manaConsistency(ColorCombination combo) {
        switch (combo.size()) {
            case 2:
                return 0.9;
            case 3:
                return 0.7;
            default:
                return 1.0;
        }
    }

    private static double averageScore(List<ScoredCard> selected) {
        return selected.stream().mapToDouble(ScoredCard::getScore).average().orElse(0.0);
    }

    private static int creatureCount(List<Card> cards) {
        return (int) cards.stream().filter(Card::isCreature).count();
    }

    private static List<Card> cardsOf(List<ScoredCard> scored) {
        return scored.stream().map(ScoredCard::getCard).collect(Collectors.toList());
    }
}
