package org.carball.deckforge.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.analyzer.DeckCompositionAnalyzer;
import org.carball.deckforge.analyzer.QualityScorer;
import org.carball.deckforge.analyzer.ReasoningFormatter;
import org.carball.deckforge.analyzer.RecommendationFactorScorer;
import org.carball.deckforge.config.RecommendationWeights;
import org.carball.deckforge.lookup.BulkCardFetcher;
import org.carball.deckforge.lookup.CardLookup;
import org.carball.deckforge.lookup.RatingsLookup;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.DeckComposition;
import org.carball.deckforge.model.deck.DeckContext;
import org.carball.deckforge.model.recommendation.CardRecommendation;
import org.carball.deckforge.model.recommendation.RecommendationFilters;
import org.carball.deckforge.model.recommendation.RecommendationSource;
import org.carball.deckforge.model.recommendation.ScoreFactors;
import org.carball.deckforge.ontology.TypeLines;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted multi-factor recommendation engine over a draft pool.
 */
@Slf4j
public class RuleBasedRecommendationEngine implements RecommendationEngine {

    private static final double POSITIVE_FACTOR = 0.6;
    private static final double HIGH_FACTOR = 0.8;

    private final CardLookup cardLookup;
    private final RecommendationWeights weights;
    private final DeckCompositionAnalyzer analyzer;
    private final RecommendationFactorScorer factorScorer;
    private final QualityScorer qualityScorer;

    public RuleBasedRecommendationEngine(CardLookup cardLookup, RatingsLookup ratingsLookup) {
        this(cardLookup, ratingsLookup, RecommendationWeights.defaults());
    }

    /**
     * @param ratingsLookup may be null; quality then falls back to rarity
     */
    public RuleBasedRecommendationEngine(CardLookup cardLookup, RatingsLookup ratingsLookup,
                                         RecommendationWeights weights) {
        this.cardLookup = cardLookup;
        this.weights = weights;
        this.analyzer = new DeckCompositionAnalyzer(weights.getPrimaryColorCount());
        this.factorScorer = new RecommendationFactorScorer(weights);
        this.qualityScorer = new QualityScorer(ratingsLookup);
    }

    @Override
    public List<CardRecommendation> recommend(DeckContext deck, RecommendationFilters filters) {
        checkReady(deck);
        if (filters == null) {
            filters = RecommendationFilters.builder()
                    .maxResults(weights.getDefaultMaxResults())
                    .minScore(weights.getDefaultMinScore())
                    .build();
        }

        DeckComposition composition = analyzer.analyze(deck);
        List<Card> candidates = gatherCandidates(deck, filters);
        log.debug("Scoring {} candidates against deck {}", candidates.size(), deck.getDeckId());

        List<CardRecommendation> recommendations = new ArrayList<>();
        for (Card card : candidates) {
            if (deck.containsCard(card.getId())) {
                continue;
            }
            if (!matchesFilters(card, filters)) {
                continue;
            }

            CardRecommendation recommendation = score(card, deck, composition);
            if (recommendation.getScore() >= filters.getMinScore()) {
                recommendations.add(recommendation);
            }
        }

        // stable: equal scores keep pool order
        recommendations.sort(Comparator.comparingDouble(CardRecommendation::getScore).reversed());
        if (recommendations.size() > filters.getMaxResults()) {
            recommendations = new ArrayList<>(recommendations.subList(0, Math.max(filters.getMaxResults(), 0)));
        }

        log.info("Recommended {} of {} candidates for deck {}", recommendations.size(), candidates.size(), deck.getDeckId());
        return recommendations;
    }

    @Override
    public String explain(int cardId, DeckContext deck) {
        checkReady(deck);
        Card card = cardLookup.findCard(cardId)
                .orElseThrow(() -> new IllegalArgumentException("card not found: " + cardId));
        DeckComposition composition = analyzer.analyze(deck);
        return score(card, deck, composition).getReasoning();
    }

    @Override
    public void recordAcceptance(DeckContext deck, int cardId) {
        log.debug("Recommendation of card {} accepted for deck {}", cardId, deck == null ? null : deck.getDeckId());
    }

    private void checkReady(DeckContext deck) {
        if (cardLookup == null) {
            throw new IllegalStateException("card lookup is not initialized");
        }
        if (deck == null) {
            throw new IllegalStateException("deck context is nil");
        }
    }

    /**
     * Draft pool cards, preferring metadata already on the deck context and bulk-fetching the rest.
     * Without a draft pool there are no candidates.
     */
    private List<Card> gatherCandidates(DeckContext deck, RecommendationFilters filters) {
        if (!filters.isOnlyDraftPool() || filters.getDraftPool() == null || filters.getDraftPool().isEmpty()) {
            log.debug("No draft pool given, nothing to recommend from");
            return List.of();
        }

        Map<Integer, Card> resolved = new LinkedHashMap<>();
        List<Integer> missing = new ArrayList<>();
        for (Integer cardId : filters.getDraftPool()) {
            Card known = deck.getCardMetadata().get(cardId);
            if (known != null) {
                resolved.put(cardId, known);
            } else {
                missing.add(cardId);
            }
        }

        if (!missing.isEmpty()) {
            try (BulkCardFetcher fetcher = new BulkCardFetcher(cardLookup)) {
                for (Card card : fetcher.fetchAllOrdered(missing)) {
                    resolved.put(card.getId(), card);
                }
            }
        }

        List<Card> candidates = new ArrayList<>();
        for (Integer cardId : filters.getDraftPool()) {
            Card card = resolved.remove(cardId);
            if (card != null) {
                candidates.add(card);
            }
        }
        return candidates;
    }

    private boolean matchesFilters(Card card, RecommendationFilters filters) {
        if (filters.getColors() != null && !filters.getColors().isEmpty() && !card.isColorless()) {
            boolean overlap = card.getColors().stream().anyMatch(filters.getColors()::contains);
            if (!overlap) {
                return false;
            }
        }

        if (filters.getCardTypes() != null && !filters.getCardTypes().isEmpty()) {
            boolean typeMatch = filters.getCardTypes().stream()
                    .anyMatch(type -> TypeLines.containsType(card.getTypeLine(), type));
            if (!typeMatch) {
                return false;
            }
        }

        if (filters.getCmcRange() != null && !filters.getCmcRange().contains(card.getWholeCmc())) {
            return false;
        }

        return filters.isIncludeLands() || !card.isLand();
    }

    private CardRecommendation score(Card card, DeckContext deck, DeckComposition composition) {
        ScoreFactors factors = ScoreFactors.builder()
                .colorFit(factorScorer.colorFit(card, composition))
                .manaCurve(factorScorer.manaCurve(card, composition))
                .quality(qualityScorer.score(card, deck.getSetCode(), deck.getDraftFormat()))
                .synergy(factorScorer.synergy(card, composition))
                .playable(factorScorer.playability(card, deck))
                .build();

        double score = factors.getColorFit() * weights.getColorFitWeight()
                + factors.getManaCurve() * weights.getManaCurveWeight()
                + factors.getQuality() * weights.getQualityWeight()
                + factors.getSynergy() * weights.getSynergyWeight()
                + factors.getPlayable() * weights.getPlayabilityWeight();

        return CardRecommendation.builder()
                .card(card)
                .score(score)
                .factors(factors)
                .reasoning(explanation(card, factors))
                .source(primarySource(factors))
                .confidence(confidence(factors))
                .build();
    }

    private String explanation(Card card, ScoreFactors factors) {
        List<String> reasons = new ArrayList<>();

        if (factors.getColorFit() >= 0.85) {
            reasons.add("matches your deck's colors perfectly");
        } else if (factors.getColorFit() >= 0.7) {
            reasons.add("fits your color identity");
        } else if (factors.getColorFit() < 0.3) {
            reasons.add("color requirements may be difficult");
        }

        if (factors.getManaCurve() >= 0.7) {
            reasons.add(String.format("fills a gap in your mana curve at %d CMC", card.getWholeCmc()));
        } else if (factors.getManaCurve() <= 0.3) {
            reasons.add(String.format("your deck already has many %d-drops", card.getWholeCmc()));
        }

        if (factors.getQuality() >= 0.8) {
            reasons.add("is a high-quality card");
        } else if (factors.getQuality() >= 0.7) {
            reasons.add("has strong ratings");
        }

        if (factors.getSynergy() >= 0.8) {
            reasons.add("has excellent synergy with your deck's strategy");
        } else if (factors.getSynergy() >= 0.7) {
            reasons.add("has strong synergy with your existing cards");
        } else if (factors.getSynergy() >= 0.6) {
            reasons.add("synergizes well with your deck");
        }

        return ReasoningFormatter.sentence(reasons);
    }

    /**
     * The strictly highest factor; ties go to the earlier factor.
     */
    static RecommendationSource primarySource(ScoreFactors factors) {
        RecommendationSource source = RecommendationSource.QUALITY;
        double max = 0.0;
        if (factors.getColorFit() > max) {
            max = factors.getColorFit();
            source = RecommendationSource.COLOR_FIT;
        }
        if (factors.getManaCurve() > max) {
            max = factors.getManaCurve();
            source = RecommendationSource.MANA_CURVE;
        }
        if (factors.getQuality() > max) {
            max = factors.getQuality();
            source = RecommendationSource.QUALITY;
        }
        if (factors.getSynergy() > max) {
            max = factors.getSynergy();
            source = RecommendationSource.SYNERGY;
        }
        if (factors.getPlayable() > max) {
            source = RecommendationSource.PLAYABILITY;
        }
        return source;
    }

    static double confidence(ScoreFactors factors) {
        double[] values = {
                factors.getColorFit(), factors.getManaCurve(), factors.getQuality(),
                factors.getSynergy(), factors.getPlayable()
        };

        int positive = 0;
        int high = 0;
        for (double value : values) {
            if (value > POSITIVE_FACTOR) {
                positive++;
            }
            if (value > HIGH_FACTOR) {
                high++;
            }
        }

        double confidence = (double) positive / values.length;
        if (high >= 2) {
            confidence += 0.1;
        }
        if (high >= 3) {
            confidence += 0.1;
        }
        return Math.min(confidence, 1.0);
    }
}
