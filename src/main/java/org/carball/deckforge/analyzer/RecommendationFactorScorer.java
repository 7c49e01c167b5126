package org.carball.deckforge.analyzer;

import org.carball.deckforge.config.RecommendationWeights;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.DeckComposition;
import org.carball.deckforge.model.deck.DeckContext;
import org.carball.deckforge.ontology.KeywordOntology;
import org.carball.deckforge.ontology.TypeLines;

/**
 * Color fit, mana curve, synergy and playability factors of a candidate against a deck.
 * Every factor is in [0, 1].
 */
public class RecommendationFactorScorer {

    private static final double NEUTRAL = 0.5;

    private static final double UNDER_CURVE_BASE = 0.7;
    private static final double CURVE_STEP = 0.1;
    private static final double AT_CURVE = 0.6;
    private static final double OVER_CURVE_BASE = 0.5;
    private static final double OVER_CURVE_FLOOR = 0.1;

    private static final double PARTIAL_COLOR_FACTOR = 0.5;

    private static final double IN_DRAFT_POOL = 0.9;
    private static final double OUTSIDE_DRAFT_POOL = 0.1;
    private static final double DEFAULT_PLAYABILITY = 0.8;

    private final RecommendationWeights weights;

    public RecommendationFactorScorer(RecommendationWeights weights) {
        this.weights = weights;
    }

    public double colorFit(Card card, DeckComposition composition) {
        if (card.isColorless()) {
            return 1.0;
        }

        int total = card.getColors().size();
        int matching = 0;
        for (String color : card.getColors()) {
            if (composition.getColorIdentity().contains(color)) {
                matching++;
            }
        }

        if (matching == 0) {
            return 0.0;
        }
        if (matching == total) {
            boolean allPrimary = composition.getPrimaryColors().containsAll(card.getColors());
            return allPrimary ? 1.0 : weights.getSplashColorFit();
        }
        return (double) matching / total * PARTIAL_COLOR_FACTOR;
    }

    public double manaCurve(Card card, DeckComposition composition) {
        if (card.isLand()) {
            return NEUTRAL;
        }

        int cmc = card.getWholeCmc();
        int current = composition.countAtCmc(cmc);
        int ideal = weights.idealCountAt(cmc);

        if (current < ideal) {
            return Math.min(UNDER_CURVE_BASE + CURVE_STEP * (ideal - current), 1.0);
        } else if (current == ideal) {
            return AT_CURVE;
        }
        return Math.max(OVER_CURVE_BASE - CURVE_STEP * (current - ideal), OVER_CURVE_FLOOR);
    }

    /**
     * Averages one signal per card keyword already present in the deck and one per creature type
     * the deck already runs at least three of. Neutral when nothing matches.
     */
    public double synergy(Card card, DeckComposition composition) {
        double synergy = 0.0;
        int synergyCount = 0;

        // Factor 1: shared keywords
        if (card.hasOracleText()) {
            for (String keyword : KeywordOntology.extractKeywords(card.getOracleText())) {
                if (composition.keywordCount(keyword) > 0) {
                    synergy += weights.getKeywordSynergyIncrement();
                    synergyCount++;
                }
            }
        }

        // Factor 2: tribal overlap
        if (card.isCreature()) {
            for (String creatureType : TypeLines.extractCreatureTypes(card.getTypeLine())) {
                double tribal = tribalBonus(composition.creatureTypeCount(creatureType));
                if (tribal > 0) {
                    synergy += tribal;
                    synergyCount++;
                }
            }
        }

        if (synergyCount == 0) {
            return NEUTRAL;
        }
        return Math.min(synergy / synergyCount, 1.0);
    }

    private double tribalBonus(int count) {
        if (count >= weights.getStrongTribalCount()) {
            return 0.8;
        } else if (count >= weights.getModerateTribalCount()) {
            return 0.6;
        } else if (count >= weights.getLightTribalCount()) {
            return 0.4;
        }
        return 0.0;
    }

    public double playability(Card card, DeckContext context) {
        if (context.isLimited() && context.getDraftCardIds() != null) {
            return context.getDraftCardIds().contains(card.getId()) ? IN_DRAFT_POOL : OUTSIDE_DRAFT_POOL;
        }
        return DEFAULT_PLAYABILITY;
    }
}
