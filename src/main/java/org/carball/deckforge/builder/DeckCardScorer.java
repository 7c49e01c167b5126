package org.carball.deckforge.builder;

import org.carball.deckforge.analyzer.QualityScorer;
import org.carball.deckforge.analyzer.ReasoningFormatter;
import org.carball.deckforge.config.DeckConstructionTuning;
import org.carball.deckforge.config.DraftArchetype;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.recommendation.ScoredCard;
import org.carball.deckforge.ontology.KeywordOntology;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores the candidates of one color combination against each other.
 */
class DeckCardScorer {

    private static final double NEUTRAL = 0.5;
    private static final int SYNERGY_SATURATION = 5;
    private static final double MULTICOLOR_BONUS = 0.85;

    private static final double ARCHETYPE_QUALITY_WEIGHT = 0.35;
    private static final double ARCHETYPE_CMC_WEIGHT = 0.30;
    private static final double ARCHETYPE_TYPE_WEIGHT = 0.20;
    private static final double ARCHETYPE_SYNERGY_WEIGHT = 0.15;

    private static final List<String> SPELL_HEAVY_TEXT = List.of("destroy", "exile", "draw", "counter");

    private final QualityScorer qualityScorer;
    private final DeckConstructionTuning tuning;
    private final List<Card> candidates;
    private final String setCode;
    private final String draftFormat;
    private final Map<Integer, Integer> candidateCurve = new HashMap<>();
    private final Map<Integer, Set<String>> keywordsByCard = new HashMap<>();

    DeckCardScorer(QualityScorer qualityScorer, DeckConstructionTuning tuning, List<Card> candidates,
                   String setCode, String draftFormat) {
        this.qualityScorer = qualityScorer;
        this.tuning = tuning;
        this.candidates = candidates;
        this.setCode = setCode;
        this.draftFormat = draftFormat;

        for (Card card : candidates) {
            if (!card.isLand()) {
                candidateCurve.merge(card.getWholeCmc(), 1, Integer::sum);
            }
            if (card.hasOracleText()) {
                keywordsByCard.put(card.getId(), KeywordOntology.extractKeywords(card.getOracleText()));
            }
        }
    }

    /**
     * Quality, curve, pool synergy and a mono-color bonus.
     */
    ScoredCard scoreForDeck(Card card) {
        List<String> reasons = new ArrayList<>();

        // Factor 1: quality
        double quality = qualityScorer.scoreByWinRate(card, setCode, draftFormat);
        if (quality >= 0.7) {
            reasons.add("high-quality card");
        }

        // Factor 2: curve
        double curve = curveFit(card);
        if (curve >= 0.7) {
            reasons.add(String.format("good %d-drop", card.getWholeCmc()));
        }

        // Factor 3: pool synergy
        double synergy = poolSynergy(card);
        if (synergy >= 0.6) {
            reasons.add("synergizes with pool");
        }

        // Factor 4: fewer colors are easier to cast
        double colorBonus = card.getColors().size() > 1 ? MULTICOLOR_BONUS : 1.0;

        double score = quality * tuning.getQualityWeight()
                + curve * tuning.getCurveWeight()
                + synergy * tuning.getSynergyWeight()
                + colorBonus * tuning.getColorBonusWeight();
        return new ScoredCard(card, score, ReasoningFormatter.list(reasons, "Standard playable"));
    }

    ScoredCard scoreForArchetype(Card card, DraftArchetype archetype) {
        List<String> reasons = new ArrayList<>();

        double quality = qualityScorer.scoreByWinRate(card, setCode, draftFormat);
        if (quality >= 0.7) {
            reasons.add("high-quality card");
        }

        double cmcFit = archetypeCmcFit(card, archetype);
        if (cmcFit >= 0.8) {
            reasons.add(String.format("great %d-drop for %s", card.getWholeCmc(), archetype.getDisplayName()));
        }

        double typeFit = archetypeTypeFit(card, archetype);
        if (typeFit >= 0.8) {
            if (card.isCreature() && archetype.isCreatureHeavy()) {
                reasons.add("creature for aggro");
            } else if (!card.isCreature() && archetype.isSpellHeavy()) {
                reasons.add("spell for control");
            }
        }

        double synergy = poolSynergy(card);
        if (synergy >= 0.7) {
            reasons.add("synergy bonus");
        }

        double score = quality * ARCHETYPE_QUALITY_WEIGHT
                + cmcFit * ARCHETYPE_CMC_WEIGHT
                + typeFit * ARCHETYPE_TYPE_WEIGHT
                + synergy * ARCHETYPE_SYNERGY_WEIGHT;
        return new ScoredCard(card, score,
                ReasoningFormatter.list(reasons, "Good for " + archetype.getDisplayName()));
    }

    /**
     * Rewards CMCs the candidate pool is short on. Costs above the table have an ideal of one.
     */
    double curveFit(Card card) {
        int cmc = card.getWholeCmc();
        int ideal = cmc > 7 ? 1 : tuning.getCandidateCurve().getOrDefault(cmc, 0);
        int current = candidateCurve.getOrDefault(cmc, 0);

        if (current < ideal) {
            return Math.min(0.7 + 0.1 * (ideal - current), 1.0);
        } else if (current == ideal) {
            return 0.6;
        }
        return 0.4;
    }

    /**
     * 0.5 plus up to 0.5 for other candidates sharing a keyword; five sharers saturate.
     */
    double poolSynergy(Card card) {
        Set<String> keywords = keywordsByCard.get(card.getId());
        if (keywords == null || keywords.isEmpty()) {
            return NEUTRAL;
        }

        int sharing = 0;
        for (Card other : candidates) {
            if (other.getId() == card.getId()) {
                continue;
            }
            Set<String> otherKeywords = keywordsByCard.get(other.getId());
            if (otherKeywords != null && otherKeywords.stream().anyMatch(keywords::contains)) {
                sharing++;
            }
        }

        double score = Math.min((double) sharing / SYNERGY_SATURATION, 1.0);
        return score * 0.5 + 0.5;
    }

    static double archetypeCmcFit(Card card, DraftArchetype archetype) {
        int cmc = Math.min(card.getWholeCmc(), DraftArchetype.CURVE_CAP);
        int ideal = archetype.preferredAt(cmc);

        if (ideal == 0 && cmc >= DraftArchetype.CURVE_CAP) {
            return archetype.getMaxAverageCmc() <= 2.5 ? 0.2 : 0.5;
        }
        if (ideal >= 5) {
            return 1.0;
        } else if (ideal >= 3) {
            return 0.8;
        } else if (ideal >= 1) {
            return 0.6;
        }
        return 0.4;
    }

    static double archetypeTypeFit(Card card, DraftArchetype archetype) {
        boolean creature = card.isCreature();
        if (archetype.isCreatureHeavy() && creature) {
            return 1.0;
        }
        if (archetype.isSpellHeavy() && !creature) {
            if (card.hasOracleText()) {
                String text = card.getOracleText().toLowerCase(Locale.ROOT);
                if (SPELL_HEAVY_TEXT.stream().anyMatch(text::contains)) {
                    return 1.0;
                }
            }
            return 0.8;
        }
        return 0.7;
    }
}
