package org.carball.deckforge.seed;

import org.carball.deckforge.analyzer.KeywordSynergyCalculator;
import org.carball.deckforge.analyzer.ReasoningFormatter;
import org.carball.deckforge.config.SeedBuilderTuning;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.analyzer.QualityScorer;
import org.carball.deckforge.model.recommendation.ScoreBreakdown;
import org.carball.deckforge.model.recommendation.ScoredCard;
import org.carball.deckforge.model.recommendation.SynergyDetail;
import org.carball.deckforge.model.recommendation.SynergyDetail.SynergyType;
import org.carball.deckforge.model.seed.SeedCardAnalysis;
import org.carball.deckforge.model.synergy.KeywordInfo;
import org.carball.deckforge.model.synergy.KeywordSynergy;
import org.carball.deckforge.ontology.ColorCombinations;
import org.carball.deckforge.ontology.KeywordOntology;
import org.carball.deckforge.ontology.TribalDatabase;
import org.carball.deckforge.ontology.TypeLines;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores candidates against a build-around target, either one seed card or a whole deck.
 */
public class SeedCardScorer {

    private static final double COLORLESS_SEED_FIT = 0.8;
    private static final double PARTIAL_COLOR_FACTOR = 0.7;
    private static final double LAND_CURVE_FIT = 0.5;
    private static final double TRIBAL_MATCH = 0.8;
    private static final double THEME_MATCH = 0.7;
    private static final double NEUTRAL_SYNERGY = 0.5;
    private static final double LEGALITY = 1.0;
    private static final double PLAYABILITY = 0.8;

    private static final double COLOR_REASON_THRESHOLD = 0.8;
    private static final double REASON_THRESHOLD = 0.7;

    private final SeedBuilderTuning tuning;
    private final TribalDatabase tribes;

    public SeedCardScorer(SeedBuilderTuning tuning) {
        this(tuning, TribalDatabase.defaults());
    }

    public SeedCardScorer(SeedBuilderTuning tuning, TribalDatabase tribes) {
        this.tuning = tuning;
        this.tribes = tribes;
    }

    public static SeedCardAnalysis analyzeSeed(Card card) {
        SeedCardAnalysis analysis = new SeedCardAnalysis();
        analysis.setCard(card);
        analysis.setColors(new ArrayList<>(card.getColors()));
        analysis.setCmc(card.getWholeCmc());

        List<KeywordInfo> keywords = KeywordOntology.extractKeywordsWithInfo(card.getOracleText());
        analysis.setKeywords(keywords);
        analysis.setThemes(themesOf(keywords));

        analysis.setCardTypes(TypeLines.extractTypes(card.getTypeLine()));
        analysis.setCreature(card.isCreature());
        if (card.isCreature()) {
            analysis.setCreatureTypes(new ArrayList<>(TypeLines.extractCreatureTypes(card.getTypeLine())));
        }
        return analysis;
    }

    /**
     * Collective analysis of a deck: union of colors, keywords, themes and creature types,
     * with the average nonland CMC as the target CMC.
     */
    public static SeedCardAnalysis analyzeDeck(List<Card> deckCards) {
        Set<String> colors = new LinkedHashSet<>();
        Map<String, KeywordInfo> keywords = new LinkedHashMap<>();
        Set<String> cardTypes = new LinkedHashSet<>();
        Set<String> creatureTypes = new LinkedHashSet<>();
        boolean anyCreature = false;
        double totalCmc = 0.0;
        int nonLands = 0;

        for (Card card : deckCards) {
            colors.addAll(card.getColors());
            for (KeywordInfo info : KeywordOntology.extractKeywordsWithInfo(card.getOracleText())) {
                keywords.putIfAbsent(info.keyword(), info);
            }
            cardTypes.addAll(TypeLines.extractTypes(card.getTypeLine()));
            if (card.isCreature()) {
                anyCreature = true;
                creatureTypes.addAll(TypeLines.extractCreatureTypes(card.getTypeLine()));
            }
            if (!card.isLand()) {
                totalCmc += card.getCmc();
                nonLands++;
            }
        }

        SeedCardAnalysis analysis = new SeedCardAnalysis();
        analysis.setColors(ColorCombinations.inColorOrder(colors));
        analysis.setKeywords(new ArrayList<>(keywords.values()));
        analysis.setThemes(themesOf(analysis.getKeywords()));
        analysis.setCardTypes(new ArrayList<>(cardTypes));
        analysis.setCreature(anyCreature);
        analysis.setCreatureTypes(new ArrayList<>(creatureTypes));
        analysis.setCmc(nonLands == 0 ? 0 : (int) Math.round(totalCmc / nonLands));
        return analysis;
    }

    /**
     * Scores a candidate with the fixed curve table.
     */
    public ScoredCard score(Card card, SeedCardAnalysis target) {
        double curve = curveFit(card);
        String curveReason = String.format("good curve fit at %d CMC", card.getWholeCmc());
        return score(card, target, curve, curveReason);
    }

    /**
     * Scores a candidate with a curve score supplied by the caller, e.g. a gap-filling score.
     */
    public ScoredCard score(Card card, SeedCardAnalysis target, double curve, String curveReason) {
        List<String> reasons = new ArrayList<>();

        // Factor 1: Color compatibility
        double color = colorCompatibility(card, target);
        if (color >= COLOR_REASON_THRESHOLD) {
            reasons.add("matches your colors");
        }

        // Factor 2: Mana curve
        if (curve >= REASON_THRESHOLD) {
            reasons.add(curveReason);
        }

        // Factor 3: Synergy with the target
        List<SynergyDetail> details = new ArrayList<>();
        double synergy = synergy(card, target, details);
        if (synergy >= REASON_THRESHOLD) {
            reasons.add("synergizes with your strategy");
        }

        // Factor 4: Card quality
        double quality = quality(card);
        if (quality >= REASON_THRESHOLD) {
            reasons.add("high-quality card");
        }

        // Factors 5 and 6: legality and playability are constant for standard candidates
        double overall = color * tuning.getColorWeight()
                + curve * tuning.getCurveWeight()
                + synergy * tuning.getSynergyWeight()
                + quality * tuning.getQualityWeight()
                + LEGALITY * tuning.getLegalityWeight()
                + PLAYABILITY * tuning.getPlayabilityWeight();

        ScoreBreakdown breakdown = new ScoreBreakdown(color, curve, synergy, quality, overall);
        return new ScoredCard(card, overall, ReasoningFormatter.sentence(reasons), breakdown, details);
    }

    public double colorCompatibility(Card card, SeedCardAnalysis target) {
        if (card.isColorless()) {
            return 1.0;
        }
        if (target.getColors().isEmpty()) {
            return COLORLESS_SEED_FIT;
        }

        long matching = card.getColors().stream().filter(target.getColors()::contains).count();
        if (matching == 0) {
            return 0.0;
        }
        if (matching == card.getColors().size()) {
            return 1.0;
        }
        return (double) matching / card.getColors().size() * PARTIAL_COLOR_FACTOR;
    }

    public double curveFit(Card card) {
        if (card.isLand()) {
            return LAND_CURVE_FIT;
        }
        int cmc = card.getWholeCmc();
        Double weight = tuning.getCurveWeights().get(cmc);
        if (weight != null) {
            return weight;
        }
        return cmc > 6 ? tuning.getCurveWeightAboveTable() : LAND_CURVE_FIT;
    }

    /**
     * Keyword, tribal and theme overlap averaged over the signals that fired, neutral 0.5 when none
     * fired. Every matching creature type counts; a changeling matches all of the target's types.
     * Matches are appended to {@code details}.
     */
    public double synergy(Card card, SeedCardAnalysis target, List<SynergyDetail> details) {
        double synergy = 0.0;
        int signals = 0;

        List<KeywordInfo> cardKeywords = KeywordOntology.extractKeywordsWithInfo(card.getOracleText());

        if (!cardKeywords.isEmpty() && !target.getKeywords().isEmpty()) {
            KeywordSynergy keywordSynergy = KeywordSynergyCalculator.calculateDetailed(target.getKeywords(), cardKeywords);
            if (keywordSynergy.score() > 0) {
                synergy += keywordSynergy.score();
                signals++;
                for (String keyword : keywordSynergy.matchedKeywords()) {
                    details.add(new SynergyDetail(SynergyType.KEYWORD, keyword, "Shares " + keyword + " with your deck"));
                }
            }
        }

        if (card.isCreature() && target.isCreature()) {
            Collection<String> cardTypes = TribalDatabase.isChangeling(card.getOracleText())
                    ? target.getCreatureTypes()
                    : TypeLines.extractCreatureTypes(card.getTypeLine());
            for (String creatureType : cardTypes) {
                if (target.getCreatureTypes().contains(creatureType)) {
                    synergy += TRIBAL_MATCH;
                    signals++;
                    details.add(new SynergyDetail(SynergyType.TRIBAL, creatureType, tribalDescription(creatureType)));
                }
            }
        }

        List<String> cardThemes = themesOf(cardKeywords);
        for (String theme : target.getThemes()) {
            if (cardThemes.contains(theme)) {
                synergy += THEME_MATCH;
                signals++;
                details.add(new SynergyDetail(SynergyType.THEME, theme,
                        "Supports the " + KeywordOntology.friendlyThemeName(theme) + " theme"));
            }
        }

        if (signals == 0) {
            return NEUTRAL_SYNERGY;
        }
        return Math.min(synergy / signals, 1.0);
    }

    public double quality(Card card) {
        return QualityScorer.fallback(card);
    }

    private String tribalDescription(String creatureType) {
        return tribes.find(creatureType)
                .map(info -> creatureType + " tribal synergy: " + info.getDescription())
                .orElse(creatureType + " tribal synergy");
    }

    private static List<String> themesOf(List<KeywordInfo> keywords) {
        List<String> themes = new ArrayList<>();
        for (KeywordInfo info : keywords) {
            if (info.isTheme() && !themes.contains(info.keyword())) {
                themes.add(info.keyword());
            }
        }
        return themes;
    }
}
