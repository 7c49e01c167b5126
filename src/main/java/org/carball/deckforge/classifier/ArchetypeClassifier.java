package org.carball.deckforge.classifier;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.model.archetype.Archetype;
import org.carball.deckforge.model.archetype.ArchetypeScore;
import org.carball.deckforge.model.archetype.ArchetypeSignal;
import org.carball.deckforge.model.archetype.ArchetypeStats;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.ontology.ArchetypeSignalRegistry;
import org.carball.deckforge.ontology.PatternMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores a card list against every archetype's weighted signals.
 */
@Slf4j
public class ArchetypeClassifier {

    private static final double MINIMUM_SCORE = 0.2;
    private static final double SIGNAL_CONFIDENCE_STEP = 0.1;
    private static final double MAX_SIGNAL_CONFIDENCE = 0.3;

    private static final int FEW_CREATURES_LIMIT = 10;
    private static final int BIG_FINISHER_COUNT = 4;
    private static final double HIGH_CMC = 5.0;
    private static final double LOW_CMC = 2.0;

    private final ArchetypeSignalRegistry registry;

    public ArchetypeClassifier() {
        this(ArchetypeSignalRegistry.defaults());
    }

    public ArchetypeClassifier(ArchetypeSignalRegistry registry) {
        this.registry = registry;
    }

    /**
     * Archetypes scoring above 0.2, best first. Each card entry counts once, so pass one entry per copy.
     */
    public List<ArchetypeScore> classifyDeck(List<Card> cards) {
        List<ArchetypeScore> scores = new ArrayList<>();
        if (cards == null || cards.isEmpty()) {
            return scores;
        }

        ArchetypeStats stats = computeStats(cards);
        for (Archetype archetype : Archetype.values()) {
            List<String> matchedSignals = new ArrayList<>();
            double score = scoreArchetype(cards, stats, registry.signalsFor(archetype), matchedSignals);
            log.debug("{} scored {} from signals {}", archetype.getDisplayName(), String.format("%.3f", score), matchedSignals);

            if (score > MINIMUM_SCORE) {
                scores.add(ArchetypeScore.builder()
                        .archetype(archetype)
                        .score(score)
                        .confidence(confidence(score, matchedSignals.size()))
                        .signals(matchedSignals)
                        .description(archetype.getDescription())
                        .build());
            }
        }

        // stable: ties keep declaration order
        scores.sort(Comparator.comparingDouble(ArchetypeScore::getScore).reversed());
        return scores;
    }

    public Optional<ArchetypeScore> primaryArchetype(List<Card> cards) {
        List<ArchetypeScore> scores = classifyDeck(cards);
        return scores.isEmpty() ? Optional.empty() : Optional.of(scores.get(0));
    }

    public ArchetypeStats computeStats(List<Card> cards) {
        ArchetypeStats stats = new ArchetypeStats();
        double totalCmc = 0.0;
        int nonLands = 0;

        for (Card card : cards) {
            String typeLine = card.getTypeLine().toLowerCase(Locale.ROOT);
            stats.setTotalCards(stats.getTotalCards() + 1);

            if (typeLine.contains("land")) {
                stats.setLandCount(stats.getLandCount() + 1);
                continue;
            }

            nonLands++;
            totalCmc += card.getCmc();
            if (card.getCmc() >= HIGH_CMC) {
                stats.setHighCmcCount(stats.getHighCmcCount() + 1);
            }
            if (card.getCmc() <= LOW_CMC) {
                stats.setLowCmcCount(stats.getLowCmcCount() + 1);
            }

            boolean creature = typeLine.contains("creature");
            if (creature) {
                stats.setCreatureCount(stats.getCreatureCount() + 1);
            }
            if (typeLine.contains("instant")) {
                stats.setInstantCount(stats.getInstantCount() + 1);
            }
            if (typeLine.contains("sorcery")) {
                stats.setSorceryCount(stats.getSorceryCount() + 1);
            }
            if (typeLine.contains("artifact") && !creature) {
                stats.setArtifactCount(stats.getArtifactCount() + 1);
            }
            if (typeLine.contains("enchantment")) {
                stats.setEnchantmentCount(stats.getEnchantmentCount() + 1);
            }
            if (typeLine.contains("planeswalker")) {
                stats.setPlaneswalkerCount(stats.getPlaneswalkerCount() + 1);
            }
        }

        if (nonLands > 0) {
            stats.setAverageCmc(totalCmc / nonLands);
        }
        return stats;
    }

    private double scoreArchetype(List<Card> cards, ArchetypeStats stats, List<ArchetypeSignal> signals,
                                  List<String> matchedSignals) {
        double totalWeight = 0.0;
        double weightedScore = 0.0;

        for (ArchetypeSignal signal : signals) {
            totalWeight += signal.getWeight();
            double signalScore = evaluateSignal(cards, stats, signal);
            if (signalScore > 0) {
                weightedScore += signalScore * signal.getWeight();
                matchedSignals.add(signal.getName());
            }
        }

        if (totalWeight == 0) {
            matchedSignals.clear();
            return 0.0;
        }
        return weightedScore / totalWeight;
    }

    double evaluateSignal(List<Card> cards, ArchetypeStats stats, ArchetypeSignal signal) {
        // deck-level CMC bounds first
        if (signal.getMinCmc() > 0 && stats.getAverageCmc() < signal.getMinCmc()) {
            return 0.0;
        }
        if (signal.getMaxCmc() > 0 && stats.getAverageCmc() > signal.getMaxCmc()) {
            return 0.0;
        }

        if (signal.getSpecial() != null) {
            switch (signal.getSpecial()) {
                case FEW_CREATURES:
                    return stats.getCreatureCount() <= FEW_CREATURES_LIMIT ? 1.0 : 0.0;
                case BIG_FINISHERS:
                    return stats.getHighCmcCount() >= BIG_FINISHER_COUNT ? 1.0 : 0.0;
                default:
                    break;
            }
        }

        long matchCount = cards.stream().filter(card -> matchesSignal(card, signal)).count();
        if (signal.getMinCount() > 0 && matchCount < signal.getMinCount()) {
            return 0.0;
        }
        if (signal.isCmcOnly()) {
            return 1.0;
        }
        if (signal.getMinCount() > 0) {
            return Math.min((double) matchCount / (signal.getMinCount() * 2), 1.0);
        }
        return 1.0;
    }

    static boolean matchesSignal(Card card, ArchetypeSignal signal) {
        String oracleText = card.hasOracleText() ? card.getOracleText().toLowerCase(Locale.ROOT) : "";
        String typeLine = card.getTypeLine().toLowerCase(Locale.ROOT);

        boolean typeMatch = signal.getTypeLines().isEmpty() || signal.getTypeLines().stream()
                .anyMatch(type -> typeLine.contains(type.toLowerCase(Locale.ROOT)));
        if (!typeMatch) {
            return false;
        }

        // with type lines, the signal's max CMC also caps each card
        if (signal.getMaxCmc() > 0 && !signal.getTypeLines().isEmpty() && card.getCmc() > signal.getMaxCmc()) {
            return false;
        }

        if (!signal.getPatterns().isEmpty() && !PatternMatcher.containsAny(oracleText, signal.getPatterns())) {
            return false;
        }

        return signal.getKeywords().isEmpty() || signal.getKeywords().stream()
                .anyMatch(keyword -> oracleText.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    static double confidence(double score, int signalCount) {
        double signalBonus = Math.min(signalCount * SIGNAL_CONFIDENCE_STEP, MAX_SIGNAL_CONFIDENCE);
        return Math.min(score + signalBonus, 1.0);
    }
}
