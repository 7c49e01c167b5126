package org.carball.deckforge.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Tuning shared by the generic and archetype-targeted deck constructors.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class DeckConstructionTuning {

    // Deck shape
    @Builder.Default
    private int spellCount = 23;

    @Builder.Default
    private int landCount = 17;

    @Builder.Default
    private int deckSize = 40;

    // Viability gates
    @Builder.Default
    private int minimumCandidates = 15;

    @Builder.Default
    private int minimumCreatures = 6;

    @Builder.Default
    private int archetypeCreatureSlack = 4;

    @Builder.Default
    private int fillTolerance = 3;

    // Card score weights
    @Builder.Default
    private double qualityWeight = 0.40;

    @Builder.Default
    private double curveWeight = 0.30;

    @Builder.Default
    private double synergyWeight = 0.20;

    @Builder.Default
    private double colorBonusWeight = 0.10;

    // Deck score weights
    @Builder.Default
    private double averageScoreWeight = 0.50;

    @Builder.Default
    private double creatureRatioWeight = 0.15;

    @Builder.Default
    private double curveCompletenessWeight = 0.15;

    @Builder.Default
    private double manaConsistencyWeight = 0.20;

    // Viability labels
    @Builder.Default
    private double strongScore = 0.7;

    @Builder.Default
    private int strongCreatures = 10;

    @Builder.Default
    private int strongPlayables = 20;

    @Builder.Default
    private double viableScore = 0.5;

    @Builder.Default
    private int viableCreatures = 6;

    // Curve tables
    @Builder.Default
    private Map<Integer, Integer> candidateCurve = Map.of(1, 2, 2, 5, 3, 5, 4, 4, 5, 3, 6, 2, 7, 2);

    @Builder.Default
    private Map<Integer, Integer> selectionCurve = Map.of(0, 0, 1, 2, 2, 5, 3, 5, 4, 4, 5, 3, 6, 2, 7, 2);

    public static DeckConstructionTuning defaults() {
        return DeckConstructionTuning.builder().build();
    }

    public double cardWeightSum() {
        return qualityWeight + curveWeight + synergyWeight + colorBonusWeight;
    }

    public double deckWeightSum() {
        return averageScoreWeight + creatureRatioWeight + curveCompletenessWeight + manaConsistencyWeight;
    }

    public void validate() {
        if (Math.abs(cardWeightSum() - 1.0) > 0.001) {
            log.warn("Deck construction card weights sum to {} instead of 1.0", String.format("%.3f", cardWeightSum()));
        }

        if (Math.abs(deckWeightSum() - 1.0) > 0.001) {
            log.warn("Deck score weights sum to {} instead of 1.0", String.format("%.3f", deckWeightSum()));
        }

        if (spellCount + landCount != deckSize) {
            log.warn("Spell count ({}) plus land count ({}) does not equal deck size ({})",
                    spellCount, landCount, deckSize);
        }

        if (strongScore <= viableScore) {
            log.warn("Strong score ({}) should be greater than viable score ({})", strongScore, viableScore);
        }

        if (minimumCandidates < minimumCreatures) {
            log.warn("Minimum candidates ({}) should not be below minimum creatures ({})",
                    minimumCandidates, minimumCreatures);
        }
    }

    public String getConfigurationSummary() {
        return String.format(
                "deck=%d (%d spells + %d lands), minCandidates=%d, minCreatures=%d, " +
                "cardWeights=[%.2f/%.2f/%.2f/%.2f], deckWeights=[%.2f/%.2f/%.2f/%.2f]",
                deckSize, spellCount, landCount, minimumCandidates, minimumCreatures,
                qualityWeight, curveWeight, synergyWeight, colorBonusWeight,
                averageScoreWeight, creatureRatioWeight, curveCompletenessWeight, manaConsistencyWeight);
    }
}
