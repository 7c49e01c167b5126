package org.carball.deckforge.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Tuning of the build-around, iterative and complete-deck builders.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class SeedBuilderTuning {

    // Score weights
    @Builder.Default
    private double colorWeight = 0.25;

    @Builder.Default
    private double curveWeight = 0.20;

    @Builder.Default
    private double synergyWeight = 0.30;

    @Builder.Default
    private double qualityWeight = 0.15;

    @Builder.Default
    private double legalityWeight = 0.05;

    @Builder.Default
    private double playabilityWeight = 0.05;

    // Candidate selection
    @Builder.Default
    private double minimumScore = 0.3;

    @Builder.Default
    private int defaultMaxResults = 40;

    @Builder.Default
    private int defaultIterativeResults = 15;

    @Builder.Default
    private int maxCopies = 4;

    // Land base
    @Builder.Default
    private int landTotal = 24;

    @Builder.Default
    private int seedColorWeight = 4;

    @Builder.Default
    private int topSuggestionWeight = 2;

    @Builder.Default
    private int topSuggestionCount = 20;

    // Curves
    @Builder.Default
    private Map<Integer, Double> curveWeights = Map.of(0, 0.6, 1, 0.8, 2, 1.0, 3, 1.0, 4, 0.8, 5, 0.6, 6, 0.4);

    @Builder.Default
    private double curveWeightAboveTable = 0.3;

    @Builder.Default
    private Map<Integer, Integer> reportedIdealCurve = Map.of(1, 4, 2, 8, 3, 8, 4, 6, 5, 4, 6, 2);

    @Builder.Default
    private Map<Integer, Integer> iterativeIdealCurve = Map.of(1, 4, 2, 8, 3, 8, 4, 6, 5, 4, 6, 4, 7, 2);

    @Builder.Default
    private int constructedDeckSize = 60;

    public static SeedBuilderTuning defaults() {
        return SeedBuilderTuning.builder().build();
    }

    public double weightSum() {
        return colorWeight + curveWeight + synergyWeight + qualityWeight + legalityWeight + playabilityWeight;
    }

    public void validate() {
        if (Math.abs(weightSum() - 1.0) > 0.001) {
            log.warn("Seed builder weights sum to {} instead of 1.0", String.format("%.3f", weightSum()));
        }

        if (minimumScore < 0.0 || minimumScore > 1.0) {
            log.warn("Minimum score ({}) should be between 0 and 1", minimumScore);
        }

        if (maxCopies <= 0) {
            log.warn("Max copies ({}) should be positive", maxCopies);
        }

        if (landTotal <= 0 || landTotal >= constructedDeckSize) {
            log.warn("Land total ({}) should be between 1 and {}", landTotal, constructedDeckSize - 1);
        }
    }

    public String getConfigurationSummary() {
        return String.format(
                "weights=[color=%.2f, curve=%.2f, synergy=%.2f, quality=%.2f, legality=%.2f, playability=%.2f], " +
                "minScore=%.2f, maxResults=%d, lands=%d, maxCopies=%d",
                colorWeight, curveWeight, synergyWeight, qualityWeight, legalityWeight, playabilityWeight,
                minimumScore, defaultMaxResults, landTotal, maxCopies);
    }
}
