package org.carball.deckforge.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Tuning of the single-card recommendation engine.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class RecommendationWeights {

    // Factor weights
    @Builder.Default
    private double colorFitWeight = 0.30;

    @Builder.Default
    private double manaCurveWeight = 0.25;

    @Builder.Default
    private double qualityWeight = 0.25;

    @Builder.Default
    private double synergyWeight = 0.15;

    @Builder.Default
    private double playabilityWeight = 0.05;

    // Filter defaults
    @Builder.Default
    private int defaultMaxResults = 10;

    @Builder.Default
    private double defaultMinScore = 0.3;

    // Color fit
    @Builder.Default
    private int primaryColorCount = 2;

    @Builder.Default
    private double splashColorFit = 0.85;

    // Synergy
    @Builder.Default
    private double keywordSynergyIncrement = 0.2;

    @Builder.Default
    private int lightTribalCount = 3;

    @Builder.Default
    private int moderateTribalCount = 5;

    @Builder.Default
    private int strongTribalCount = 8;

    // Mana curve
    @Builder.Default
    private Map<Integer, Integer> idealCurve = Map.of(1, 2, 2, 5, 3, 5, 4, 4, 5, 3, 6, 2);

    @Builder.Default
    private int idealAboveCurve = 2;

    public static RecommendationWeights defaults() {
        return RecommendationWeights.builder().build();
    }

    /**
     * Ideal number of cards at a CMC. Zero-cost spells have no slot; anything above the table
     * shares {@link #idealAboveCurve}.
     */
    public int idealCountAt(int cmc) {
        if (cmc > 6) {
            return idealAboveCurve;
        }
        return idealCurve.getOrDefault(cmc, 0);
    }

    public double weightSum() {
        return colorFitWeight + manaCurveWeight + qualityWeight + synergyWeight + playabilityWeight;
    }

    /**
     * Validates the weights and logs warnings for problematic values.
     */
    public void validate() {
        if (Math.abs(weightSum() - 1.0) > 0.001) {
            log.warn("Recommendation weights sum to {} instead of 1.0", String.format("%.3f", weightSum()));
        }

        if (defaultMaxResults <= 0) {
            log.warn("Default max results ({}) should be positive", defaultMaxResults);
        }

        if (defaultMinScore < 0.0 || defaultMinScore > 1.0) {
            log.warn("Default minimum score ({}) should be between 0 and 1", defaultMinScore);
        }

        if (!(lightTribalCount <= moderateTribalCount && moderateTribalCount <= strongTribalCount)) {
            log.warn("Tribal tiers should be ascending: {}/{}/{}",
                    lightTribalCount, moderateTribalCount, strongTribalCount);
        }
    }

    public String getConfigurationSummary() {
        return String.format(
                "weights=[color=%.2f, curve=%.2f, quality=%.2f, synergy=%.2f, playability=%.2f], " +
                "maxResults=%d, minScore=%.2f, primaryColors=%d",
                colorFitWeight, manaCurveWeight, qualityWeight, synergyWeight, playabilityWeight,
                defaultMaxResults, defaultMinScore, primaryColorCount);
    }
}
