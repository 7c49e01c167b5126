package org.carball.deckforge.config;

import lombok.Builder;
import lombok.Data;

/**
 * The resolved tuning of all three pipelines.
 */
@Data
@Builder(toBuilder = true)
public class EngineConfiguration {

    @Builder.Default
    private RecommendationWeights recommendation = RecommendationWeights.defaults();

    @Builder.Default
    private DeckConstructionTuning construction = DeckConstructionTuning.defaults();

    @Builder.Default
    private SeedBuilderTuning seedBuilder = SeedBuilderTuning.defaults();

    public static EngineConfiguration defaults() {
        return EngineConfiguration.builder().build();
    }

    public void validate() {
        recommendation.validate();
        construction.validate();
        seedBuilder.validate();
    }

    public String getConfigurationSummary() {
        return "recommendation{" + recommendation.getConfigurationSummary() + "}, " +
                "construction{" + construction.getConfigurationSummary() + "}, " +
                "seedBuilder{" + seedBuilder.getConfigurationSummary() + "}";
    }
}
