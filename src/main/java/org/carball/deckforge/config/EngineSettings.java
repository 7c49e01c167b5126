package org.carball.deckforge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * File form of the engine tuning, read from YAML or JSON. Every value is optional; an absent
 * value keeps the built-in default.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineSettings {

    @JsonProperty("recommendation")
    private RecommendationSection recommendation = new RecommendationSection();

    @JsonProperty("construction")
    private ConstructionSection construction = new ConstructionSection();

    @JsonProperty("seed_builder")
    private SeedBuilderSection seedBuilder = new SeedBuilderSection();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecommendationSection {
        @JsonProperty("color_fit_weight")
        private Double colorFitWeight;

        @JsonProperty("mana_curve_weight")
        private Double manaCurveWeight;

        @JsonProperty("quality_weight")
        private Double qualityWeight;

        @JsonProperty("synergy_weight")
        private Double synergyWeight;

        @JsonProperty("playability_weight")
        private Double playabilityWeight;

        @JsonProperty("max_results")
        private Integer maxResults;

        @JsonProperty("min_score")
        private Double minScore;

        @JsonProperty("primary_color_count")
        private Integer primaryColorCount;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConstructionSection {
        @JsonProperty("spell_count")
        private Integer spellCount;

        @JsonProperty("land_count")
        private Integer landCount;

        @JsonProperty("minimum_candidates")
        private Integer minimumCandidates;

        @JsonProperty("minimum_creatures")
        private Integer minimumCreatures;

        @JsonProperty("quality_weight")
        private Double qualityWeight;

        @JsonProperty("curve_weight")
        private Double curveWeight;

        @JsonProperty("synergy_weight")
        private Double synergyWeight;

        @JsonProperty("color_bonus_weight")
        private Double colorBonusWeight;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeedBuilderSection {
        @JsonProperty("color_weight")
        private Double colorWeight;

        @JsonProperty("curve_weight")
        private Double curveWeight;

        @JsonProperty("synergy_weight")
        private Double synergyWeight;

        @JsonProperty("quality_weight")
        private Double qualityWeight;

        @JsonProperty("min_score")
        private Double minScore;

        @JsonProperty("max_results")
        private Integer maxResults;

        @JsonProperty("land_total")
        private Integer landTotal;

        @JsonProperty("max_copies")
        private Integer maxCopies;
    }

    public String getDescription() {
        return String.format(
                "Settings: recommendation.minScore=%s, construction.spellCount=%s, seedBuilder.minScore=%s",
                recommendation.getMinScore(), construction.getSpellCount(), seedBuilder.getMinScore());
    }
}
