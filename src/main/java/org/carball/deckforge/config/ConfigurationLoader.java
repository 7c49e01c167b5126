package org.carball.deckforge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private static final String ENV_PREFIX = "DECKFORGE_";
    private static final String CLI_PREFIX = "--engine.";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public EngineConfiguration loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > config file > defaults.
     * A null file is skipped.
     */
    public EngineConfiguration loadConfiguration(Path configFile, String[] args) {
        log.debug("Loading configuration");

        // Start with defaults
        Builders builders = new Builders();

        // 1. Apply config file
        if (configFile != null) {
            applySettings(builders, readSettings(configFile));
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builders);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builders, args);

        EngineConfiguration configuration = builders.build();
        configuration.validate();

        log.info("Configuration loaded: {}", configuration.getConfigurationSummary());
        return configuration;
    }

    /**
     * Reads a YAML or JSON settings file.
     */
    public EngineSettings readSettings(Path configFile) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            EngineSettings settings = mapper.readValue(Files.readAllBytes(configFile), EngineSettings.class);
            if (settings == null) {
                log.warn("Configuration file {} is empty", configFile);
                return new EngineSettings();
            }
            log.debug("Read {} from {}", settings.getDescription(), configFile);
            return settings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration file " + configFile, e);
        }
    }

    private void applySettings(Builders builders, EngineSettings settings) {
        EngineSettings.RecommendationSection rec = settings.getRecommendation();
        if (rec != null) {
            if (rec.getColorFitWeight() != null) builders.recommendation.colorFitWeight(rec.getColorFitWeight());
            if (rec.getManaCurveWeight() != null) builders.recommendation.manaCurveWeight(rec.getManaCurveWeight());
            if (rec.getQualityWeight() != null) builders.recommendation.qualityWeight(rec.getQualityWeight());
            if (rec.getSynergyWeight() != null) builders.recommendation.synergyWeight(rec.getSynergyWeight());
            if (rec.getPlayabilityWeight() != null) builders.recommendation.playabilityWeight(rec.getPlayabilityWeight());
            if (rec.getMaxResults() != null) builders.recommendation.defaultMaxResults(rec.getMaxResults());
            if (rec.getMinScore() != null) builders.recommendation.defaultMinScore(rec.getMinScore());
            if (rec.getPrimaryColorCount() != null) builders.recommendation.primaryColorCount(rec.getPrimaryColorCount());
        }

        EngineSettings.ConstructionSection construction = settings.getConstruction();
        if (construction != null) {
            if (construction.getSpellCount() != null) builders.construction.spellCount(construction.getSpellCount());
            if (construction.getLandCount() != null) builders.construction.landCount(construction.getLandCount());
            if (construction.getMinimumCandidates() != null) builders.construction.minimumCandidates(construction.getMinimumCandidates());
            if (construction.getMinimumCreatures() != null) builders.construction.minimumCreatures(construction.getMinimumCreatures());
            if (construction.getQualityWeight() != null) builders.construction.qualityWeight(construction.getQualityWeight());
            if (construction.getCurveWeight() != null) builders.construction.curveWeight(construction.getCurveWeight());
            if (construction.getSynergyWeight() != null) builders.construction.synergyWeight(construction.getSynergyWeight());
            if (construction.getColorBonusWeight() != null) builders.construction.colorBonusWeight(construction.getColorBonusWeight());
            if (construction.getSpellCount() != null || construction.getLandCount() != null) {
                builders.deckSizeFromParts = true;
            }
        }

        EngineSettings.SeedBuilderSection seed = settings.getSeedBuilder();
        if (seed != null) {
            if (seed.getColorWeight() != null) builders.seedBuilder.colorWeight(seed.getColorWeight());
            if (seed.getCurveWeight() != null) builders.seedBuilder.curveWeight(seed.getCurveWeight());
            if (seed.getSynergyWeight() != null) builders.seedBuilder.synergyWeight(seed.getSynergyWeight());
            if (seed.getQualityWeight() != null) builders.seedBuilder.qualityWeight(seed.getQualityWeight());
            if (seed.getMinScore() != null) builders.seedBuilder.minimumScore(seed.getMinScore());
            if (seed.getMaxResults() != null) builders.seedBuilder.defaultMaxResults(seed.getMaxResults());
            if (seed.getLandTotal() != null) builders.seedBuilder.landTotal(seed.getLandTotal());
            if (seed.getMaxCopies() != null) builders.seedBuilder.maxCopies(seed.getMaxCopies());
        }
    }

    private void applyEnvironmentVariables(Builders builders) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String name = entry.getKey();
            if (!name.startsWith(ENV_PREFIX)) {
                continue;
            }
            // DECKFORGE_MIN_SCORE is the same setting as --engine.min-score
            String option = CLI_PREFIX + name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
            if (!applySetting(builders, option, entry.getValue())) {
                log.warn("Ignoring unknown environment variable {}", name);
            }
        }
    }

    private void applyCLIArguments(Builders builders, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (!arg.startsWith(CLI_PREFIX)) {
                continue;
            }
            if (!applySetting(builders, arg, args[i + 1])) {
                log.warn("Ignoring unknown option {}", arg);
            }
            i++;
        }
    }

    /**
     * Applies one option. Returns false for unknown options; unparseable values are logged and skipped.
     */
    private boolean applySetting(Builders builders, String option, String value) {
        try {
            switch (option) {
                case "--engine.max-results":
                    builders.recommendation.defaultMaxResults(Integer.parseInt(value));
                    break;
                case "--engine.min-score":
                    builders.recommendation.defaultMinScore(Double.parseDouble(value));
                    break;
                case "--engine.color-weight":
                    builders.recommendation.colorFitWeight(Double.parseDouble(value));
                    break;
                case "--engine.curve-weight":
                    builders.recommendation.manaCurveWeight(Double.parseDouble(value));
                    break;
                case "--engine.quality-weight":
                    builders.recommendation.qualityWeight(Double.parseDouble(value));
                    break;
                case "--engine.synergy-weight":
                    builders.recommendation.synergyWeight(Double.parseDouble(value));
                    break;
                case "--engine.playability-weight":
                    builders.recommendation.playabilityWeight(Double.parseDouble(value));
                    break;
                case "--engine.spell-count":
                    builders.construction.spellCount(Integer.parseInt(value));
                    builders.deckSizeFromParts = true;
                    break;
                case "--engine.land-count":
                    builders.construction.landCount(Integer.parseInt(value));
                    builders.deckSizeFromParts = true;
                    break;
                case "--engine.min-candidates":
                    builders.construction.minimumCandidates(Integer.parseInt(value));
                    break;
                case "--engine.min-creatures":
                    builders.construction.minimumCreatures(Integer.parseInt(value));
                    break;
                case "--engine.seed-min-score":
                    builders.seedBuilder.minimumScore(Double.parseDouble(value));
                    break;
                case "--engine.seed-max-results":
                    builders.seedBuilder.defaultMaxResults(Integer.parseInt(value));
                    break;
                case "--engine.seed-land-total":
                    builders.seedBuilder.landTotal(Integer.parseInt(value));
                    break;
                case "--engine.max-copies":
                    builders.seedBuilder.maxCopies(Integer.parseInt(value));
                    break;
                default:
                    return false;
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", option, value);
        }
        return true;
    }

    /**
     * Returns help text for engine configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Engine Configuration Options:

            CLI Arguments:
              --engine.max-results <num>         Default number of recommendations
              --engine.min-score <num>           Minimum recommendation score (0-1)
              --engine.color-weight <num>        Recommendation color fit weight
              --engine.curve-weight <num>        Recommendation mana curve weight
              --engine.quality-weight <num>      Recommendation quality weight
              --engine.synergy-weight <num>      Recommendation synergy weight
              --engine.playability-weight <num>  Recommendation playability weight
              --engine.spell-count <num>         Spells per constructed limited deck
              --engine.land-count <num>          Lands per constructed limited deck
              --engine.min-candidates <num>      Candidates a color combination needs
              --engine.min-creatures <num>       Creatures a color combination needs
              --engine.seed-min-score <num>      Minimum build-around score (0-1)
              --engine.seed-max-results <num>    Default number of build-around suggestions
              --engine.seed-land-total <num>     Lands in a build-around land base
              --engine.max-copies <num>          Copies allowed per card

            Environment Variables:
              DECKFORGE_<OPTION>                 Same as --engine.<option>, e.g.
                                                 DECKFORGE_MIN_SCORE for --engine.min-score

            Configuration File (--config <file>, YAML or JSON):
              recommendation:  color_fit_weight, mana_curve_weight, quality_weight, synergy_weight,
                               playability_weight, max_results, min_score, primary_color_count
              construction:    spell_count, land_count, minimum_candidates, minimum_creatures,
                               quality_weight, curve_weight, synergy_weight, color_bonus_weight
              seed_builder:    color_weight, curve_weight, synergy_weight, quality_weight,
                               min_score, max_results, land_total, max_copies

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }

    private static final class Builders {
        private final RecommendationWeights.RecommendationWeightsBuilder recommendation = RecommendationWeights.builder();
        private final DeckConstructionTuning.DeckConstructionTuningBuilder construction = DeckConstructionTuning.builder();
        private final SeedBuilderTuning.SeedBuilderTuningBuilder seedBuilder = SeedBuilderTuning.builder();
        private boolean deckSizeFromParts;

        private EngineConfiguration build() {
            DeckConstructionTuning constructionTuning = construction.build();
            if (deckSizeFromParts) {
                constructionTuning = constructionTuning.toBuilder()
                        .deckSize(constructionTuning.getSpellCount() + constructionTuning.getLandCount())
                        .build();
            }
            return EngineConfiguration.builder()
                    .recommendation(recommendation.build())
                    .construction(constructionTuning)
                    .seedBuilder(seedBuilder.build())
                    .build();
        }
    }
}
