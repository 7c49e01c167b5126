package org.carball.deckforge.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;
    private Logger logger;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());

        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        EngineConfiguration configuration = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(configuration.getRecommendation().getDefaultMaxResults()).isEqualTo(10);
        assertThat(configuration.getRecommendation().getDefaultMinScore()).isEqualTo(0.3);
        assertThat(configuration.getConstruction().getSpellCount()).isEqualTo(23);
        assertThat(configuration.getConstruction().getLandCount()).isEqualTo(17);
        assertThat(configuration.getConstruction().getDeckSize()).isEqualTo(40);
        assertThat(configuration.getSeedBuilder().getMaxCopies()).isEqualTo(4);
        assertThat(configuration.getSeedBuilder().getLandTotal()).isEqualTo(24);
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "cards.json", "suggest",
                "--engine.max-results", "25",
                "--engine.min-score", "0.45",
                "--engine.min-creatures", "8",
                "--engine.seed-max-results", "12",
                "--engine.max-copies", "3"
        };

        // When
        EngineConfiguration configuration = loader.loadConfiguration(args);

        // Then
        assertThat(configuration.getRecommendation().getDefaultMaxResults()).isEqualTo(25);
        assertThat(configuration.getRecommendation().getDefaultMinScore()).isEqualTo(0.45);
        assertThat(configuration.getConstruction().getMinimumCreatures()).isEqualTo(8);
        assertThat(configuration.getSeedBuilder().getDefaultMaxResults()).isEqualTo(12);
        assertThat(configuration.getSeedBuilder().getMaxCopies()).isEqualTo(3);
    }

    @Test
    void shouldReadEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "DECKFORGE_MIN_SCORE", "0.5",
                "DECKFORGE_SEED_LAND_TOTAL", "22",
                "PATH", "/usr/bin"));

        // When
        EngineConfiguration configuration = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(configuration.getRecommendation().getDefaultMinScore()).isEqualTo(0.5);
        assertThat(configuration.getSeedBuilder().getLandTotal()).isEqualTo(22);
    }

    @Test
    void shouldWarnAboutUnknownEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("DECKFORGE_COLOUR", "blue"));

        // When
        envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().equals("Ignoring unknown environment variable DECKFORGE_COLOUR"));
    }

    @Test
    void shouldReadConfigurationFile() throws IOException {
        // Given
        Path file = tempDir.resolve("engine.yaml");
        Files.writeString(file, String.join("\n",
                "recommendation:",
                "  max_results: 20",
                "  primary_color_count: 3",
                "construction:",
                "  minimum_candidates: 12",
                "seed_builder:",
                "  land_total: 23",
                "  max_copies: 2",
                "unknown_section:",
                "  anything: 1",
                ""));

        // When
        EngineConfiguration configuration = loader.loadConfiguration(file, new String[0]);

        // Then
        assertThat(configuration.getRecommendation().getDefaultMaxResults()).isEqualTo(20);
        assertThat(configuration.getRecommendation().getPrimaryColorCount()).isEqualTo(3);
        assertThat(configuration.getConstruction().getMinimumCandidates()).isEqualTo(12);
        assertThat(configuration.getSeedBuilder().getLandTotal()).isEqualTo(23);
        assertThat(configuration.getSeedBuilder().getMaxCopies()).isEqualTo(2);
    }

    @Test
    void shouldReadJsonConfigurationFile() throws IOException {
        // Given
        Path file = tempDir.resolve("engine.json");
        Files.writeString(file, "{\"seed_builder\": {\"min_score\": 0.4}}");

        // When
        EngineConfiguration configuration = loader.loadConfiguration(file, new String[0]);

        // Then
        assertThat(configuration.getSeedBuilder().getMinimumScore()).isEqualTo(0.4);
    }

    @Test
    void shouldApplyHierarchy() throws IOException {
        // Given
        Path file = tempDir.resolve("engine.yaml");
        Files.writeString(file, "recommendation:\n  max_results: 20\n  min_score: 0.35\n  synergy_weight: 0.2\n");
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "DECKFORGE_MAX_RESULTS", "30",
                "DECKFORGE_MIN_SCORE", "0.4"));
        String[] args = {"--engine.max-results", "40"};

        // When
        EngineConfiguration configuration = envLoader.loadConfiguration(file, args);

        // Then - CLI > env vars > file > defaults
        assertThat(configuration.getRecommendation().getDefaultMaxResults()).isEqualTo(40);
        assertThat(configuration.getRecommendation().getDefaultMinScore()).isEqualTo(0.4);
        assertThat(configuration.getRecommendation().getSynergyWeight()).isEqualTo(0.2);
        assertThat(configuration.getRecommendation().getColorFitWeight()).isEqualTo(0.30);
    }

    @Test
    void shouldIgnoreInvalidCLIValues() {
        // Given
        String[] args = {
                "--engine.max-results", "not-a-number",
                "--engine.min-score", "0.6"
        };

        // When
        EngineConfiguration configuration = loader.loadConfiguration(args);

        // Then - invalid value ignored, valid one applied
        assertThat(configuration.getRecommendation().getDefaultMaxResults()).isEqualTo(10);
        assertThat(configuration.getRecommendation().getDefaultMinScore()).isEqualTo(0.6);
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().equals("Invalid numeric value for --engine.max-results: not-a-number"));
    }

    @Test
    void shouldWarnAboutUnknownOptions() {
        // When
        loader.loadConfiguration(new String[]{"--engine.colour", "blue"});

        // Then
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().equals("Ignoring unknown option --engine.colour"));
    }

    @Test
    void shouldRecomputeDeckSizeFromParts() {
        // When
        EngineConfiguration configuration = loader.loadConfiguration(new String[]{
                "--engine.spell-count", "24",
                "--engine.land-count", "16"
        });

        // Then
        assertThat(configuration.getConstruction().getSpellCount()).isEqualTo(24);
        assertThat(configuration.getConstruction().getLandCount()).isEqualTo(16);
        assertThat(configuration.getConstruction().getDeckSize()).isEqualTo(40);

        EngineConfiguration bigger = loader.loadConfiguration(new String[]{"--engine.spell-count", "25"});
        assertThat(bigger.getConstruction().getDeckSize()).isEqualTo(42);
    }

    @Test
    void shouldFailOnUnreadableFile() {
        // Given
        Path missing = tempDir.resolve("missing.yaml");

        // Then
        assertThatThrownBy(() -> loader.loadConfiguration(missing, new String[0]))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to read configuration file");
    }

    @Test
    void shouldProvideConfigurationHelp() {
        // When
        String help = ConfigurationLoader.getConfigurationHelp();

        // Then
        assertThat(help).contains("Engine Configuration Options:");
        assertThat(help).contains("--engine.min-score");
        assertThat(help).contains("DECKFORGE_MIN_SCORE");
        assertThat(help).contains("seed_builder:");
        assertThat(help).contains("Priority Order");
    }
}
