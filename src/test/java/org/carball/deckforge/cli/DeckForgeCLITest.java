package org.carball.deckforge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.deckforge.TestCards;
import org.carball.deckforge.model.card.Card;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DeckForgeCLITest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private Path cardFile;

    @BeforeEach
    void setUp() throws IOException {
        List<Card> pool = new ArrayList<>();
        for (int i = 0; i < 18; i++) {
            pool.add(TestCards.creature(i + 1, "Red Creature " + (i + 1), "Goblin", 1 + (i % 5), "common", "Haste", "R"));
        }
        for (int i = 0; i < 6; i++) {
            pool.add(TestCards.spell(100 + i, "Bolt " + i, "Instant", 1, "uncommon",
                    "Deals 3 damage to any target.", "R"));
        }
        cardFile = writeCards("cards.json", pool);
    }

    @Test
    void shouldShowHelp() {
        assertThat(DeckForgeCLI.run(new String[]{"--help"})).isEqualTo(0);
    }

    @Test
    void shouldFailWithTooFewArguments() {
        assertThat(DeckForgeCLI.run(new String[]{cardFile.toString()})).isEqualTo(1);
    }

    @Test
    void shouldFailForMissingCardFile() {
        String missing = tempDir.resolve("missing.json").toString();

        assertThat(DeckForgeCLI.run(new String[]{missing, "suggest"})).isEqualTo(1);
    }

    @Test
    void shouldFailForUnknownOptionAndCommand() {
        assertThat(DeckForgeCLI.run(new String[]{cardFile.toString(), "suggest", "--verbose"})).isEqualTo(1);
        assertThat(DeckForgeCLI.run(new String[]{cardFile.toString(), "shuffle"})).isEqualTo(1);
    }

    @Test
    void shouldWriteSuggestionsAsJson() throws IOException {
        // Given
        Path output = tempDir.resolve("report.json");

        // When
        int exitCode = DeckForgeCLI.run(new String[]{cardFile.toString(), "suggest", "--set", "TST", "-o", output.toString()});

        // Then
        assertThat(exitCode).isEqualTo(0);
        JsonNode json = mapper.readTree(output.toFile());
        assertThat(json.path("metadata").path("command").asText()).isEqualTo("suggest");
        assertThat(json.path("metadata").path("poolSize").asInt()).isEqualTo(24);
        assertThat(json.path("suggestions").path("bestCombo").path("name").asText()).isEqualTo("Mono-Red");
    }

    @Test
    void shouldWriteArchetypeDeckAsArenaList() throws IOException {
        // Given
        Path output = tempDir.resolve("deck.txt");

        // When
        int exitCode = DeckForgeCLI.run(new String[]{cardFile.toString(), "archetype", "AGGRO", "--output", output.toString()});

        // Then
        assertThat(exitCode).isEqualTo(0);
        String arena = Files.readString(output);
        assertThat(arena).startsWith("Deck: Mono-Red Draft");
        assertThat(arena).contains("Mountain");
    }

    @Test
    void shouldWriteClassificationAsMarkdown() throws IOException {
        // Given
        Path output = tempDir.resolve("report.md");

        // When
        int exitCode = DeckForgeCLI.run(new String[]{cardFile.toString(), "classify", "-o", output.toString()});

        // Then
        assertThat(exitCode).isEqualTo(0);
        String markdown = Files.readString(output);
        assertThat(markdown).contains("**Command:** classify");
        assertThat(markdown).contains("## Archetype Classification");
    }

    @Test
    void shouldRunPackagesWithoutOutputFile() {
        assertThat(DeckForgeCLI.run(new String[]{cardFile.toString(), "packages"})).isEqualTo(0);
    }

    @Test
    void shouldExitWithTwoWhenNoDeckSupportsArchetype() throws IOException {
        // Given
        Path smallPool = writeCards("small.json", TestCards.goblins(1, 5, 2, "R"));

        // When
        int exitCode = DeckForgeCLI.run(new String[]{smallPool.toString(), "archetype", "control"});

        // Then
        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void shouldParseArchetypeAndOptions() {
        // When
        DeckForgeCLI.CliOptions options = DeckForgeCLI.parseArgs(new String[]{
                cardFile.toString(), "Archetype", "Control", "--engine.max-results", "3",
                "--set", "DSK", "--format", "QuickDraft"});

        // Then
        assertThat(options.command).isEqualTo("archetype");
        assertThat(options.archetype).isEqualTo("control");
        assertThat(options.setCode).isEqualTo("DSK");
        assertThat(options.format).isEqualTo("QuickDraft");
        assertThat(options.outputFile).isNull();
    }

    @Test
    void shouldRejectBadArguments() {
        assertThatThrownBy(() -> DeckForgeCLI.parseArgs(new String[]{cardFile.toString(), "archetype"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Archetype not specified");

        assertThatThrownBy(() -> DeckForgeCLI.parseArgs(new String[]{cardFile.toString(), "suggest", "--set"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Set code not specified");

        assertThatThrownBy(() -> DeckForgeCLI.parseArgs(new String[]{cardFile.toString(), "suggest",
                "--config", tempDir.resolve("none.yaml").toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");

        assertThatThrownBy(() -> DeckForgeCLI.parseArgs(new String[]{cardFile.toString(), "suggest",
                "-o", tempDir.resolve("nowhere/report.json").toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output directory does not exist");
    }

    private Path writeCards(String name, List<Card> cards) throws IOException {
        Path file = tempDir.resolve(name);
        mapper.writeValue(file.toFile(), cards);
        return file;
    }
}
