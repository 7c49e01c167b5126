package org.carball.deckforge.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.builder.DeckSuggester;
import org.carball.deckforge.builder.NoViableDeckException;
import org.carball.deckforge.classifier.ArchetypeClassifier;
import org.carball.deckforge.classifier.SynergyPackageAnalyzer;
import org.carball.deckforge.config.ConfigurationLoader;
import org.carball.deckforge.config.DraftArchetype;
import org.carball.deckforge.config.EngineConfiguration;
import org.carball.deckforge.lookup.InMemoryCardCatalog;
import org.carball.deckforge.model.archetype.ArchetypeScore;
import org.carball.deckforge.model.deck.SuggestDecksResponse;
import org.carball.deckforge.model.deck.SuggestedDeck;
import org.carball.deckforge.model.synergy.PackageAnalysis;
import org.carball.deckforge.output.DeckReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Slf4j
public class DeckForgeCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════╗
        ║     Deck Forge: deck recommendations v%s   ║
        ╚═══════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }
        if (args.length < 2) {
            printUsage();
            return 1;
        }

        try {
            CliOptions options = parseArgs(args);
            EngineConfiguration configuration = new ConfigurationLoader().loadConfiguration(options.configFile, args);

            System.out.println("\n🔍 Loading cards...");
            System.out.println("   Card file: " + options.cardFile);
            InMemoryCardCatalog catalog = InMemoryCardCatalog.fromJson(options.cardFile);
            System.out.println("   Cards loaded: " + catalog.size());
            System.out.println();

            DeckReport report;
            switch (options.command) {
                case "suggest":
                    report = suggest(catalog, configuration, options);
                    break;
                case "archetype":
                    report = suggestArchetype(catalog, configuration, options);
                    break;
                case "classify":
                    report = classify(catalog);
                    break;
                case "packages":
                    report = packages(catalog);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown command: " + options.command);
            }

            if (options.outputFile != null) {
                System.out.print("📝 Writing results... ");
                writeReport(report, options.outputFile);
                System.out.println("✓");
                System.out.println("   Output file: " + options.outputFile);
            }

            System.out.println("\n✅ Done!");
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (NoViableDeckException e) {
            System.err.println("\n❌ " + e.getMessage());
            log.debug("No viable deck details", e);
            return 2;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private static DeckReport suggest(InMemoryCardCatalog catalog, EngineConfiguration configuration, CliOptions options) {
        DeckSuggester suggester = new DeckSuggester(catalog, null, configuration.getConstruction());

        System.out.print("🃏 Building decks across all color combinations... ");
        SuggestDecksResponse response = suggester.suggestDecks(catalog.allCardIds(), options.setCode, options.format);
        System.out.println("✓");

        if (response.hasError()) {
            System.out.println("\n💡 " + response.getError());
        } else {
            printDeckSummary(response);
        }
        return DeckReport.forSuggestions(response, catalog.size());
    }

    private static DeckReport suggestArchetype(InMemoryCardCatalog catalog, EngineConfiguration configuration,
                                               CliOptions options) {
        DeckSuggester suggester = new DeckSuggester(catalog, null, configuration.getConstruction());

        System.out.print("🎯 Building the best " + options.archetype + " deck... ");
        SuggestedDeck deck = suggester.suggestDeckByArchetype(
                catalog.allCardIds(), options.setCode, options.format, options.archetype);
        System.out.println("✓");

        System.out.printf("%n%-12s score %.2f (%s), %d spells, %d lands%n",
                deck.getColorCombo().name(), deck.getScore(), deck.getViability().getLabel(),
                deck.getSpells().size(), deck.landCount());
        return DeckReport.forArchetypeDeck(options.archetype, deck, catalog.size());
    }

    private static DeckReport classify(InMemoryCardCatalog catalog) {
        System.out.print("📊 Classifying archetypes... ");
        List<ArchetypeScore> scores = new ArchetypeClassifier().classifyDeck(catalog.allCards());
        System.out.println("✓");

        System.out.println("\n🎯 Archetypes:");
        System.out.println("-".repeat(60));
        if (scores.isEmpty()) {
            System.out.println("💡 No archetype matched this card list.");
        }
        scores.forEach(score -> System.out.printf("%-12s score %.2f, confidence %.2f%n",
                score.getArchetype().getDisplayName(), score.getScore(), score.getConfidence()));
        return DeckReport.forClassification(scores, catalog.size());
    }

    private static DeckReport packages(InMemoryCardCatalog catalog) {
        System.out.print("🧩 Detecting synergy packages... ");
        SynergyPackageAnalyzer analyzer = new SynergyPackageAnalyzer();
        List<PackageAnalysis> analyses = analyzer.analyzeDeckPackages(catalog.allCards());
        System.out.println("✓");

        System.out.println("\n🧩 Synergy packages:");
        System.out.println("-".repeat(60));
        if (analyses.isEmpty()) {
            System.out.println("💡 No synergy package has a required role filled.");
        }
        for (PackageAnalysis analysis : analyses) {
            System.out.printf("%-20s %3.0f%% complete%s%n", analysis.getPackageName(),
                    analysis.getCompleteness() * 100, analysis.isActive() ? " (active)" : "");
            String suggestion = analyzer.missingRoleSuggestion(analysis);
            if (!suggestion.isEmpty()) {
                System.out.println("  └─ " + suggestion);
            }
        }
        return DeckReport.forPackages(analyses, catalog.size());
    }

    private static void printDeckSummary(SuggestDecksResponse response) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 DECK SUMMARY");
        System.out.println("=".repeat(60));
        System.out.println("\nColor combinations checked: " + response.getTotalCombos());
        System.out.println("Viable combinations: " + response.getViableCombos());

        if (response.getSuggestions().isEmpty()) {
            System.out.println("\n💡 No viable deck was found in this pool.");
            return;
        }

        System.out.println("\n🎯 Top decks:");
        System.out.println("-".repeat(60));
        response.getSuggestions().stream()
                .limit(3)
                .forEach(deck -> {
                    System.out.printf("%-12s score %.2f (%s)%n",
                            deck.getColorCombo().name(), deck.getScore(), deck.getViability().getLabel());
                    if (deck.getAnalysis() != null && !deck.getAnalysis().getTopCards().isEmpty()) {
                        System.out.printf("  └─ Top cards: %s%n", String.join(", ", deck.getAnalysis().getTopCards()));
                    }
                });
    }

    private static void writeReport(DeckReport report, Path outputFile) throws IOException {
        String name = outputFile.getFileName().toString().toLowerCase(Locale.ROOT);
        String content;
        if (name.endsWith(".md")) {
            content = report.toMarkdown();
        } else if (name.endsWith(".txt")) {
            content = report.toArenaFormat();
        } else {
            content = report.toJson();
        }
        Files.writeString(outputFile, content);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar deckforge.jar <cards.json> <command> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  cards.json          JSON array of cards forming the pool");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  suggest             Build the best deck for every color combination");
        System.out.println("  archetype <key>     Build the best deck for one archetype (" +
                String.join(", ", DraftArchetype.getAvailableArchetypes()) + ")");
        System.out.println("  classify            Score the cards against every archetype");
        System.out.println("  packages            Report synergy package completeness");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --set <code>        Set code used for ratings lookups");
        System.out.println("  --format <name>     Draft format used for ratings lookups");
        System.out.println("  --output, -o <file> Write the report: .json, .md or .txt (Arena decklist)");
        System.out.println("  --config <file>     YAML or JSON engine settings");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(DraftArchetype.getArchetypeHelp());
        System.out.println(ConfigurationLoader.getConfigurationHelp());
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.cardFile = Paths.get(args[0]);
        options.command = args[1].toLowerCase(Locale.ROOT);

        int i = 2;
        if ("archetype".equals(options.command)) {
            if (args.length < 3 || args[2].startsWith("--")) {
                throw new IllegalArgumentException("Archetype not specified. Available archetypes: " +
                        String.join(", ", DraftArchetype.getAvailableArchetypes()));
            }
            options.archetype = DraftArchetype.fromName(args[2]).getKey();
            i = 3;
        }

        for (; i < args.length; i++) {
            switch (args[i]) {
                case "--set":
                    options.setCode = requireValue(args, i++, "Set code not specified");
                    break;
                case "--format":
                    options.format = requireValue(args, i++, "Format not specified");
                    break;
                case "--output":
                case "-o":
                    options.outputFile = Paths.get(requireValue(args, i++, "Output file not specified"));
                    break;
                case "--config":
                    options.configFile = Paths.get(requireValue(args, i++, "Config file not specified"));
                    break;
                default:
                    if (args[i].startsWith("--engine.")) {
                        // handled by ConfigurationLoader
                        i++;
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (!Files.exists(options.cardFile)) {
            throw new IllegalArgumentException("Card file not found: " + options.cardFile);
        }
        if (options.configFile != null && !Files.exists(options.configFile)) {
            throw new IllegalArgumentException("Config file not found: " + options.configFile);
        }
        Path outputDir = options.outputFile == null ? null : options.outputFile.toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    static final class CliOptions {
        Path cardFile;
        String command;
        String archetype;
        String setCode;
        String format;
        Path outputFile;
        Path configFile;
    }
}
