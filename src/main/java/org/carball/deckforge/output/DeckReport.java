package org.carball.deckforge.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.builder.ArenaExporter;
import org.carball.deckforge.classifier.SynergyPackageAnalyzer;
import org.carball.deckforge.model.archetype.ArchetypeScore;
import org.carball.deckforge.model.deck.SuggestDecksResponse;
import org.carball.deckforge.model.deck.SuggestedCard;
import org.carball.deckforge.model.deck.SuggestedDeck;
import org.carball.deckforge.model.synergy.PackageAnalysis;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the result of one engine run as JSON, Markdown or an Arena decklist.
 */
@Slf4j
public class DeckReport {

    private static final String VERSION = "1.0.0";

    private final String command;
    private final int poolSize;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    private SuggestDecksResponse suggestions;
    private SuggestedDeck archetypeDeck;
    private String archetypeKey;
    private List<ArchetypeScore> archetypes;
    private List<PackageAnalysis> packages;

    private DeckReport(String command, int poolSize) {
        this.command = command;
        this.poolSize = poolSize;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static DeckReport forSuggestions(SuggestDecksResponse response, int poolSize) {
        DeckReport report = new DeckReport("suggest", poolSize);
        report.suggestions = response;
        return report;
    }

    public static DeckReport forArchetypeDeck(String archetypeKey, SuggestedDeck deck, int poolSize) {
        DeckReport report = new DeckReport("archetype", poolSize);
        report.archetypeKey = archetypeKey;
        report.archetypeDeck = deck;
        return report;
    }

    public static DeckReport forClassification(List<ArchetypeScore> scores, int poolSize) {
        DeckReport report = new DeckReport("classify", poolSize);
        report.archetypes = scores;
        return report;
    }

    public static DeckReport forPackages(List<PackageAnalysis> analyses, int poolSize) {
        DeckReport report = new DeckReport("packages", poolSize);
        report.packages = analyses;
        return report;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Deck Forge Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Command:** ").append(command).append("  \n");
        md.append("**Cards in pool:** ").append(poolSize).append("  \n\n");

        if (suggestions != null) {
            appendSuggestions(md);
        }
        if (archetypeDeck != null) {
            md.append("## ").append(capitalize(archetypeKey)).append(" Deck\n\n");
            appendDeck(md, archetypeDeck);
        }
        if (archetypes != null) {
            appendArchetypes(md);
        }
        if (packages != null) {
            appendPackages(md);
        }
        return md.toString();
    }

    /**
     * Arena import text for the best suggested deck or the archetype deck; empty when there is none.
     */
    public String toArenaFormat() {
        if (archetypeDeck != null) {
            return ArenaExporter.toArenaFormat(archetypeDeck);
        }
        if (suggestions != null && !suggestions.getSuggestions().isEmpty()) {
            return ArenaExporter.toArenaFormat(suggestions.getSuggestions().get(0));
        }
        return "";
    }

    private void appendSuggestions(StringBuilder md) {
        md.append("## Deck Suggestions\n\n");
        if (suggestions.hasError()) {
            md.append("**Error:** ").append(suggestions.getError()).append("\n\n");
            return;
        }

        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Color combinations checked | ").append(suggestions.getTotalCombos()).append(" |\n");
        md.append("| Viable combinations | ").append(suggestions.getViableCombos()).append(" |\n");
        if (suggestions.getBestCombo() != null) {
            md.append("| Best combination | ").append(suggestions.getBestCombo().name()).append(" |\n");
        }
        md.append("\n");

        if (suggestions.getSuggestions().isEmpty()) {
            md.append("**No viable deck was found in this pool.**\n\n");
        }

        int rank = 1;
        for (SuggestedDeck deck : suggestions.getSuggestions()) {
            md.append("### ").append(rank++).append(". ").append(deck.getColorCombo().name()).append("\n\n");
            appendDeck(md, deck);
        }
    }

    private void appendDeck(StringBuilder md, SuggestedDeck deck) {
        md.append("- **Score:** ").append(String.format("%.2f", deck.getScore()))
                .append(" (").append(deck.getViability().getLabel()).append(")\n");
        md.append("- **Cards:** ").append(deck.getTotalCards())
                .append(" (").append(deck.getSpells().size()).append(" spells, ")
                .append(deck.landCount()).append(" lands)\n");
        if (deck.getAnalysis() != null) {
            md.append("- **Creatures:** ").append(deck.getAnalysis().getCreatureCount()).append("\n");
            md.append("- **Average CMC:** ").append(String.format("%.2f", deck.getAnalysis().getAverageCmc())).append("\n");
            if (!deck.getAnalysis().getSynergies().isEmpty()) {
                md.append("- **Synergies:** ").append(String.join(", ", deck.getAnalysis().getSynergies())).append("\n");
            }
        }
        md.append("\n");

        md.append("| Card | CMC | Score | Why |\n");
        md.append("|------|-----|-------|-----|\n");
        for (SuggestedCard card : deck.getSpells()) {
            md.append("| ").append(card.getName())
                    .append(" | ").append(card.getCmc())
                    .append(" | ").append(String.format("%.2f", card.getScore()))
                    .append(" | ").append(card.getReasoning())
                    .append(" |\n");
        }
        md.append("\n");

        String lands = deck.getLands().stream()
                .map(land -> land.quantity() + " " + land.name())
                .collect(Collectors.joining(", "));
        md.append("**Lands:** ").append(lands).append("\n\n");
    }

    private void appendArchetypes(StringBuilder md) {
        md.append("## Archetype Classification\n\n");
        if (archetypes.isEmpty()) {
            md.append("**No archetype matched this card list.**\n\n");
            return;
        }

        md.append("| Archetype | Score | Confidence | Signals |\n");
        md.append("|-----------|-------|------------|---------|\n");
        for (ArchetypeScore score : archetypes) {
            md.append("| ").append(score.getArchetype().getDisplayName())
                    .append(" | ").append(String.format("%.2f", score.getScore()))
                    .append(" | ").append(String.format("%.2f", score.getConfidence()))
                    .append(" | ").append(String.join(", ", score.getSignals()))
                    .append(" |\n");
        }
        md.append("\n");
    }

    private void appendPackages(StringBuilder md) {
        md.append("## Synergy Packages\n\n");
        if (packages.isEmpty()) {
            md.append("**No synergy package has a required role filled.**\n\n");
            return;
        }

        SynergyPackageAnalyzer analyzer = new SynergyPackageAnalyzer();
        for (PackageAnalysis analysis : packages) {
            md.append("### ").append(analysis.getPackageName())
                    .append(analysis.isActive() ? " (active)" : "").append("\n\n");
            md.append(analysis.getSynergyPackage().getDescription()).append("\n\n");
            md.append("- **Completeness:** ").append(String.format("%.0f%%", analysis.getCompleteness() * 100)).append("\n");
            for (Map.Entry<String, Integer> role : analysis.getFilledRoles().entrySet()) {
                md.append("- ").append(role.getKey()).append(": ").append(role.getValue()).append("\n");
            }
            String suggestion = analyzer.missingRoleSuggestion(analysis);
            if (!suggestion.isEmpty()) {
                md.append("- 💡 ").append(suggestion).append("\n");
            }
            md.append("\n");
        }
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setMetadata(new ReportMetadata(timestamp, VERSION, command, poolSize));
        report.setSuggestions(suggestions);
        report.setArchetype(archetypeKey);
        report.setDeck(archetypeDeck);
        report.setArchetypes(archetypes);
        report.setPackages(packages);
        return report;
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private SuggestDecksResponse suggestions;
        private String archetype;
        private SuggestedDeck deck;
        private List<ArchetypeScore> archetypes;
        private List<PackageAnalysis> packages;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime generatedAt;
        private String version;
        private String command;
        private int poolSize;
    }
}
