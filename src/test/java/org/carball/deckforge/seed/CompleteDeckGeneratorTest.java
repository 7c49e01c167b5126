package org.carball.deckforge.seed;

import org.carball.deckforge.TestCards;
import org.carball.deckforge.lookup.InMemoryCardCatalog;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.seed.CardWithQuantity;
import org.carball.deckforge.model.seed.GenerateCompleteDeckRequest;
import org.carball.deckforge.model.seed.GenerateCompleteDeckResponse;
import org.carball.deckforge.model.seed.LandEntry;
import org.carball.deckforge.model.seed.SetRestriction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

public class CompleteDeckGeneratorTest {

    private CompleteDeckGenerator generator;

    @BeforeEach
    void setUp() {
        List<Card> cards = new ArrayList<>();
        cards.add(TestCards.creature(1, "Goblin Warchief", "Goblin", 2, "rare", "Haste", "R"));
        // three goblins at each of CMC 1 to 4, ids 2..13
        for (int cmc = 1; cmc <= 4; cmc++) {
            cards.addAll(TestCards.goblins(2 + (cmc - 1) * 3, 3, cmc, "R"));
        }
        cards.add(TestCards.land(14, "Mountain"));

        InMemoryCardCatalog catalog = new InMemoryCardCatalog(cards);
        generator = new CompleteDeckGenerator(new SeedDeckBuilder(catalog, null, null, catalog));
    }

    @Test
    void shouldRejectNullRequest() {
        assertThatThrownBy(() -> generator.generateCompleteDeck(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("request is nil");
    }

    @Test
    void shouldRejectUnknownArchetype() {
        assertThatThrownBy(() -> generator.generateCompleteDeck(request(1, "tempo")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown archetype: tempo");
    }

    @Test
    void shouldGenerateSixtyCardMidrangeDeck() {
        // When
        GenerateCompleteDeckResponse response = generator.generateCompleteDeck(request(1, ""));

        // Then
        assertThat(response.getArchetype()).isEqualTo("midrange");
        assertThat(response.totalCards()).isEqualTo(60);
        assertThat(response.getSpells().stream().mapToInt(CardWithQuantity::getQuantity).sum()).isEqualTo(36);
        assertThat(response.getLands()).containsExactly(new LandEntry(81719, "Mountain", 24, List.of("R"), true, false));

        CardWithQuantity seed = response.getSpells().get(0);
        assertThat(seed.getCard().getName()).isEqualTo("Goblin Warchief");
        assertThat(seed.getQuantity()).isEqualTo(4);
        assertThat(response.getSpells()).allSatisfy(spell -> assertThat(spell.getQuantity()).isBetween(1, 4));
    }

    @Test
    void shouldFillCurveTargetsBeforeTopUp() {
        // When
        GenerateCompleteDeckResponse response = generator.generateCompleteDeck(request(1, "midrange"));

        // Then - two-drops stop at the curve target until the top-up pass
        assertThat(response.getAnalysis().getManaCurve())
                .containsExactly(entry(1, 4), entry(2, 14), entry(3, 10), entry(4, 8));
        assertThat(response.getSpells()).extracting(spell -> spell.getCard().getCardId())
                .containsExactly(1, 5, 8, 9, 10, 2, 11, 12, 13, 6, 7);
    }

    @Test
    void shouldSummarizeDeck() {
        // When
        GenerateCompleteDeckResponse response = generator.generateCompleteDeck(request(1, "midrange"));

        // Then
        assertThat(response.getAnalysis().getSpellCount()).isEqualTo(36);
        assertThat(response.getAnalysis().getLandCount()).isEqualTo(24);
        assertThat(response.getAnalysis().getCreatureCount()).isEqualTo(36);
        assertThat(response.getAnalysis().getColorDistribution()).containsExactly(entry("R", 36));
        assertThat(response.getAnalysis().getMissingCards()).isEqualTo(36);
        assertThat(response.getAnalysis().getWildcardCost()).isEqualTo(Map.of("rare", 4, "common", 32));
        assertThat(response.getAnalysis().getArchetypeMatch()).isEqualTo("Midrange");
    }

    @Test
    void shouldDescribeStrategy() {
        // When
        GenerateCompleteDeckResponse response = generator.generateCompleteDeck(request(1, "midrange"));

        // Then
        assertThat(response.getStrategy().getSummary()).isEqualTo("Mono-Red Midrange deck built around Goblin Warchief.");
        assertThat(response.getStrategy().getKeyCards()).containsExactly("Goblin Warchief", "Goblin 5", "Goblin 8", "Goblin 9");
        assertThat(response.getStrategy().getStrengths()).contains(
                "Creature count fits the Midrange plan",
                "Consistent mana from a single color",
                "Many cards synergize with Goblin Warchief");
        assertThat(response.getStrategy().getWeaknesses()).containsExactly(
                "Light on removal (0 of 6 for Midrange)",
                "Little card advantage (0 of 4 for Midrange)",
                "Needs 36 more cards to complete");
    }

    @Test
    void shouldUseAggroLandCount() {
        // When
        GenerateCompleteDeckResponse response = generator.generateCompleteDeck(request(1, "Aggro"));

        // Then
        assertThat(response.totalCards()).isEqualTo(60);
        assertThat(response.getAnalysis().getLandCount()).isEqualTo(20);
        assertThat(response.getAnalysis().getSpellCount()).isEqualTo(40);
    }

    @Test
    void shouldFlagCardMixAgainstControlProfile() {
        // Given - only one-drops besides the seed
        List<Card> cards = new ArrayList<>(TestCards.goblins(1, 11, 1, "R"));
        InMemoryCardCatalog catalog = new InMemoryCardCatalog(cards);
        CompleteDeckGenerator oneDrops = new CompleteDeckGenerator(new SeedDeckBuilder(catalog, null, null, catalog));

        // When
        GenerateCompleteDeckResponse response = oneDrops.generateCompleteDeck(request(1, "control"));

        // Then
        assertThat(response.totalCards()).isEqualTo(60);
        assertThat(response.getAnalysis().getArchetypeMatch()).isEqualTo("Aggro");
        assertThat(response.getStrategy().getWeaknesses()).contains("Card mix plays more like Aggro than Control");
        assertThat(response.getStrategy().getStrengths()).contains("Low curve pressures opponents early");
    }

    private static GenerateCompleteDeckRequest request(int seedCardId, String archetype) {
        return GenerateCompleteDeckRequest.builder()
                .seedCardId(seedCardId)
                .archetype(archetype)
                .setRestriction(SetRestriction.SINGLE)
                .build();
    }
}
