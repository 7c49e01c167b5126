package org.carball.deckforge.seed;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.deckforge.TestCards;
import org.carball.deckforge.lookup.CollectionLookup;
import org.carball.deckforge.lookup.InMemoryCardCatalog;
import org.carball.deckforge.lookup.LookupException;
import org.carball.deckforge.lookup.StandardSetsLookup;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.SuggestedLand;
import org.carball.deckforge.model.seed.CardWithOwnership;
import org.carball.deckforge.model.seed.IterativeBuildAroundRequest;
import org.carball.deckforge.model.seed.IterativeBuildAroundResponse;
import org.carball.deckforge.model.seed.SeedDeckBuilderRequest;
import org.carball.deckforge.model.seed.SeedDeckBuilderResponse;
import org.carball.deckforge.model.seed.SetRestriction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class SeedDeckBuilderTest {

    private InMemoryCardCatalog catalog;
    private SeedDeckBuilder builder;

    private Logger logger;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        Card seed = inSet(TestCards.creature(1, "Goblin Warchief", "Goblin", 2, "rare", "Haste", "R"), "AAA");
        Card raider = inSet(TestCards.creature(2, "Goblin Raider", "Goblin", 2, "common", "Haste", "R"), "AAA");
        Card growth = inSet(TestCards.spell(3, "Giant Growth", "Instant", 1, "common", "", "G"), "AAA");
        Card mountain = TestCards.land(4, "Mountain").toBuilder().typeLine("Basic Land — Mountain").setCode("AAA").build();
        Card shock = inSet(TestCards.spell(5, "Shock", "Instant", 1, "common",
                "Shock deals 2 damage to any target.", "R"), "BBB");
        catalog = new InMemoryCardCatalog(List.of(seed, raider, growth, mountain, shock));

        builder = new SeedDeckBuilder(catalog, () -> Map.of(2, 2), () -> List.of("BBB"), catalog);

        logger = (Logger) LoggerFactory.getLogger(SeedDeckBuilder.class);
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
    void shouldRejectInvalidSeedRequests() {
        assertThatThrownBy(() -> builder.buildAroundSeed(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("request is nil");
        assertThatThrownBy(() -> builder.buildAroundSeed(SeedDeckBuilderRequest.builder().build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seed card ID is required");
        assertThatThrownBy(() -> builder.buildAroundSeed(SeedDeckBuilderRequest.builder().seedCardId(99).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seed card not found: 99");
    }

    @Test
    void shouldTreatFailingCardLookupAsMissingSeed() {
        // Given
        SeedDeckBuilder failing = new SeedDeckBuilder(catalog, null, null, id -> {
            throw new LookupException("card service down");
        });

        // Then
        assertThatThrownBy(() -> failing.buildAroundSeed(SeedDeckBuilderRequest.builder().seedCardId(1).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seed card not found: 1");
    }

    @Test
    void shouldBuildAroundSeedFromItsOwnSet() {
        // Given
        SeedDeckBuilderRequest request = SeedDeckBuilderRequest.builder()
                .seedCardId(1)
                .setRestriction(SetRestriction.SINGLE)
                .build();

        // When
        SeedDeckBuilderResponse response = builder.buildAroundSeed(request);

        // Then
        assertThat(response.getSeedCard().getName()).isEqualTo("Goblin Warchief");
        assertThat(response.getSeedCard().getScore()).isEqualTo(1.0);
        assertThat(response.getSeedCard().getReasoning()).isEqualTo("This is your build-around card.");

        assertThat(response.getSuggestions()).extracting(CardWithOwnership::getName)
                .containsExactly("Goblin Raider", "Mountain", "Giant Growth");
        assertThat(response.getSuggestions().get(0).getScore()).isCloseTo(0.825, within(1e-9));
        assertThat(response.getSuggestions().get(2).getScore()).isCloseTo(0.475, within(1e-9));
    }

    @Test
    void shouldMarkOwnership() {
        // When
        SeedDeckBuilderResponse response = builder.buildAroundSeed(
                SeedDeckBuilderRequest.builder().seedCardId(1).setRestriction(SetRestriction.SINGLE).build());

        // Then
        CardWithOwnership raider = response.getSuggestions().get(0);
        assertThat(raider.isInCollection()).isTrue();
        assertThat(raider.getOwnedCount()).isEqualTo(2);
        assertThat(raider.getNeededCount()).isEqualTo(2);
        assertThat(response.getSeedCard().isInCollection()).isFalse();
        assertThat(response.getSeedCard().getNeededCount()).isEqualTo(4);

        assertThat(response.getAnalysis().getInCollectionCount()).isEqualTo(1);
        assertThat(response.getAnalysis().getMissingCount()).isEqualTo(2);
        assertThat(response.getAnalysis().getMissingWildcardCost()).containsEntry("common", 2);
    }

    @Test
    void shouldWeightLandsTowardSeedColors() {
        // When
        SeedDeckBuilderResponse response = builder.buildAroundSeed(
                SeedDeckBuilderRequest.builder().seedCardId(1).setRestriction(SetRestriction.SINGLE).build());

        // Then - red weighs 4 + 2, green 2
        assertThat(response.getLandSuggestions()).containsExactly(
                new SuggestedLand(81719, "Mountain", 18, "R"),
                new SuggestedLand(81720, "Forest", 6, "G"));
        assertThat(response.getAnalysis().getSuggestedLandCount()).isEqualTo(24);
        assertThat(response.getAnalysis().getTotalCards()).isEqualTo(3 + 24 + 4);
        assertThat(response.getAnalysis().getColorIdentity()).containsExactly("R");
        assertThat(response.getAnalysis().getKeywords()).containsExactly("haste");
    }

    @Test
    void shouldOnlySuggestOwnedCardsInBudgetMode() {
        // When
        SeedDeckBuilderResponse response = builder.buildAroundSeed(SeedDeckBuilderRequest.builder()
                .seedCardId(1)
                .setRestriction(SetRestriction.SINGLE)
                .budgetMode(true)
                .build());

        // Then
        assertThat(response.getSuggestions()).extracting(CardWithOwnership::getCardId).containsExactly(2);
    }

    @Test
    void shouldLimitResults() {
        // When
        SeedDeckBuilderResponse response = builder.buildAroundSeed(SeedDeckBuilderRequest.builder()
                .seedCardId(1)
                .setRestriction(SetRestriction.SINGLE)
                .maxResults(1)
                .build());

        // Then
        assertThat(response.getSuggestions()).hasSize(1);
    }

    @Test
    void shouldCollectCandidatesPerRestriction() {
        assertThat(builder.candidates(SetRestriction.SINGLE, List.of(), "AAA"))
                .extracting(Card::getId).containsExactly(1, 2, 3, 4);
        assertThat(builder.candidates(SetRestriction.MULTIPLE, List.of("BBB", "AAA", "BBB"), "AAA"))
                .extracting(Card::getId).containsExactly(5, 1, 2, 3, 4);
        assertThat(builder.candidates(SetRestriction.ALL, List.of(), "AAA"))
                .extracting(Card::getId).containsExactly(5);
        assertThat(builder.candidates(SetRestriction.SINGLE, List.of(), null)).isEmpty();
    }

    @Test
    void shouldDegradeWhenStandardSetsUnavailable() {
        // Given
        StandardSetsLookup down = () -> {
            throw new LookupException("rotation service down");
        };
        SeedDeckBuilder degraded = new SeedDeckBuilder(catalog, null, down, catalog);

        // When
        SeedDeckBuilderResponse response = degraded.buildAroundSeed(SeedDeckBuilderRequest.builder().seedCardId(1).build());

        // Then
        assertThat(response.getSuggestions()).isEmpty();
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().contains("Standard sets unavailable"));
    }

    @Test
    void shouldContinueWithoutCollection() {
        // Given
        CollectionLookup down = () -> {
            throw new LookupException("collection service down");
        };
        SeedDeckBuilder degraded = new SeedDeckBuilder(catalog, down, null, catalog);

        // When
        SeedDeckBuilderResponse response = degraded.buildAroundSeed(
                SeedDeckBuilderRequest.builder().seedCardId(1).setRestriction(SetRestriction.SINGLE).build());

        // Then
        assertThat(response.getSuggestions()).noneMatch(CardWithOwnership::isInCollection);
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().contains("Collection unavailable"));
    }

    @Test
    void shouldSuggestNextCardsForDeckInProgress() {
        // Given
        IterativeBuildAroundRequest request = IterativeBuildAroundRequest.builder()
                .seedCardId(1)
                .deckCardIds(List.of(1, 1, 2))
                .setRestriction(SetRestriction.SINGLE)
                .build();

        // When
        IterativeBuildAroundResponse response = builder.suggestNextCards(request);

        // Then - basic lands and off-color cards are skipped
        assertThat(response.getSuggestions()).extracting(CardWithOwnership::getCardId).containsExactly(1, 2);
        assertThat(response.getSuggestions().get(0).getRecommendedCopies()).isEqualTo(2);
        assertThat(response.getSuggestions().get(1).getRecommendedCopies()).isEqualTo(3);
        assertThat(response.getSuggestions().get(0).getReasoning()).contains("fills a gap at 2 CMC");

        assertThat(response.getDeckAnalysis().getCurrentCurve()).containsExactly(Map.entry(2, 3));
        assertThat(response.getDeckAnalysis().getRecommendedLandCount()).isEqualTo(22);
        assertThat(response.getDeckAnalysis().getTotalCards()).isEqualTo(3);
        assertThat(response.getDeckAnalysis().getInCollectionCount()).isEqualTo(1);
        assertThat(response.getSlotsRemaining()).isEqualTo(60 - 3 - 22);
        assertThat(response.getLandSuggestions()).containsExactly(new SuggestedLand(81719, "Mountain", 22, "R"));
    }

    @Test
    void shouldRejectEmptyDecks() {
        assertThatThrownBy(() -> builder.suggestNextCards(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("request is nil");
        assertThatThrownBy(() -> builder.suggestNextCards(IterativeBuildAroundRequest.builder().build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deck card list is empty");
        assertThatThrownBy(() -> builder.suggestNextCards(
                IterativeBuildAroundRequest.builder().deckCardIds(List.of(98, 99)).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("could not load any deck cards");
    }

    @Test
    void shouldScoreCurveGaps() {
        Card twoDrop = TestCards.spell(10, "Two", "Sorcery", 2, "common", "");
        Card oneDrop = TestCards.spell(11, "One", "Sorcery", 1, "common", "");
        Card bigDrop = TestCards.spell(12, "Nine", "Sorcery", 9, "common", "");
        Card zeroDrop = TestCards.spell(13, "Zero", "Artifact", 0, "common", "");

        assertThat(builder.gapScore(TestCards.land(14, "Island"), Map.of())).isEqualTo(0.5);
        assertThat(builder.gapScore(twoDrop, Map.of())).isEqualTo(1.0);
        assertThat(builder.gapScore(twoDrop, Map.of(2, 6))).isCloseTo(0.7, within(1e-9));
        assertThat(builder.gapScore(bigDrop, Map.of(7, 1))).isCloseTo(0.6, within(1e-9));
        assertThat(builder.gapScore(zeroDrop, Map.of())).isEqualTo(0.4);
        assertThat(builder.gapScore(oneDrop, Map.of(1, 5))).isEqualTo(0.3);
    }

    @Test
    void shouldRecommendCopiesByCardShape() {
        Card walker = TestCards.spell(1, "Walker", "Legendary Planeswalker — Chandra", 4, "mythic", "", "R");
        Card legend = TestCards.spell(2, "Legend", "Legendary Creature — Goblin", 3, "rare", "", "R");
        Card cheap = TestCards.spell(3, "Cheap", "Instant", 1, "common", "", "R");
        Card four = TestCards.spell(4, "Four", "Sorcery", 4, "common", "", "R");
        Card big = TestCards.spell(5, "Big", "Sorcery", 6, "common", "", "R");

        assertThat(SeedDeckBuilder.recommendedCopies(walker, 0.9, 0, 4)).isEqualTo(3);
        assertThat(SeedDeckBuilder.recommendedCopies(walker, 0.5, 0, 4)).isEqualTo(2);
        assertThat(SeedDeckBuilder.recommendedCopies(legend, 0.9, 0, 4)).isEqualTo(2);
        assertThat(SeedDeckBuilder.recommendedCopies(cheap, 0.9, 0, 4)).isEqualTo(4);
        assertThat(SeedDeckBuilder.recommendedCopies(cheap, 0.9, 3, 4)).isEqualTo(1);
        assertThat(SeedDeckBuilder.recommendedCopies(cheap, 0.9, 4, 4)).isEqualTo(1);
        assertThat(SeedDeckBuilder.recommendedCopies(four, 0.8, 0, 4)).isEqualTo(3);
        assertThat(SeedDeckBuilder.recommendedCopies(big, 0.5, 0, 4)).isEqualTo(1);
    }

    @Test
    void shouldRecommendLandCountFromAverageCmc() {
        assertThat(SeedDeckBuilder.recommendedLandCount(2.0)).isEqualTo(22);
        assertThat(SeedDeckBuilder.recommendedLandCount(3.0)).isEqualTo(24);
        assertThat(SeedDeckBuilder.recommendedLandCount(3.5)).isEqualTo(26);
    }

    @Test
    void shouldNormalizeRarityKeys() {
        assertThat(SeedDeckBuilder.rarityKey("Mythic")).isEqualTo("mythic");
        assertThat(SeedDeckBuilder.rarityKey(null)).isEmpty();
    }

    private static Card inSet(Card card, String setCode) {
        return card.toBuilder().setCode(setCode).build();
    }
}
