package org.carball.deckforge.seed;

import org.carball.deckforge.TestCards;
import org.carball.deckforge.config.SeedBuilderTuning;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.recommendation.ScoredCard;
import org.carball.deckforge.model.recommendation.SynergyDetail;
import org.carball.deckforge.model.recommendation.SynergyDetail.SynergyType;
import org.carball.deckforge.model.seed.SeedCardAnalysis;
import org.carball.deckforge.model.synergy.KeywordInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class SeedCardScorerTest {

    private SeedCardScorer scorer;
    private SeedCardAnalysis goblinSeed;

    @BeforeEach
    void setUp() {
        scorer = new SeedCardScorer(SeedBuilderTuning.defaults());
        goblinSeed = SeedCardScorer.analyzeSeed(
                TestCards.creature(1, "Goblin Warchief", "Goblin", 2, "rare", "Haste", "R"));
    }

    @Test
    void shouldAnalyzeSeedCard() {
        assertThat(goblinSeed.getColors()).containsExactly("R");
        assertThat(goblinSeed.getCmc()).isEqualTo(2);
        assertThat(goblinSeed.isCreature()).isTrue();
        assertThat(goblinSeed.getCreatureTypes()).containsExactly("Goblin");
        assertThat(goblinSeed.getKeywords()).extracting(KeywordInfo::keyword).containsExactly("haste");
        assertThat(goblinSeed.getThemes()).isEmpty();
    }

    @Test
    void shouldMergeDeckIntoOneTarget() {
        // Given
        List<Card> deck = List.of(
                TestCards.creature(1, "Elf Scout", "Elf", 3, "common", "Reach", "G"),
                TestCards.creature(2, "Goblin Guide", "Goblin", 1, "common", "Haste", "R"),
                TestCards.land(3, "Forest"));

        // When
        SeedCardAnalysis analysis = SeedCardScorer.analyzeDeck(deck);

        // Then
        assertThat(analysis.getColors()).containsExactly("R", "G");
        assertThat(analysis.getCreatureTypes()).containsExactly("Elf", "Goblin");
        assertThat(analysis.getKeywords()).extracting(KeywordInfo::keyword).containsExactly("reach", "haste");
        assertThat(analysis.getCmc()).isEqualTo(2);
        assertThat(analysis.isCreature()).isTrue();
    }

    @Test
    void shouldScoreColorCompatibility() {
        SeedCardAnalysis colorless = SeedCardScorer.analyzeSeed(TestCards.spell(2, "Ornithopter", "Artifact", 0, "common", ""));

        assertThat(scorer.colorCompatibility(TestCards.spell(3, "Mind Stone", "Artifact", 2, "common", ""), goblinSeed)).isEqualTo(1.0);
        assertThat(scorer.colorCompatibility(TestCards.spell(4, "Shock", "Instant", 1, "common", "", "R"), goblinSeed)).isEqualTo(1.0);
        assertThat(scorer.colorCompatibility(TestCards.spell(5, "Giant Growth", "Instant", 1, "common", "", "G"), goblinSeed)).isZero();
        assertThat(scorer.colorCompatibility(TestCards.spell(6, "Fires", "Instant", 2, "common", "", "R", "G"), goblinSeed))
                .isCloseTo(0.35, within(1e-9));
        assertThat(scorer.colorCompatibility(TestCards.spell(7, "Shock", "Instant", 1, "common", "", "R"), colorless)).isEqualTo(0.8);
    }

    @Test
    void shouldScoreCurveFromFixedTable() {
        assertThat(scorer.curveFit(TestCards.land(1, "Mountain"))).isEqualTo(0.5);
        assertThat(scorer.curveFit(TestCards.spell(2, "Free", "Artifact", 0, "common", ""))).isEqualTo(0.6);
        assertThat(scorer.curveFit(TestCards.spell(3, "Two Drop", "Sorcery", 2, "common", ""))).isEqualTo(1.0);
        assertThat(scorer.curveFit(TestCards.spell(4, "Six Drop", "Sorcery", 6, "common", ""))).isEqualTo(0.4);
        assertThat(scorer.curveFit(TestCards.spell(5, "Big Spell", "Sorcery", 9, "common", ""))).isEqualTo(0.3);
    }

    @Test
    void shouldCombineKeywordAndTribalSynergy() {
        // Given
        Card goblin = TestCards.creature(2, "Goblin Raider", "Goblin", 2, "common", "Haste", "R");
        List<SynergyDetail> details = new ArrayList<>();

        // When
        double synergy = scorer.synergy(goblin, goblinSeed, details);

        // Then - keyword 0.6 and tribal 0.8 averaged
        assertThat(synergy).isCloseTo(0.7, within(1e-9));
        assertThat(details).containsExactly(
                new SynergyDetail(SynergyType.KEYWORD, "haste", "Shares haste with your deck"),
                new SynergyDetail(SynergyType.TRIBAL, "Goblin",
                        "Goblin tribal synergy: Aggressive swarm tactics with sacrifice synergies"));
    }

    @Test
    void shouldRewardSharedThemes() {
        // Given
        SeedCardAnalysis tokenSeed = SeedCardScorer.analyzeSeed(TestCards.spell(1, "Raise the Alarm", "Instant", 2,
                "common", "Create a 1/1 white Soldier creature token.", "W"));
        Card moreTokens = TestCards.spell(2, "Double Up", "Sorcery", 3, "common",
                "Create two 1/1 white Soldier creature tokens.", "W");
        List<SynergyDetail> details = new ArrayList<>();

        // When
        double synergy = scorer.synergy(moreTokens, tokenSeed, details);

        // Then - keyword 0.9 and theme 0.7 averaged
        assertThat(tokenSeed.getThemes()).containsExactly("tokens");
        assertThat(synergy).isCloseTo(0.8, within(1e-9));
        assertThat(details).extracting(SynergyDetail::type).containsExactly(SynergyType.KEYWORD, SynergyType.THEME);
        assertThat(details.get(1).description()).isEqualTo("Supports the Tokens theme");
    }

    @Test
    void shouldTreatChangelingAsEveryTargetType() {
        // Given
        Card shapeshifter = TestCards.creature(2, "Shapeshifter", "Shapeshifter", 2, "common",
                "Changeling (This card is every creature type.)", "R");
        SeedCardAnalysis plainGoblin = SeedCardScorer.analyzeSeed(
                TestCards.creature(1, "Goblin", "Goblin", 1, "common", "", "R"));
        List<SynergyDetail> details = new ArrayList<>();

        // When
        double synergy = scorer.synergy(shapeshifter, plainGoblin, details);

        // Then
        assertThat(synergy).isCloseTo(0.8, within(1e-9));
        assertThat(details).extracting(SynergyDetail::name).containsExactly("Goblin");
    }

    @Test
    void shouldFallBackToNeutralSynergy() {
        // Given
        Card vanilla = TestCards.spell(2, "Mind Stone", "Artifact", 2, "common", "");
        List<SynergyDetail> details = new ArrayList<>();

        // Then
        assertThat(scorer.synergy(vanilla, goblinSeed, details)).isEqualTo(0.5);
        assertThat(details).isEmpty();
    }

    @Test
    void shouldWeightAllFactors() {
        // Given
        Card goblin = TestCards.creature(2, "Goblin Raider", "Goblin", 2, "common", "Haste", "R");

        // When
        ScoredCard scored = scorer.score(goblin, goblinSeed);

        // Then - 1.0*.25 + 1.0*.2 + .7*.3 + .5*.15 + 1.0*.05 + .8*.05
        assertThat(scored.getScore()).isCloseTo(0.825, within(1e-9));
        assertThat(scored.getBreakdown().getQuality()).isEqualTo(0.5);
        assertThat(scored.getReasoning()).startsWith("This card matches your colors")
                .contains("good curve fit at 2 CMC");
        assertThat(scored.getSynergyDetails()).hasSize(2);
    }

    @Test
    void shouldUseCallerCurveScore() {
        // Given
        Card goblin = TestCards.creature(2, "Goblin Raider", "Goblin", 5, "common", "Haste", "R");

        // When
        ScoredCard scored = scorer.score(goblin, goblinSeed, 0.9, "fills a gap at 5 CMC");

        // Then
        assertThat(scored.getBreakdown().getCurveFit()).isEqualTo(0.9);
        assertThat(scored.getReasoning()).contains("fills a gap at 5 CMC");
    }
}
