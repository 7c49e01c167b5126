package org.carball.deckforge.analyzer;

import org.carball.deckforge.model.synergy.KeywordCategory;
import org.carball.deckforge.model.synergy.KeywordInfo;
import org.carball.deckforge.model.synergy.KeywordSynergy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class KeywordSynergyCalculatorTest {

    private static final KeywordInfo FLYING = new KeywordInfo("flying", KeywordCategory.COMBAT, 0.8);
    private static final KeywordInfo HASTE = new KeywordInfo("haste", KeywordCategory.COMBAT, 0.6);
    private static final KeywordInfo TOKENS = new KeywordInfo("tokens", KeywordCategory.THEME, 0.9);

    @Test
    void shouldScoreExactMatchByMeanWeight() {
        // When
        KeywordSynergy synergy = KeywordSynergyCalculator.calculateDetailed(List.of(FLYING), List.of(FLYING));

        // Then
        assertThat(synergy.score()).isCloseTo(0.8, within(1e-9));
        assertThat(synergy.matchedKeywords()).containsExactly("flying");
    }

    @Test
    void shouldScoreSameCategoryAtQuarterWeight() {
        // When
        KeywordSynergy synergy = KeywordSynergyCalculator.calculateDetailed(List.of(FLYING), List.of(HASTE));

        // Then
        assertThat(synergy.score()).isCloseTo((0.8 + 0.6) / 4, within(1e-9));
        assertThat(synergy.matchedKeywords()).isEmpty();
    }

    @Test
    void shouldNormalizeByPairCount() {
        // When - flying/flying exact plus haste/flying related, over 2x1 pairs
        double score = KeywordSynergyCalculator.calculate(List.of(FLYING, HASTE), List.of(FLYING));

        // Then
        assertThat(score).isCloseTo((0.8 + (0.6 + 0.8) / 4) / 2, within(1e-9));
    }

    @Test
    void shouldReturnZeroWithoutOverlap() {
        assertThat(KeywordSynergyCalculator.calculate(List.of(FLYING), List.of(TOKENS))).isZero();
    }

    @Test
    void shouldReturnNoneForEmptyLists() {
        // When
        KeywordSynergy synergy = KeywordSynergyCalculator.calculateDetailed(List.of(), List.of(FLYING));

        // Then
        assertThat(synergy.score()).isZero();
        assertThat(synergy.matchedKeywords()).isEmpty();
        assertThat(KeywordSynergyCalculator.calculate(null, List.of(FLYING))).isZero();
    }
}
