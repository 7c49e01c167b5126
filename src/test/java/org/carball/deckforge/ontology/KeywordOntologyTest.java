package org.carball.deckforge.ontology;

import org.carball.deckforge.model.synergy.KeywordCategory;
import org.carball.deckforge.model.synergy.KeywordInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class KeywordOntologyTest {

    @Test
    void shouldExtractDictionaryKeywords() {
        // When
        Set<String> keywords = KeywordOntology.extractKeywords("Flying, haste");

        // Then
        assertThat(keywords).contains("flying", "haste");
    }

    @Test
    void shouldExtractThemeKeywords() {
        // When
        Set<String> keywords = KeywordOntology.extractKeywords(
                "When this enters, create a 1/1 white Soldier creature token. Draw a card.");

        // Then
        assertThat(keywords).contains("tokens", "card draw");
    }

    @Test
    void shouldReturnEmptyForMissingText() {
        assertThat(KeywordOntology.extractKeywords(null)).isEmpty();
        assertThat(KeywordOntology.extractKeywords("")).isEmpty();
        assertThat(KeywordOntology.extractKeywordsWithInfo(null)).isEmpty();
    }

    @Test
    void shouldKeepCategoryAndWeight() {
        // When
        List<KeywordInfo> infos = KeywordOntology.extractKeywordsWithInfo("Flying");

        // Then
        assertThat(infos).contains(new KeywordInfo("flying", KeywordCategory.COMBAT, 0.8));
    }

    @Test
    void shouldListEachKeywordOnce() {
        // Given - two death payoff patterns and two token patterns match
        String text = "Whenever another creature you control dies, create a token. Create a 2/2 Zombie token.";

        // When
        List<KeywordInfo> infos = KeywordOntology.extractKeywordsWithInfo(text);

        // Then
        assertThat(infos).extracting(KeywordInfo::keyword).doesNotHaveDuplicates()
                .contains("tokens", "death payoff", "death triggers");
        KeywordInfo payoff = infos.stream().filter(i -> i.keyword().equals("death payoff")).findFirst().orElseThrow();
        assertThat(payoff.weight()).isEqualTo(0.95);
        assertThat(payoff.isTheme()).isTrue();
    }

    @Test
    void shouldLookUpWeightsAndCategories() {
        assertThat(KeywordOntology.weightOf("Flying")).isEqualTo(0.8);
        assertThat(KeywordOntology.weightOf("tokens")).isEqualTo(0.9);
        assertThat(KeywordOntology.weightOf("no such keyword")).isEqualTo(0.5);

        assertThat(KeywordOntology.categoryOf("flash")).isEqualTo(KeywordCategory.ABILITY);
        assertThat(KeywordOntology.categoryOf("sacrifice")).isEqualTo(KeywordCategory.THEME);
        assertThat(KeywordOntology.categoryOf("no such keyword")).isEqualTo(KeywordCategory.ABILITY);
    }

    @Test
    void shouldTranslateThemeNames() {
        assertThat(KeywordOntology.friendlyThemeName("ETB")).isEqualTo("Enter the Battlefield");
        assertThat(KeywordOntology.friendlyThemeName("tokens")).isEqualTo("Tokens");
        assertThat(KeywordOntology.friendlyThemeName("landfall")).isEqualTo("landfall");
    }

    @Test
    void shouldExposeTables() {
        assertThat(KeywordOntology.dictionary()).containsKey("haste");
        assertThat(KeywordOntology.themePatterns()).isNotEmpty();
    }
}
