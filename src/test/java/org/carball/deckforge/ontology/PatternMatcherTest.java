package org.carball.deckforge.ontology;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class PatternMatcherTest {

    @Test
    void shouldMatchPlainSubstring() {
        assertThat(PatternMatcher.containsPattern("draw a card.", "draw a card")).isTrue();
        assertThat(PatternMatcher.containsPattern("draw two cards.", "draw a card")).isFalse();
    }

    @Test
    void shouldMatchSuffixAfterPrefix() {
        // Given
        String text = "create a 1/1 white soldier creature token.";

        // Then
        assertThat(PatternMatcher.containsPattern(text, "create a.*token")).isTrue();
        assertThat(PatternMatcher.containsPattern("token doubling. create a copy", "create a.*token")).isFalse();
    }

    @Test
    void shouldSearchSuffixOnlyAfterFirstPrefixOccurrence() {
        // Given - the suffix only appears before the first prefix
        String text = "damage deals nothing";

        // Then
        assertThat(PatternMatcher.containsPattern(text, "deals.*damage")).isFalse();
    }

    @Test
    void shouldOnlyCheckFirstSegmentWithSeveralWildcards() {
        // When/Then - trailing segments are ignored
        assertThat(PatternMatcher.containsPattern("other elves", "other.*you control.*get")).isTrue();
        assertThat(PatternMatcher.containsPattern("elves", "other.*you control.*get")).isFalse();
    }

    @Test
    void shouldHandleNullArguments() {
        assertThat(PatternMatcher.containsPattern(null, "x")).isFalse();
        assertThat(PatternMatcher.containsPattern("x", null)).isFalse();
    }

    @Test
    void shouldMatchAnyPattern() {
        // Given
        List<String> patterns = List.of("counter target spell", "destroy target");

        // Then
        assertThat(PatternMatcher.containsAny("destroy target creature.", patterns)).isTrue();
        assertThat(PatternMatcher.containsAny("exile target creature.", patterns)).isFalse();
        assertThat(PatternMatcher.containsAny("anything", List.of())).isFalse();
    }
}
