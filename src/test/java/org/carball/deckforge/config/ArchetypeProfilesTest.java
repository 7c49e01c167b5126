package org.carball.deckforge.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ArchetypeProfilesTest {

    @Test
    void shouldFindDraftArchetypeIgnoringCase() {
        assertThat(DraftArchetype.fromName(" Aggro ")).isEqualTo(DraftArchetype.AGGRO);
        assertThat(DraftArchetype.fromName("CONTROL")).isEqualTo(DraftArchetype.CONTROL);
    }

    @Test
    void shouldListAvailableKeysOnUnknownArchetype() {
        assertThatThrownBy(() -> DraftArchetype.fromName("tempo"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown archetype: tempo")
                .hasMessageContaining("aggro, midrange, control");
        assertThatThrownBy(() -> ConstructedArchetype.fromName(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown archetype: null");
    }

    @Test
    void shouldDescribeDraftProfiles() {
        // Then
        assertThat(DraftArchetype.AGGRO.getLandCount()).isEqualTo(16);
        assertThat(DraftArchetype.CONTROL.getLandCount()).isEqualTo(18);
        assertThat(DraftArchetype.AGGRO.isCreatureHeavy()).isTrue();
        assertThat(DraftArchetype.CONTROL.isSpellHeavy()).isTrue();
        assertThat(DraftArchetype.MIDRANGE.isCreatureHeavy()).isTrue();
        assertThat(DraftArchetype.MIDRANGE.isSpellHeavy()).isFalse();
        assertThat(DraftArchetype.AGGRO.preferredAt(2)).isEqualTo(8);
        assertThat(DraftArchetype.CONTROL.preferredAt(9)).isEqualTo(3);
    }

    @Test
    void shouldProvideArchetypeHelp() {
        // When
        String help = DraftArchetype.getArchetypeHelp();

        // Then
        assertThat(help).startsWith("Available Draft Archetypes:");
        assertThat(help).contains("aggro", "midrange", "control");
    }

    @Test
    void shouldSizeConstructedProfiles() {
        assertThat(ConstructedArchetype.AGGRO.nonlandSlots(60)).isEqualTo(40);
        assertThat(ConstructedArchetype.MIDRANGE.nonlandSlots(60)).isEqualTo(36);
        assertThat(ConstructedArchetype.CONTROL.nonlandSlots(60)).isEqualTo(34);
        assertThat(ConstructedArchetype.CONTROL.getRemovalCount()).isEqualTo(10);
        assertThat(ConstructedArchetype.AGGRO.getCreatureRatio()).isEqualTo(0.70);
        assertThat(ConstructedArchetype.getAvailableArchetypes()).containsExactly("aggro", "midrange", "control");
    }
}
