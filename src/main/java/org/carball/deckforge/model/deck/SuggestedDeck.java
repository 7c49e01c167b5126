package org.carball.deckforge.model.deck;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SuggestedDeck {
    private ColorCombination colorCombo;
    private List<SuggestedCard> spells;
    private List<SuggestedLand> lands;
    private int totalCards;
    private double score;
    private Viability viability;
    private DeckSuggestionAnalysis analysis;

    public int landCount() {
        return lands.stream().mapToInt(SuggestedLand::quantity).sum();
    }
}
