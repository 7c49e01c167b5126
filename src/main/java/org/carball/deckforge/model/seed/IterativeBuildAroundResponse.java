package org.carball.deckforge.model.seed;

import lombok.Builder;
import lombok.Data;
import org.carball.deckforge.model.deck.SuggestedLand;

import java.util.List;

@Data
@Builder
public class IterativeBuildAroundResponse {
    private List<CardWithOwnership> suggestions;
    private LiveDeckAnalysis deckAnalysis;
    private int slotsRemaining;
    private List<SuggestedLand> landSuggestions;
}
