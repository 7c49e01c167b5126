package org.carball.deckforge.model.seed;

import lombok.Builder;
import lombok.Data;
import org.carball.deckforge.model.deck.SuggestedLand;

import java.util.List;

@Data
@Builder
public class SeedDeckBuilderResponse {
    private CardWithOwnership seedCard;
    private List<CardWithOwnership> suggestions;
    private List<SuggestedLand> landSuggestions;
    private SeedDeckAnalysis analysis;
}
