package org.carball.deckforge.model.seed;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class GenerateCompleteDeckResponse {
    private CardWithOwnership seedCard;
    private String archetype;
    private List<CardWithQuantity> spells;
    private List<LandEntry> lands;
    private DeckStrategy strategy;
    private CompleteDeckAnalysis analysis;

    public int totalCards() {
        return spells.stream().mapToInt(CardWithQuantity::getQuantity).sum()
                + lands.stream().mapToInt(LandEntry::quantity).sum();
    }
}
