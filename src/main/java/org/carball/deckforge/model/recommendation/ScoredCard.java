package org.carball.deckforge.model.recommendation;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.carball.deckforge.model.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * A candidate card with its weighted score, used by the deck constructors and the seed builder.
 */
@Data
@AllArgsConstructor
public class ScoredCard {
    private Card card;
    private double score;
    private String reasoning;
    private ScoreBreakdown breakdown;
    private List<SynergyDetail> synergyDetails;

    public ScoredCard(Card card, double score, String reasoning) {
        this(card, score, reasoning, null, new ArrayList<>());
    }

    public int getCardId() {
        return card.getId();
    }
}
