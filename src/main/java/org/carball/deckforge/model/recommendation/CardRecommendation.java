package org.carball.deckforge.model.recommendation;

import lombok.Builder;
import lombok.Data;
import org.carball.deckforge.model.card.Card;

@Data
@Builder
public class CardRecommendation {
    private Card card;
    private double score;
    private String reasoning;
    private RecommendationSource source;
    private double confidence;
    private ScoreFactors factors;
}
