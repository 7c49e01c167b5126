package org.carball.deckforge.engine;

import org.carball.deckforge.model.deck.DeckContext;
import org.carball.deckforge.model.recommendation.CardRecommendation;
import org.carball.deckforge.model.recommendation.RecommendationFilters;

import java.util.List;

/**
 * Suggests single cards to add to an existing deck.
 */
public interface RecommendationEngine {

    /**
     * Ranked recommendations, best first. Cards already in the deck are never returned.
     *
     * @param filters null means the engine defaults
     */
    List<CardRecommendation> recommend(DeckContext deck, RecommendationFilters filters);

    /**
     * The reasoning sentence for one card against the deck.
     */
    String explain(int cardId, DeckContext deck);

    /**
     * Notifies the engine that a recommendation was accepted. Reserved for future learning.
     */
    void recordAcceptance(DeckContext deck, int cardId);
}
