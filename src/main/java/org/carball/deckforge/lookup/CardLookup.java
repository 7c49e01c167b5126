package org.carball.deckforge.lookup;

import org.carball.deckforge.model.card.Card;

import java.util.Optional;

@FunctionalInterface
public interface CardLookup {

    /**
     * @throws LookupException when the backing source fails
     */
    Optional<Card> findCard(int cardId);
}
