package org.carball.deckforge.lookup;

import org.carball.deckforge.model.card.Card;

import java.util.List;

@FunctionalInterface
public interface SetCardsLookup {

    List<Card> getCardsBySet(String setCode);
}
