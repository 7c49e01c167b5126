package org.carball.deckforge.model.deck;

/**
 * A basic land allocation: which land and how many copies.
 */
public record SuggestedLand(int cardId, String name, int quantity, String color) {
}
