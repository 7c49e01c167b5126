package org.carball.deckforge.model.deck;

/**
 * One entry of a deck list: a card id, how many copies, and which board it sits on.
 */
public record DeckCard(int cardId, int quantity, String board) {

    public static final String MAIN_BOARD = "main";
    public static final String SIDEBOARD = "sideboard";

    public static DeckCard mainboard(int cardId, int quantity) {
        return new DeckCard(cardId, quantity, MAIN_BOARD);
    }

    public boolean isMainboard() {
        return MAIN_BOARD.equals(board);
    }
}
