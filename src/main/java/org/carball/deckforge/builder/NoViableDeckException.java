package org.carball.deckforge.builder;

/**
 * No color combination of the pool supports the requested archetype.
 */
public class NoViableDeckException extends RuntimeException {

    public NoViableDeckException(String message) {
        super(message);
    }
}
