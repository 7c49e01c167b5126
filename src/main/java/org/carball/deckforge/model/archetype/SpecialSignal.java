package org.carball.deckforge.model.archetype;

/**
 * Signals decided from deck statistics alone instead of counting matching cards.
 */
public enum SpecialSignal {
    /** Ten or fewer creatures. */
    FEW_CREATURES,
    /** Four or more nonland cards with CMC 5 or more. */
    BIG_FINISHERS
}
