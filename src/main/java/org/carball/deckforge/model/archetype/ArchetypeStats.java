package org.carball.deckforge.model.archetype;

import lombok.Data;

/**
 * Card-type and curve counts used to classify a deck.
 */
@Data
public class ArchetypeStats {
    private double averageCmc;
    private int creatureCount;
    private int instantCount;
    private int sorceryCount;
    /** Noncreature artifacts only. */
    private int artifactCount;
    private int enchantmentCount;
    private int planeswalkerCount;
    private int landCount;
    private int totalCards;
    /** Nonland cards with CMC 5 or more. */
    private int highCmcCount;
    /** Nonland cards with CMC 2 or less. */
    private int lowCmcCount;
}
