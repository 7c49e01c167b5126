package org.carball.deckforge.model.recommendation;

/**
 * Inclusive CMC bounds.
 */
public record CmcRange(int min, int max) {

    public boolean contains(int cmc) {
        return cmc >= min && cmc <= max;
    }
}
