package org.carball.deckforge.lookup;

import org.carball.deckforge.model.card.CardRating;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * External card-quality signals: draft win-rate metrics per set and format, plus an optional
 * expert limited score in [0, 1].
 */
@FunctionalInterface
public interface RatingsLookup {

    Optional<CardRating> findRating(String setCode, String draftFormat, int cardId);

    default OptionalDouble findExpertScore(int cardId) {
        return OptionalDouble.empty();
    }
}
