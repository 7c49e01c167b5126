package org.carball.deckforge.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.lookup.LookupException;
import org.carball.deckforge.lookup.RatingsLookup;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.card.CardRating;
import org.carball.deckforge.model.card.Rarity;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Card quality in [0, 1] from draft ratings, falling back to rarity when no rating is known.
 */
@Slf4j
public class QualityScorer {

    private static final double WIN_RATE_FLOOR = 0.45;
    private static final double WIN_RATE_SPAN = 0.20;
    private static final double PICK_SPAN = 13.0;

    private static final double GIH_WEIGHT = 0.50;
    private static final double OH_WEIGHT = 0.30;
    private static final double ATA_WEIGHT = 0.10;
    private static final double ALSA_WEIGHT = 0.10;

    private static final double RATING_BLEND = 0.70;
    private static final double EXPERT_BLEND = 0.30;

    private final RatingsLookup ratingsLookup;

    /**
     * @param ratingsLookup may be null, in which case every card scores by rarity
     */
    public QualityScorer(RatingsLookup ratingsLookup) {
        this.ratingsLookup = ratingsLookup;
    }

    /**
     * Blends the win-rate score (70%) with the expert score (30%). Either one alone is used as is.
     */
    public double score(Card card, String setCode, String draftFormat) {
        OptionalDouble ratingScore = findRating(card, setCode, draftFormat).map(r -> OptionalDouble.of(ratingScore(r)))
                .orElse(OptionalDouble.empty());
        OptionalDouble expertScore = findExpertScore(card);

        if (ratingScore.isPresent() && expertScore.isPresent()) {
            return ratingScore.getAsDouble() * RATING_BLEND + expertScore.getAsDouble() * EXPERT_BLEND;
        } else if (ratingScore.isPresent()) {
            return ratingScore.getAsDouble();
        } else if (expertScore.isPresent()) {
            return expertScore.getAsDouble();
        }
        return fallback(card);
    }

    /**
     * Games-in-hand win rate only, as used by the deck constructors.
     */
    public double scoreByWinRate(Card card, String setCode, String draftFormat) {
        return findRating(card, setCode, draftFormat)
                .map(r -> normalizeWinRate(r.getGamesInHandWinRate()))
                .orElseGet(() -> fallback(card));
    }

    public static double fallback(Card card) {
        return Rarity.fallbackQualityOf(card.getRarity());
    }

    /**
     * 50% games-in-hand, 30% opening-hand, 10% average taken at, 10% average last seen at.
     */
    static double ratingScore(CardRating rating) {
        double gih = normalizeWinRate(rating.getGamesInHandWinRate());
        double oh = normalizeWinRate(rating.getOpeningHandWinRate());
        double ata = normalizePick(rating.getAverageTakenAt());
        double alsa = normalizePick(rating.getAverageLastSeenAt());
        return gih * GIH_WEIGHT + oh * OH_WEIGHT + ata * ATA_WEIGHT + alsa * ALSA_WEIGHT;
    }

    /** 45% maps to 0, 65% and above to 1. */
    static double normalizeWinRate(double winRate) {
        return clamp((winRate - WIN_RATE_FLOOR) / WIN_RATE_SPAN);
    }

    /** Pick 1 maps to 1, pick 14 and later to 0. */
    static double normalizePick(double pick) {
        return clamp(1.0 - (pick - 1.0) / PICK_SPAN);
    }

    private Optional<CardRating> findRating(Card card, String setCode, String draftFormat) {
        if (ratingsLookup == null || isBlank(setCode) || isBlank(draftFormat)) {
            return Optional.empty();
        }
        try {
            return ratingsLookup.findRating(setCode, draftFormat, card.getId());
        } catch (LookupException e) {
            log.warn("Rating lookup failed for card {} in {}/{}: {}", card.getId(), setCode, draftFormat, e.getMessage());
            return Optional.empty();
        }
    }

    private OptionalDouble findExpertScore(Card card) {
        if (ratingsLookup == null) {
            return OptionalDouble.empty();
        }
        try {
            return ratingsLookup.findExpertScore(card.getId());
        } catch (LookupException e) {
            log.warn("Expert score lookup failed for card {}: {}", card.getId(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
