package org.carball.deckforge.model.card;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Draft win-rate metrics for a card within one set and format.
 * Win rates are fractions (0.55 means 55%), pick positions are 1-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CardRating {
    private double gamesInHandWinRate;
    private double openingHandWinRate;
    private double averageTakenAt;
    private double averageLastSeenAt;
}
