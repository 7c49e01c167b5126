package org.carball.deckforge.model.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-factor breakdown of a recommendation score. Every field is in [0, 1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreFactors {
    private double colorFit;
    private double manaCurve;
    private double synergy;
    private double quality;
    private double playable;
}
