package org.carball.deckforge.model.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private double colorFit;
    private double curveFit;
    private double synergy;
    private double quality;
    private double overall;
}
