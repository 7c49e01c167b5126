package org.carball.deckforge.model.seed;

import lombok.Builder;
import lombok.Data;
import org.carball.deckforge.model.recommendation.ScoreBreakdown;
import org.carball.deckforge.model.recommendation.SynergyDetail;

import java.util.List;

@Data
@Builder
public class CardWithQuantity {
    private CardWithOwnership card;
    private int quantity;
    private ScoreBreakdown scoreBreakdown;
    private List<SynergyDetail> synergyDetails;
}
