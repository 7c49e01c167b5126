package org.carball.deckforge.model.seed;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IterativeBuildAroundRequest {
    /** Optional; zero when the deck has no designated seed. */
    private int seedCardId;
    /** One entry per copy already in the deck. */
    @Builder.Default
    private List<Integer> deckCardIds = new ArrayList<>();
    private int maxResults;
    private boolean budgetMode;
    private SetRestriction setRestriction;
    @Builder.Default
    private List<String> allowedSets = new ArrayList<>();
}
