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
public class GenerateCompleteDeckRequest {
    private int seedCardId;
    /** aggro, midrange or control. */
    private String archetype;
    private boolean budgetMode;
    private SetRestriction setRestriction;
    @Builder.Default
    private List<String> allowedSets = new ArrayList<>();
}
