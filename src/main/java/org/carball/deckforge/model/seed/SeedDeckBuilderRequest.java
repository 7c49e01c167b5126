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
public class SeedDeckBuilderRequest {
    private int seedCardId;
    /** Zero or less means the configured default. */
    private int maxResults;
    /** Only suggest cards already in the collection. */
    private boolean budgetMode;
    private SetRestriction setRestriction;
    @Builder.Default
    private List<String> allowedSets = new ArrayList<>();
}
