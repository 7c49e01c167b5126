package org.carball.deckforge.model.archetype;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ArchetypeScore {
    private Archetype archetype;
    private double score;
    private double confidence;
    private List<String> signals;
    private String description;
}
