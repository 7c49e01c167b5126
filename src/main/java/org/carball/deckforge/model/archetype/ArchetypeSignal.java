package org.carball.deckforge.model.archetype;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One weighted piece of evidence for an archetype. CMC bounds apply to the deck's average CMC;
 * zero means unbounded.
 */
@Data
@NoArgsConstructor
public class ArchetypeSignal {
    private String name;
    private List<String> patterns = new ArrayList<>();

    @JsonProperty("type_lines")
    private List<String> typeLines = new ArrayList<>();

    private List<String> keywords = new ArrayList<>();

    @JsonProperty("min_cmc")
    private double minCmc;

    @JsonProperty("max_cmc")
    private double maxCmc;

    @JsonProperty("min_count")
    private int minCount;

    private double weight;

    private SpecialSignal special;

    public boolean isCmcOnly() {
        return patterns.isEmpty() && typeLines.isEmpty() && keywords.isEmpty();
    }
}
