package org.carball.deckforge.model.synergy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One role within a synergy package and the rules a card must satisfy to fill it.
 */
@Data
@NoArgsConstructor
public class PackageRole {
    private String name;

    @JsonProperty("display_name")
    private String displayName;

    private List<String> patterns = new ArrayList<>();

    @JsonProperty("type_lines")
    private List<String> typeLines = new ArrayList<>();

    private List<String> keywords = new ArrayList<>();

    private boolean required;

    /** Upper CMC bound applied to type-line matches ("cheap" roles). */
    @JsonProperty("max_cmc")
    private Double maxCmc;

    /** When set, any creature at or above this CMC fills the role ("big" roles). */
    @JsonProperty("min_creature_cmc")
    private Double minCreatureCmc;
}
