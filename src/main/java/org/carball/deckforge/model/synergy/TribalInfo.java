package org.carball.deckforge.model.synergy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class TribalInfo {
    private String type;
    private TribalSupport support;

    @JsonProperty("synergy_weight")
    private double synergyWeight;

    @JsonProperty("related_types")
    private List<String> relatedTypes = new ArrayList<>();

    @JsonProperty("common_keywords")
    private List<String> commonKeywords = new ArrayList<>();

    private String description;
}
