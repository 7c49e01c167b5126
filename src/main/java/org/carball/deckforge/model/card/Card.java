package org.carball.deckforge.model.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.deckforge.ontology.TypeLines;

import java.util.List;

/**
 * Card attributes as returned by a card lookup. Treated as immutable once loaded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Card {
    private int id;
    private String name;
    private String typeLine;
    private String manaCost;
    private double cmc;
    private List<String> colors;
    private String rarity;
    private String oracleText;
    private String imageUri;
    private String setCode;

    public List<String> getColors() {
        return colors == null ? List.of() : colors;
    }

    public String getTypeLine() {
        return typeLine == null ? "" : typeLine;
    }

    @JsonIgnore
    public boolean hasOracleText() {
        return oracleText != null && !oracleText.isEmpty();
    }

    @JsonIgnore
    public boolean isLand() {
        return TypeLines.containsType(getTypeLine(), "Land");
    }

    @JsonIgnore
    public boolean isCreature() {
        return TypeLines.containsType(getTypeLine(), "Creature");
    }

    @JsonIgnore
    public boolean isColorless() {
        return getColors().isEmpty();
    }

    /**
     * CMC truncated to a whole number, used for curve buckets.
     */
    @JsonIgnore
    public int getWholeCmc() {
        return (int) cmc;
    }
}
