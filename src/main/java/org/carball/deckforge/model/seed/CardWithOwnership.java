package org.carball.deckforge.model.seed;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CardWithOwnership {
    private int cardId;
    private String name;
    private String manaCost;
    private int cmc;
    private List<String> colors;
    private String typeLine;
    private String rarity;
    private String imageUri;
    private double score;
    private String reasoning;
    private boolean inCollection;
    private int ownedCount;
    /** Copies still missing to reach a full playset. */
    private int neededCount;
    /** Only set by iterative suggestions. */
    private Integer recommendedCopies;
}
