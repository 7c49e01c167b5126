package org.carball.deckforge.model.deck;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestedCard {
    private int cardId;
    private String name;
    private String typeLine;
    private String manaCost;
    private String imageUri;
    private int cmc;
    private List<String> colors;
    private String rarity;
    private double score;
    private String reasoning;
}
