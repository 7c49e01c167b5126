package org.carball.deckforge.model.deck;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestDecksResponse {
    private List<SuggestedDeck> suggestions = new ArrayList<>();
    private int totalCombos;
    private int viableCombos;
    private ColorCombination bestCombo;
    private String error;

    public static SuggestDecksResponse failed(String error) {
        SuggestDecksResponse response = new SuggestDecksResponse();
        response.setError(error);
        return response;
    }

    public boolean hasError() {
        return error != null;
    }
}
