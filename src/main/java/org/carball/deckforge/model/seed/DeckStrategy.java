package org.carball.deckforge.model.seed;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DeckStrategy {
    private String summary;
    private String gamePlan;
    private List<String> keyCards = new ArrayList<>();
    private String mulligan;
    private List<String> strengths = new ArrayList<>();
    private List<String> weaknesses = new ArrayList<>();
}
