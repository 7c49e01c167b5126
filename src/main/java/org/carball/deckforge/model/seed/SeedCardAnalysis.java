package org.carball.deckforge.model.seed;

import lombok.Data;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.synergy.KeywordInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * What a build-around target brings: its colors, keywords, themes and creature types.
 * Built either from a single seed card or collectively from a whole deck.
 */
@Data
public class SeedCardAnalysis {
    /** Null when the analysis was built from a deck rather than one card. */
    private Card card;
    private List<String> colors = new ArrayList<>();
    private List<KeywordInfo> keywords = new ArrayList<>();
    private List<String> themes = new ArrayList<>();
    private List<String> cardTypes = new ArrayList<>();
    private int cmc;
    private boolean creature;
    private List<String> creatureTypes = new ArrayList<>();
}
