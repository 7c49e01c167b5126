package org.carball.deckforge.model.deck;

import lombok.Builder;
import lombok.Data;
import org.carball.deckforge.model.card.Card;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The deck a recommendation request is made against, with the card metadata needed to analyze it.
 */
@Data
@Builder(toBuilder = true)
public class DeckContext {

    public static final String LIMITED_FORMAT = "Limited";

    private String deckId;

    @Builder.Default
    private List<DeckCard> cards = new ArrayList<>();

    @Builder.Default
    private Map<Integer, Card> cardMetadata = new HashMap<>();

    /** Cards available in the current draft; null for constructed decks. */
    private List<Integer> draftCardIds;

    private String format;
    private String setCode;
    private String draftFormat;

    public boolean containsCard(int cardId) {
        return cards.stream().anyMatch(c -> c.cardId() == cardId);
    }

    public boolean isLimited() {
        return LIMITED_FORMAT.equals(format);
    }
}
