package org.carball.deckforge.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.model.card.Card;
import org.carball.deckforge.model.deck.DeckCard;
import org.carball.deckforge.model.deck.DeckComposition;
import org.carball.deckforge.model.deck.DeckContext;
import org.carball.deckforge.ontology.ColorCombinations;
import org.carball.deckforge.ontology.KeywordOntology;
import org.carball.deckforge.ontology.TypeLines;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reduces a card list into color, curve, type, keyword and creature-type histograms.
 */
@Slf4j
public class DeckCompositionAnalyzer {

    private final int primaryColorCount;

    public DeckCompositionAnalyzer() {
        this(2);
    }

    public DeckCompositionAnalyzer(int primaryColorCount) {
        this.primaryColorCount = primaryColorCount;
    }

    public DeckComposition analyze(DeckContext context) {
        return analyze(context.getCards(), context.getCardMetadata());
    }

    /**
     * Only main-board entries count. Entries whose card metadata is unknown are skipped.
     */
    public DeckComposition analyze(List<DeckCard> cards, Map<Integer, Card> metadata) {
        DeckComposition composition = new DeckComposition();
        double totalCmc = 0.0;

        for (DeckCard deckCard : cards) {
            if (!deckCard.isMainboard()) {
                continue;
            }
            Card card = metadata.get(deckCard.cardId());
            if (card == null) {
                log.debug("No metadata for card {}, skipping", deckCard.cardId());
                continue;
            }
            int quantity = deckCard.quantity();
            composition.setTotalCards(composition.getTotalCards() + quantity);

            for (String type : TypeLines.extractTypes(card.getTypeLine())) {
                composition.getCardTypes().merge(type, quantity, Integer::sum);
            }

            if (!card.isLand()) {
                for (String color : card.getColors()) {
                    composition.getColors().merge(color, quantity, Integer::sum);
                }
                composition.getManaCurve().merge(card.getWholeCmc(), quantity, Integer::sum);
                totalCmc += card.getCmc() * quantity;
                composition.setTotalNonLands(composition.getTotalNonLands() + quantity);
            }

            if (card.hasOracleText()) {
                for (String keyword : KeywordOntology.extractKeywords(card.getOracleText())) {
                    composition.getKeywords().merge(keyword, quantity, Integer::sum);
                }
            }

            if (card.isCreature()) {
                for (String creatureType : TypeLines.extractCreatureTypes(card.getTypeLine())) {
                    composition.getCreatureTypes().merge(creatureType, quantity, Integer::sum);
                }
            }
        }

        if (composition.getTotalNonLands() > 0) {
            composition.setAverageCmc(totalCmc / composition.getTotalNonLands());
        }

        List<String> identity = ColorCombinations.inColorOrder(composition.getColors().entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList()));
        composition.setColorIdentity(identity);
        composition.setPrimaryColors(primaryColors(identity, composition.getColors()));
        return composition;
    }

    private List<String> primaryColors(List<String> identity, Map<String, Integer> colorCounts) {
        List<String> sorted = new ArrayList<>(identity);
        // stable: equal counts stay in WUBRG order
        sorted.sort(Comparator.comparing((String color) -> colorCounts.get(color)).reversed());
        return new ArrayList<>(sorted.subList(0, Math.min(primaryColorCount, sorted.size())));
    }
}
