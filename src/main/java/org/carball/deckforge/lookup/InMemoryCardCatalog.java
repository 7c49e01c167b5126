package org.carball.deckforge.lookup;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.model.card.Card;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Card catalog held in memory, keyed by id. Serves both single-card and per-set lookups.
 */
@Slf4j
public class InMemoryCardCatalog implements CardLookup, SetCardsLookup {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Integer, Card> cardsById = new LinkedHashMap<>();

    public InMemoryCardCatalog(Collection<Card> cards) {
        for (Card card : cards) {
            cardsById.put(card.getId(), card);
        }
    }

    /**
     * Loads a JSON array of cards.
     *
     * @throws UncheckedIOException when the file cannot be read or parsed
     */
    public static InMemoryCardCatalog fromJson(Path path) {
        try {
            List<Card> cards = MAPPER.readValue(Files.readAllBytes(path), new TypeReference<List<Card>>() {});
            log.info("Loaded {} cards from {}", cards.size(), path);
            return new InMemoryCardCatalog(cards);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read card file " + path, e);
        }
    }

    @Override
    public Optional<Card> findCard(int cardId) {
        return Optional.ofNullable(cardsById.get(cardId));
    }

    @Override
    public List<Card> getCardsBySet(String setCode) {
        return cardsById.values().stream()
                .filter(card -> setCode != null && setCode.equalsIgnoreCase(card.getSetCode()))
                .collect(Collectors.toList());
    }

    public List<Card> allCards() {
        return new ArrayList<>(cardsById.values());
    }

    public List<Integer> allCardIds() {
        return new ArrayList<>(cardsById.keySet());
    }

    /** Distinct set codes in load order. */
    public List<String> setCodes() {
        return cardsById.values().stream()
                .map(Card::getSetCode)
                .filter(code -> code != null && !code.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    public int size() {
        return cardsById.size();
    }
}
