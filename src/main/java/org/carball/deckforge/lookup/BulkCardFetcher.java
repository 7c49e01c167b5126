package org.carball.deckforge.lookup;

import lombok.extern.slf4j.Slf4j;
import org.carball.deckforge.model.card.Card;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Resolves many card ids in parallel. Best effort: ids that are missing or whose lookup throws
 * are dropped from the result instead of failing the batch.
 */
@Slf4j
public class BulkCardFetcher implements AutoCloseable {

    public static final int DEFAULT_THREADS = 8;

    private final CardLookup cardLookup;
    private final ExecutorService executor;

    public BulkCardFetcher(CardLookup cardLookup) {
        this(cardLookup, DEFAULT_THREADS);
    }

    public BulkCardFetcher(CardLookup cardLookup, int threads) {
        this.cardLookup = cardLookup;
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads));
    }

    /**
     * Fetches every id concurrently. Result order follows completion and is not guaranteed.
     */
    public List<Card> fetchAll(Collection<Integer> cardIds) {
        List<Card> results = Collections.synchronizedList(new ArrayList<>());

        List<CompletableFuture<Void>> futures = cardIds.stream()
                .map(id -> CompletableFuture.runAsync(() -> fetchOne(id).ifPresent(results::add), executor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        log.debug("Fetched {} of {} cards", results.size(), cardIds.size());
        synchronized (results) {
            return new ArrayList<>(results);
        }
    }

    /**
     * Like {@link #fetchAll(Collection)} but keeps the input order of the ids that resolved.
     */
    public List<Card> fetchAllOrdered(List<Integer> cardIds) {
        List<CompletableFuture<Optional<Card>>> futures = cardIds.stream()
                .map(id -> CompletableFuture.supplyAsync(() -> fetchOne(id), executor))
                .collect(Collectors.toList());

        List<Card> results = futures.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        log.debug("Fetched {} of {} cards in order", results.size(), cardIds.size());
        return results;
    }

    private Optional<Card> fetchOne(Integer cardId) {
        try {
            return cardLookup.findCard(cardId);
        } catch (RuntimeException e) {
            log.debug("Dropping card {}: {}", cardId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
