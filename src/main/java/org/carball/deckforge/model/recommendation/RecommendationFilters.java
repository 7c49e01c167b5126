package org.carball.deckforge.model.recommendation;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class RecommendationFilters {

    public static final int DEFAULT_MAX_RESULTS = 10;
    public static final double DEFAULT_MIN_SCORE = 0.3;

    @Builder.Default
    private int maxResults = DEFAULT_MAX_RESULTS;

    @Builder.Default
    private double minScore = DEFAULT_MIN_SCORE;

    /** Any overlap passes; colorless cards always pass. Empty means no restriction. */
    @Builder.Default
    private List<String> colors = new ArrayList<>();

    /** Case-insensitive type-line substrings. Empty means no restriction. */
    @Builder.Default
    private List<String> cardTypes = new ArrayList<>();

    private CmcRange cmcRange;

    @Builder.Default
    private boolean includeLands = true;

    private boolean onlyDraftPool;

    @Builder.Default
    private List<Integer> draftPool = new ArrayList<>();

    public static RecommendationFilters defaults() {
        return RecommendationFilters.builder().build();
    }
}
