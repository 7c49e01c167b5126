package org.carball.deckforge.builder;

import org.carball.deckforge.model.recommendation.ScoredCard;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-pass greedy selection. The first pass takes the best card for each CMC slot until the slot
 * reaches its ideal count; the second fills the remaining slots with the best untaken cards.
 */
public final class CurveSelector {

    private CurveSelector() {
    }

    /**
     * @param idealCurve ideal count per CMC; higher CMCs count toward {@code curveCap}
     */
    public static List<ScoredCard> select(List<ScoredCard> scored, int targetCount,
                                          Map<Integer, Integer> idealCurve, int curveCap) {
        List<ScoredCard> ranked = new ArrayList<>(scored);
        ranked.sort(Comparator.comparingDouble(ScoredCard::getScore).reversed());

        List<ScoredCard> selected = new ArrayList<>();
        Set<Integer> used = new HashSet<>();
        Map<Integer, Integer> slots = new HashMap<>();

        for (ScoredCard candidate : ranked) {
            if (selected.size() >= targetCount) {
                break;
            }
            if (used.contains(candidate.getCardId())) {
                continue;
            }
            int cmc = Math.min(candidate.getCard().getWholeCmc(), curveCap);
            int filled = slots.getOrDefault(cmc, 0);
            if (filled < idealCurve.getOrDefault(cmc, 0)) {
                selected.add(candidate);
                used.add(candidate.getCardId());
                slots.put(cmc, filled + 1);
            }
        }

        for (ScoredCard candidate : ranked) {
            if (selected.size() >= targetCount) {
                break;
            }
            if (used.add(candidate.getCardId())) {
                selected.add(candidate);
            }
        }
        return selected;
    }
}
