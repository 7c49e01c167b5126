package org.carball.deckforge.analyzer;

import java.util.List;

/**
 * Turns scoring reasons into one display sentence.
 */
public final class ReasoningFormatter {

    public static final String DEFAULT_REASONING = "This card could work in your deck.";

    private ReasoningFormatter() {
    }

    /**
     * "This card a." / "This card a, and b." / "This card a, b, and c."
     */
    public static String sentence(List<String> reasons) {
        if (reasons.isEmpty()) {
            return DEFAULT_REASONING;
        }
        if (reasons.size() == 1) {
            return "This card " + reasons.get(0) + ".";
        }
        String head = String.join(", ", reasons.subList(0, reasons.size() - 1));
        return "This card " + head + ", and " + reasons.get(reasons.size() - 1) + ".";
    }

    /**
     * Comma-separated reasons, or the fallback when there are none.
     */
    public static String list(List<String> reasons, String fallback) {
        return reasons.isEmpty() ? fallback : String.join(", ", reasons);
    }
}
