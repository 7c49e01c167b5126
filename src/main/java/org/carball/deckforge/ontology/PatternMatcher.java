package org.carball.deckforge.ontology;

/**
 * Substring matching with a single {@code .*} wildcard.
 * <p>
 * A pattern without a wildcard is a plain substring test. A pattern with exactly one wildcard
 * matches when the prefix occurs and the suffix occurs somewhere after the first occurrence of
 * the prefix. Known limitation: a pattern with two or more wildcards only checks that its first
 * segment occurs; the remaining segments are ignored. Registry patterns rely on this behavior.
 */
public final class PatternMatcher {

    public static final String WILDCARD = ".*";

    private PatternMatcher() {
    }

    /**
     * Both arguments are expected in lowercase; no case folding happens here.
     */
    public static boolean containsPattern(String text, String pattern) {
        if (text == null || pattern == null) {
            return false;
        }
        if (!pattern.contains(WILDCARD)) {
            return text.contains(pattern);
        }

        String[] parts = pattern.split("\\.\\*", -1);
        if (parts.length != 2) {
            return text.contains(parts[0]);
        }

        int idx = text.indexOf(parts[0]);
        if (idx == -1) {
            return false;
        }
        return text.substring(idx + parts[0].length()).contains(parts[1]);
    }

    public static boolean containsAny(String text, Iterable<String> patterns) {
        for (String pattern : patterns) {
            if (containsPattern(text, pattern)) {
                return true;
            }
        }
        return false;
    }
}
