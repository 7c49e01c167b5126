package org.carball.deckforge.model.card;

import java.util.Locale;

public enum Rarity {
    MYTHIC(0.85),
    RARE(0.75),
    UNCOMMON(0.60),
    COMMON(0.50);

    private final double fallbackQuality;

    Rarity(double fallbackQuality) {
        this.fallbackQuality = fallbackQuality;
    }

    /**
     * Quality score used when no rating is available. Unknown rarities score as common.
     */
    public static double fallbackQualityOf(String rarity) {
        if (rarity == null) {
            return COMMON.fallbackQuality;
        }
        try {
            return valueOf(rarity.trim().toUpperCase(Locale.ROOT)).fallbackQuality;
        } catch (IllegalArgumentException e) {
            return COMMON.fallbackQuality;
        }
    }
}
