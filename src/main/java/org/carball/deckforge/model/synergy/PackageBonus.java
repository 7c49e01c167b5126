package org.carball.deckforge.model.synergy;

import java.util.List;

/**
 * Bonus (capped at 0.5) a candidate earns for completing or reinforcing the deck's synergy packages.
 */
public record PackageBonus(double bonus, List<String> reasons) {
}
