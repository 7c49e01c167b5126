package org.carball.deckforge.lookup;

import java.util.List;

@FunctionalInterface
public interface StandardSetsLookup {

    List<String> getStandardSets();
}
