package org.carball.deckforge.lookup;

import java.util.Map;

@FunctionalInterface
public interface CollectionLookup {

    /** Card id to owned copy count. Cards not owned may be absent. */
    Map<Integer, Integer> getCollectionCounts();
}
