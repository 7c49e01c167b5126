package org.carball.deckforge.ontology;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.deckforge.model.archetype.Archetype;
import org.carball.deckforge.model.archetype.ArchetypeSignal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Detection signals per archetype. Archetypes without an entry have no signals and never classify.
 */
public final class ArchetypeSignalRegistry {

    public static final String RESOURCE = "/registry/archetype-signals.yaml";

    private final Map<Archetype, List<ArchetypeSignal>> signals;

    public ArchetypeSignalRegistry(List<SignalSet> entries) {
        Map<Archetype, List<ArchetypeSignal>> byArchetype = new EnumMap<>(Archetype.class);
        for (SignalSet entry : entries) {
            byArchetype.put(entry.getArchetype(), List.copyOf(entry.getSignals()));
        }
        this.signals = Collections.unmodifiableMap(byArchetype);
    }

    public static ArchetypeSignalRegistry defaults() {
        return Holder.INSTANCE;
    }

    public List<ArchetypeSignal> signalsFor(Archetype archetype) {
        return signals.getOrDefault(archetype, List.of());
    }

    /** File form of one archetype's signal list. */
    @Data
    @NoArgsConstructor
    public static class SignalSet {
        private Archetype archetype;
        private List<ArchetypeSignal> signals = new ArrayList<>();
    }

    private static final class Holder {
        private static final ArchetypeSignalRegistry INSTANCE =
                new ArchetypeSignalRegistry(RegistryLoader.loadList(RESOURCE, SignalSet.class));
    }
}
