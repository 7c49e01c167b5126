package org.carball.deckforge.ontology;

import org.carball.deckforge.model.synergy.SynergyPackage;

import java.util.List;
import java.util.Optional;

/**
 * Known multi-card synergy chains, in evaluation order.
 */
public final class SynergyPackageRegistry {

    public static final String RESOURCE = "/registry/synergy-packages.yaml";

    private final List<SynergyPackage> packages;

    public SynergyPackageRegistry(List<SynergyPackage> packages) {
        this.packages = List.copyOf(packages);
    }

    public static SynergyPackageRegistry defaults() {
        return Holder.INSTANCE;
    }

    public List<SynergyPackage> packages() {
        return packages;
    }

    public Optional<SynergyPackage> find(String name) {
        return packages.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    private static final class Holder {
        private static final SynergyPackageRegistry INSTANCE =
                new SynergyPackageRegistry(RegistryLoader.loadList(RESOURCE, SynergyPackage.class));
    }
}
