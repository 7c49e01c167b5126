package org.carball.deckforge.model.synergy;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class PackageAnalysis {
    private SynergyPackage synergyPackage;
    /** Role name to number of cards filling it. */
    private Map<String, Integer> filledRoles = new LinkedHashMap<>();
    /** Display names of required roles with no card. */
    private List<String> missingRoles = new ArrayList<>();
    private double completeness;
    private boolean active;

    public int filledCount(String roleName) {
        return filledRoles.getOrDefault(roleName, 0);
    }

    public String getPackageName() {
        return synergyPackage.getName();
    }
}
