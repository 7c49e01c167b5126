package org.carball.deckforge.model.synergy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A named multi-card synergy chain, e.g. token makers + sacrifice outlets + death payoffs.
 */
@Data
@NoArgsConstructor
public class SynergyPackage {
    private String name;
    private String description;
    private List<PackageRole> roles = new ArrayList<>();

    @JsonProperty("min_roles")
    private int minRoles;

    public long requiredRoleCount() {
        return roles.stream().filter(PackageRole::isRequired).count();
    }
}
