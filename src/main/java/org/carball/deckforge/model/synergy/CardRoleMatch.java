package org.carball.deckforge.model.synergy;

public record CardRoleMatch(String packageName, String roleName, String roleDisplay, boolean required) {
}
