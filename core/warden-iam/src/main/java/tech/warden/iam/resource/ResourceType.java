package tech.warden.iam.resource;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration-defined kind of resource: its valid actions and its roles.
 * Immutable once loaded.
 *
 * @param ownerRoleName role granted to the creator of a new resource, or null
 * @param reuseIds      whether an id may be used again after its resource was deleted
 */
public record ResourceType(
    String name,
    Set<ActionPattern> actionPatterns,
    Map<String, ResourceRole> roles,
    String ownerRoleName,
    boolean reuseIds
) {

    public ResourceType {
        actionPatterns = Set.copyOf(actionPatterns);
        roles = Map.copyOf(roles);
    }

    public boolean isValidAction(String action) {
        return actionPatterns.stream().anyMatch(pattern -> pattern.matches(action));
    }

    public boolean isAuthDomainConstrainable(String action) {
        return actionPatterns.stream()
            .anyMatch(pattern -> pattern.authDomainConstrainable() && pattern.matches(action));
    }

    public Optional<ResourceRole> role(String roleName) {
        return Optional.ofNullable(roles.get(roleName));
    }

    public Optional<String> ownerRole() {
        return Optional.ofNullable(ownerRoleName);
    }

    /**
     * Actions of the named roles. Unknown role names contribute nothing.
     */
    public Set<String> actionsOf(Collection<String> roleNames) {
        Set<String> actions = new HashSet<>();
        for (String roleName : roleNames) {
            ResourceRole role = roles.get(roleName);
            if (role != null) {
                actions.addAll(role.actions());
            }
        }
        return actions;
    }

    /**
     * Roles granted on descendants of type {@code descendantType} by the named roles.
     */
    public Set<String> descendantRolesOf(Collection<String> roleNames, String descendantType) {
        Set<String> result = new HashSet<>();
        for (String roleName : roleNames) {
            ResourceRole role = roles.get(roleName);
            if (role != null) {
                result.addAll(role.descendantRolesFor(descendantType));
            }
        }
        return result;
    }
}
