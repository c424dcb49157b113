package tech.warden.iam.resource;

import java.util.Map;
import java.util.Set;

/**
 * A named bundle of actions on one resource type.
 *
 * @param descendantRoles roles this role also grants on descendant resources,
 *                        keyed by the descendant's type name
 */
public record ResourceRole(String roleName, Set<String> actions, Map<String, Set<String>> descendantRoles) {

    public ResourceRole {
        actions = Set.copyOf(actions);
        descendantRoles = descendantRoles == null ? Map.of() : Map.copyOf(descendantRoles);
    }

    public ResourceRole(String roleName, Set<String> actions) {
        this(roleName, actions, Map.of());
    }

    public Set<String> descendantRolesFor(String resourceTypeName) {
        return descendantRoles.getOrDefault(resourceTypeName, Set.of());
    }
}
