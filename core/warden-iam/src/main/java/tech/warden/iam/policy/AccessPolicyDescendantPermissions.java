package tech.warden.iam.policy;

import java.util.Set;

/**
 * Roles and actions a policy grants on every descendant of its resource that has
 * the given type.
 */
public record AccessPolicyDescendantPermissions(String resourceType, Set<String> roles, Set<String> actions) {

    public AccessPolicyDescendantPermissions {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        actions = actions == null ? Set.of() : Set.copyOf(actions);
    }
}
