package tech.warden.iam.policy;

import tech.warden.iam.subject.PolicyId;

import java.util.Set;

/**
 * The stored grant side of a policy. Members, email and version belong to the
 * policy's group record.
 */
public record PolicyGrants(
    PolicyId id,
    Set<String> roles,
    Set<String> actions,
    Set<AccessPolicyDescendantPermissions> descendantPermissions,
    boolean isPublic
) {

    public PolicyGrants {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        descendantPermissions = descendantPermissions == null ? Set.of() : Set.copyOf(descendantPermissions);
    }

    public PolicyGrants withPublic(boolean value) {
        return new PolicyGrants(id, roles, actions, descendantPermissions, value);
    }
}
