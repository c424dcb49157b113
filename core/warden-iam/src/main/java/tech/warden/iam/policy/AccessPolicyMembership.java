package tech.warden.iam.policy;

import tech.warden.iam.subject.Subject;

import java.util.Set;

/**
 * Requested content of a policy, used to create or overwrite it.
 */
public record AccessPolicyMembership(
    Set<Subject> members,
    Set<String> roles,
    Set<String> actions,
    Set<AccessPolicyDescendantPermissions> descendantPermissions,
    boolean isPublic
) {

    public AccessPolicyMembership {
        members = members == null ? Set.of() : Set.copyOf(members);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        descendantPermissions = descendantPermissions == null ? Set.of() : Set.copyOf(descendantPermissions);
    }

    public static AccessPolicyMembership ofRoles(Set<Subject> members, Set<String> roles) {
        return new AccessPolicyMembership(members, roles, Set.of(), Set.of(), false);
    }
}
