package tech.warden.iam.policy;

import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.Subject;

import java.util.HashSet;
import java.util.Set;

/**
 * A named, resource-scoped group that carries grants.
 *
 * <p>Granted actions are {@code actions} plus the actions of {@code roles}, expanded
 * against the resource type at evaluation time.
 */
public class AccessPolicy {

    public PolicyId id;

    public Set<Subject> members = new HashSet<>();

    public String email;

    public Set<String> roles = new HashSet<>();

    public Set<String> actions = new HashSet<>();

    public Set<AccessPolicyDescendantPermissions> descendantPermissions = new HashSet<>();

    public boolean isPublic;

    public int version;

    public Integer lastSynchronizedVersion;

    public AccessPolicy() {
    }
}
