package tech.warden.iam.subject;

import java.util.Objects;

/**
 * An access policy is identified by its resource and a name unique within that resource.
 */
public record PolicyId(FullyQualifiedResourceId resource, String policyName) implements GroupIdentity {

    static final String KEY_PREFIX = "policy:";

    public PolicyId {
        Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(policyName, "policy name cannot be null");
    }

    public static PolicyId of(String resourceTypeName, String resourceId, String policyName) {
        return new PolicyId(new FullyQualifiedResourceId(resourceTypeName, resourceId), policyName);
    }

    @Override
    public String key() {
        return KEY_PREFIX + resource.resourceTypeName() + "/" + resource.resourceId() + "/" + policyName;
    }

    static PolicyId parseKeyBody(String body) {
        int first = body.indexOf('/');
        int last = body.lastIndexOf('/');
        if (first < 0 || first == last) {
            throw new IllegalArgumentException("Invalid policy key: " + body);
        }
        return of(body.substring(0, first), body.substring(first + 1, last), body.substring(last + 1));
    }

    @Override
    public String toString() {
        return resource + "/" + policyName;
    }
}
