package tech.warden.iam.resource;

import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A protected resource. Resources form a forest through {@code parent}.
 */
public class Resource {

    public String resourceTypeName;

    public String resourceId;

    /**
     * Groups a subject must all belong to for auth-domain-constrainable actions.
     */
    public Set<GroupName> authDomain = new HashSet<>();

    public FullyQualifiedResourceId parent;

    public Instant createdAt;

    public Resource() {
    }

    public Resource(String resourceTypeName, String resourceId) {
        this.resourceTypeName = resourceTypeName;
        this.resourceId = resourceId;
    }

    public FullyQualifiedResourceId fullyQualifiedId() {
        return new FullyQualifiedResourceId(resourceTypeName, resourceId);
    }
}
