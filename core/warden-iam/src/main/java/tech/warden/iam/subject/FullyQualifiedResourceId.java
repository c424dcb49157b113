package tech.warden.iam.subject;

import java.util.Objects;

/**
 * A resource id is only unique within its resource type.
 */
public record FullyQualifiedResourceId(String resourceTypeName, String resourceId) {

    public FullyQualifiedResourceId {
        Objects.requireNonNull(resourceTypeName, "resource type cannot be null");
        Objects.requireNonNull(resourceId, "resource id cannot be null");
    }

    @Override
    public String toString() {
        return resourceTypeName + "/" + resourceId;
    }
}
