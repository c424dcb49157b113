package tech.warden.iam.resource.operations.createresource;

import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;

import java.util.Set;

/**
 * Command to create a resource owned by the caller.
 *
 * @param resourceTypeName Registered resource type
 * @param resourceId       Id unique within the type
 * @param authDomain       Groups a subject must belong to for constrainable actions
 * @param parent           Optional parent resource
 */
public record CreateResourceCommand(
    String resourceTypeName,
    String resourceId,
    Set<GroupName> authDomain,
    FullyQualifiedResourceId parent
) {}
