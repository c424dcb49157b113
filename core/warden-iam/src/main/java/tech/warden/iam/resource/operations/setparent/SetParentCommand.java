package tech.warden.iam.resource.operations.setparent;

import tech.warden.iam.subject.FullyQualifiedResourceId;

/**
 * Command to move a resource under a new parent.
 *
 * @param child  Resource being moved
 * @param parent New parent
 */
public record SetParentCommand(
    FullyQualifiedResourceId child,
    FullyQualifiedResourceId parent
) {}
