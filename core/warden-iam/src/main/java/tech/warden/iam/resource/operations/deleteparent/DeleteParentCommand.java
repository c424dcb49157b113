package tech.warden.iam.resource.operations.deleteparent;

import tech.warden.iam.subject.FullyQualifiedResourceId;

/**
 * Command to detach a resource from its parent.
 *
 * @param child Resource to detach
 */
public record DeleteParentCommand(FullyQualifiedResourceId child) {}
