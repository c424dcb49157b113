package tech.warden.iam.resource.operations.deleteresource;

import tech.warden.iam.subject.FullyQualifiedResourceId;

/**
 * Command to delete a resource together with its policies.
 *
 * @param resource Resource to delete
 */
public record DeleteResourceCommand(FullyQualifiedResourceId resource) {}
