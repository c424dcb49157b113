package tech.warden.iam.resource.operations.deleteresource;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.resource.ResourceService;
import tech.warden.iam.subject.FullyQualifiedResourceId;

import java.util.Optional;
import java.util.Set;

/**
 * Use case for deleting a resource. Requires {@code delete} on it.
 */
@ApplicationScoped
public class DeleteResourceUseCase implements UseCase<DeleteResourceCommand, FullyQualifiedResourceId> {

    static final String DELETE = "delete";

    @Inject
    ResourceService resourceService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(DeleteResourceCommand command, RequestContext context) {
        return accessGuard.requireAction(command.resource(), Set.of(DELETE), context);
    }

    @Override
    public Result<FullyQualifiedResourceId> doExecute(DeleteResourceCommand command, RequestContext context) {
        resourceService.deleteResource(command.resource(), context);
        return Result.success(command.resource());
    }
}
