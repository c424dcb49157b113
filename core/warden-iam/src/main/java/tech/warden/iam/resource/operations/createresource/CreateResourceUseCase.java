package tech.warden.iam.resource.operations.createresource;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.resource.Resource;
import tech.warden.iam.resource.ResourceService;
import tech.warden.iam.subject.GroupName;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Use case for creating a resource. Attaching it under a parent needs
 * {@code add_child} on that parent.
 */
@ApplicationScoped
public class CreateResourceUseCase implements UseCase<CreateResourceCommand, Resource> {

    static final String ADD_CHILD = "add_child";

    @Inject
    ResourceService resourceService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(CreateResourceCommand command, RequestContext context) {
        if (command.parent() == null) {
            return Optional.empty();
        }
        return accessGuard.requireAction(command.parent(), Set.of(ADD_CHILD), context);
    }

    @Override
    public Result<Resource> doExecute(CreateResourceCommand command, RequestContext context) {
        if (command.resourceId() == null || command.resourceId().isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                "RESOURCE_ID_REQUIRED",
                "Resource id is required",
                Map.of("resourceType", String.valueOf(command.resourceTypeName()))
            ));
        }

        Set<GroupName> authDomain =
            command.authDomain() == null ? Set.of() : command.authDomain();

        Resource created = resourceService.createResource(
            command.resourceTypeName(),
            command.resourceId(),
            authDomain,
            command.parent(),
            context.caller(),
            context
        );
        return Result.success(created);
    }
}
