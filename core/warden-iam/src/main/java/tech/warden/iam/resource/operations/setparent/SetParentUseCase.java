package tech.warden.iam.resource.operations.setparent;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.resource.ResourceService;
import tech.warden.iam.subject.FullyQualifiedResourceId;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Use case for re-parenting a resource.
 *
 * <p>The caller needs {@code set_parent} on the child and {@code add_child} on
 * the new parent. Moving a resource under one of its own descendants fails with
 * an invalid graph error.
 */
@ApplicationScoped
public class SetParentUseCase implements UseCase<SetParentCommand, FullyQualifiedResourceId> {

    static final String SET_PARENT = "set_parent";
    static final String ADD_CHILD = "add_child";

    @Inject
    ResourceService resourceService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(SetParentCommand command, RequestContext context) {
        if (command.parent() == null) {
            return Optional.of(new UseCaseError.ValidationError(
                "PARENT_REQUIRED",
                "A new parent is required",
                Map.of("child", String.valueOf(command.child()))
            ));
        }
        Optional<UseCaseError> onChild = accessGuard.requireAction(command.child(), Set.of(SET_PARENT), context);
        if (onChild.isPresent()) {
            return onChild;
        }
        return accessGuard.requireParentAction(command.child(), command.parent(), Set.of(ADD_CHILD), context);
    }

    @Override
    public Result<FullyQualifiedResourceId> doExecute(SetParentCommand command, RequestContext context) {
        resourceService.setParent(command.child(), command.parent(), context);
        return Result.success(command.parent());
    }
}
