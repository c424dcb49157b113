package tech.warden.iam.resource.operations.deleteparent;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.resource.ResourceService;

import java.util.Optional;
import java.util.Set;

/**
 * Use case for detaching a resource from its parent. Requires {@code set_parent}
 * on the child and {@code remove_child} on the current parent.
 *
 * <p>Succeeds with {@code false} when the resource had no parent.
 */
@ApplicationScoped
public class DeleteParentUseCase implements UseCase<DeleteParentCommand, Boolean> {

    static final String SET_PARENT = "set_parent";
    static final String REMOVE_CHILD = "remove_child";

    @Inject
    ResourceService resourceService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(DeleteParentCommand command, RequestContext context) {
        Optional<UseCaseError> onChild = accessGuard.requireAction(command.child(), Set.of(SET_PARENT), context);
        if (onChild.isPresent()) {
            return onChild;
        }
        return accessGuard.requireParentAction(command.child(), null, Set.of(REMOVE_CHILD), context);
    }

    @Override
    public Result<Boolean> doExecute(DeleteParentCommand command, RequestContext context) {
        return Result.success(resourceService.deleteParent(command.child(), context));
    }
}
