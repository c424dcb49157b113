package tech.warden.iam.managedgroup.operations.deletemanagedgroup;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.managedgroup.ManagedGroupService;
import tech.warden.iam.subject.GroupName;

import java.util.Optional;
import java.util.Set;

/**
 * Use case for deleting a managed group. Requires {@code delete} on the
 * managed-group resource.
 */
@ApplicationScoped
public class DeleteManagedGroupUseCase implements UseCase<DeleteManagedGroupCommand, GroupName> {

    static final String DELETE = "delete";

    @Inject
    ManagedGroupService managedGroupService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(DeleteManagedGroupCommand command, RequestContext context) {
        return accessGuard.requireAction(
            ManagedGroupService.resourceOf(command.groupName()), Set.of(DELETE), context);
    }

    @Override
    public Result<GroupName> doExecute(DeleteManagedGroupCommand command, RequestContext context) {
        managedGroupService.deleteManagedGroup(command.groupName(), context);
        return Result.success(command.groupName());
    }
}
