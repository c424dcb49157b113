package tech.warden.iam.managedgroup.operations.createmanagedgroup;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.group.Group;
import tech.warden.iam.managedgroup.ManagedGroupService;

import java.util.Optional;

/**
 * Use case for creating a managed group. Any authenticated caller may create
 * one and becomes its first admin.
 */
@ApplicationScoped
public class CreateManagedGroupUseCase implements UseCase<CreateManagedGroupCommand, Group> {

    @Inject
    ManagedGroupService managedGroupService;

    @Override
    public Optional<UseCaseError> authorizeResource(CreateManagedGroupCommand command, RequestContext context) {
        return Optional.empty();
    }

    @Override
    public Result<Group> doExecute(CreateManagedGroupCommand command, RequestContext context) {
        Group group = managedGroupService.createManagedGroup(
            command.groupName(), context.caller(), command.accessInstructions(), context);
        return Result.success(group);
    }
}
