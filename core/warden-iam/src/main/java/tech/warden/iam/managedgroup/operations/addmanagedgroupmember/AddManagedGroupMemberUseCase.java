package tech.warden.iam.managedgroup.operations.addmanagedgroupmember;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.managedgroup.ManagedGroupService;

import java.util.Optional;
import java.util.Set;

/**
 * Use case for adding a subject to a managed group's admin or member policy.
 */
@ApplicationScoped
public class AddManagedGroupMemberUseCase implements UseCase<AddManagedGroupMemberCommand, Boolean> {

    static final String ALTER_POLICIES = "alter_policies";

    @Inject
    ManagedGroupService managedGroupService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(AddManagedGroupMemberCommand command, RequestContext context) {
        return accessGuard.requireAction(
            ManagedGroupService.resourceOf(command.groupName()), Set.of(ALTER_POLICIES), context);
    }

    @Override
    public Result<Boolean> doExecute(AddManagedGroupMemberCommand command, RequestContext context) {
        boolean changed = managedGroupService.addManagedGroupMember(
            command.groupName(), command.policyName(), command.member(), context);
        return Result.success(changed);
    }
}
