package tech.warden.iam.managedgroup.operations.removemanagedgroupmember;

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
 * Use case for removing a subject from a managed group policy. Requires {@code alter_policies}
 * on the managed-group resource.
 *
 * <p>Succeeds with {@code false} when the subject was not a member.
 */
@ApplicationScoped
public class RemoveManagedGroupMemberUseCase implements UseCase<RemoveManagedGroupMemberCommand, Boolean> {

    static final String ALTER_POLICIES = "alter_policies";

    @Inject
    ManagedGroupService managedGroupService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(RemoveManagedGroupMemberCommand command, RequestContext context) {
        return accessGuard.requireAction(
            ManagedGroupService.resourceOf(command.groupName()), Set.of(ALTER_POLICIES), context);
    }

    @Override
    public Result<Boolean> doExecute(RemoveManagedGroupMemberCommand command, RequestContext context) {
        boolean changed = managedGroupService.removeManagedGroupMember(
            command.groupName(), command.policyName(), command.member(), context);
        return Result.success(changed);
    }
}
