package tech.warden.iam.policy.operations.deletepolicy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.policy.PolicyService;
import tech.warden.iam.subject.PolicyId;

import java.util.Optional;
import java.util.Set;

/**
 * Use case for deleting a policy. Requires {@code alter_policies} on its resource.
 */
@ApplicationScoped
public class DeletePolicyUseCase implements UseCase<DeletePolicyCommand, PolicyId> {

    static final String ALTER_POLICIES = "alter_policies";

    @Inject
    PolicyService policyService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(DeletePolicyCommand command, RequestContext context) {
        return accessGuard.requireAction(command.policyId().resource(), Set.of(ALTER_POLICIES), context);
    }

    @Override
    public Result<PolicyId> doExecute(DeletePolicyCommand command, RequestContext context) {
        policyService.deletePolicy(command.policyId(), context);
        return Result.success(command.policyId());
    }
}
