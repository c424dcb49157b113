package tech.warden.iam.policy.operations.overwritepolicy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.UseCase;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.evaluation.AccessGuard;
import tech.warden.iam.policy.AccessPolicy;
import tech.warden.iam.policy.PolicyService;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Use case for creating or overwriting a policy. Requires {@code alter_policies}
 * on the policy's resource.
 */
@ApplicationScoped
public class OverwritePolicyUseCase implements UseCase<OverwritePolicyCommand, AccessPolicy> {

    static final String ALTER_POLICIES = "alter_policies";

    @Inject
    PolicyService policyService;

    @Inject
    AccessGuard accessGuard;

    @Override
    public Optional<UseCaseError> authorizeResource(OverwritePolicyCommand command, RequestContext context) {
        return accessGuard.requireAction(command.policyId().resource(), Set.of(ALTER_POLICIES), context);
    }

    @Override
    public Result<AccessPolicy> doExecute(OverwritePolicyCommand command, RequestContext context) {
        if (command.membership() == null) {
            return Result.failure(new UseCaseError.ValidationError(
                "MEMBERSHIP_REQUIRED",
                "Policy membership is required",
                Map.of("policy", command.policyId().key())
            ));
        }
        return Result.success(policyService.overwritePolicy(command.policyId(), command.membership(), context));
    }
}
