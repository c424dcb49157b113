package tech.warden.iam.policy.operations.overwritepolicy;

import tech.warden.iam.policy.AccessPolicyMembership;
import tech.warden.iam.subject.PolicyId;

/**
 * Command to create or replace a policy on a resource.
 *
 * @param policyId   Policy to write
 * @param membership Members and grants the policy should hold afterwards
 */
public record OverwritePolicyCommand(
    PolicyId policyId,
    AccessPolicyMembership membership
) {}
