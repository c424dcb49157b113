package tech.warden.iam.policy.operations.deletepolicy;

import tech.warden.iam.subject.PolicyId;

/**
 * Command to delete a policy.
 *
 * @param policyId Policy to delete
 */
public record DeletePolicyCommand(PolicyId policyId) {}
