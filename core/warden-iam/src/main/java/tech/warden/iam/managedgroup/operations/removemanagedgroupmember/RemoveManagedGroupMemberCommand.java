package tech.warden.iam.managedgroup.operations.removemanagedgroupmember;

import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.Subject;

/**
 * Command to remove a subject from one of a managed group's policies.
 *
 * @param groupName  Managed group
 * @param policyName {@code admin} or {@code member}
 * @param member     Subject to remove
 */
public record RemoveManagedGroupMemberCommand(
    GroupName groupName,
    String policyName,
    Subject member
) {}
