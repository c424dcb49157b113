package tech.warden.iam.managedgroup.operations.addmanagedgroupmember;

import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.Subject;

/**
 * Command to add a subject to one of a managed group's policies.
 *
 * @param groupName  Managed group
 * @param policyName {@code admin} or {@code member}
 * @param member     Subject to add
 */
public record AddManagedGroupMemberCommand(
    GroupName groupName,
    String policyName,
    Subject member
) {}
