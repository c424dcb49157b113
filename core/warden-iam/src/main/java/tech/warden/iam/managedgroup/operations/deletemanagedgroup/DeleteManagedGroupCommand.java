package tech.warden.iam.managedgroup.operations.deletemanagedgroup;

import tech.warden.iam.subject.GroupName;

/**
 * Command to delete a managed group, its resource and policies.
 *
 * @param groupName Managed group to delete
 */
public record DeleteManagedGroupCommand(GroupName groupName) {}
