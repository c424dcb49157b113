package tech.warden.iam.managedgroup.operations.createmanagedgroup;

import tech.warden.iam.subject.GroupName;

/**
 * Command to create a managed group administered by the caller.
 *
 * @param groupName          Group name, also used as the managed-group resource id
 * @param accessInstructions Optional text shown to users asking for access
 */
public record CreateManagedGroupCommand(
    GroupName groupName,
    String accessInstructions
) {}
