package tech.warden.iam.subject;

/**
 * Subjects that can hold members: plain groups and access policies.
 */
public sealed interface GroupIdentity extends Subject permits GroupName, PolicyId {
}
