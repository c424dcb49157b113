package tech.warden.iam.evaluation;

import java.util.Set;

/**
 * One entry of a resource listing: what the subject holds on the resource.
 *
 * @param policies names of the policies on this resource that include the subject
 * @param isPublic whether any contributing policy is public
 */
public record FilteredResource(
    String resourceType,
    String resourceId,
    Set<String> policies,
    Set<String> roles,
    Set<String> actions,
    boolean isPublic
) {
}
