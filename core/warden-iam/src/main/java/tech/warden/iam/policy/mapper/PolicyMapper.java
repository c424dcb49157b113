package tech.warden.iam.policy.mapper;

import tech.warden.iam.policy.AccessPolicyDescendantPermissions;
import tech.warden.iam.policy.PolicyGrants;
import tech.warden.iam.policy.entity.PolicyDescendantPermissionEntity;
import tech.warden.iam.policy.entity.PolicyEntity;
import tech.warden.iam.subject.PolicyId;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mapper for converting between policy grants and their JPA entities.
 */
public final class PolicyMapper {

    private PolicyMapper() {
    }

    public static PolicyGrants toDomain(PolicyId id, PolicyEntity entity,
                                        List<PolicyDescendantPermissionEntity> descendants) {
        if (entity == null) {
            return null;
        }

        Set<AccessPolicyDescendantPermissions> descendantPermissions = descendants.stream()
            .map(d -> new AccessPolicyDescendantPermissions(d.resourceType, toSet(d.roles), toSet(d.actions)))
            .collect(Collectors.toSet());
        return new PolicyGrants(id, toSet(entity.roles), toSet(entity.actions), descendantPermissions, entity.isPublic);
    }

    public static PolicyEntity toEntity(PolicyGrants domain, String groupId) {
        PolicyEntity entity = new PolicyEntity();
        entity.groupId = groupId;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(PolicyEntity entity, PolicyGrants domain) {
        entity.roles = domain.roles().toArray(new String[0]);
        entity.actions = domain.actions().toArray(new String[0]);
        entity.isPublic = domain.isPublic();
    }

    public static List<PolicyDescendantPermissionEntity> toDescendantEntities(PolicyGrants domain, String groupId) {
        return domain.descendantPermissions().stream()
            .map(d -> {
                PolicyDescendantPermissionEntity entity = new PolicyDescendantPermissionEntity();
                entity.policyId = groupId;
                entity.resourceType = d.resourceType();
                entity.roles = d.roles().toArray(new String[0]);
                entity.actions = d.actions().toArray(new String[0]);
                return entity;
            })
            .toList();
    }

    private static Set<String> toSet(String[] values) {
        return values != null ? new HashSet<>(Arrays.asList(values)) : new HashSet<>();
    }
}
