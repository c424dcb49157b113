package tech.warden.iam.group.mapper;

import tech.warden.iam.group.Group;
import tech.warden.iam.group.entity.GroupEntity;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.Subject;

import java.util.HashSet;
import java.util.Set;

/**
 * Mapper for converting between Group domain model and JPA entity.
 */
public final class GroupMapper {

    private GroupMapper() {
    }

    public static GroupIdentity toIdentity(GroupEntity entity) {
        if (entity.kind == GroupEntity.Kind.POLICY) {
            return PolicyId.of(entity.policyResourceType, entity.policyResourceId, entity.policyName);
        }
        return new GroupName(entity.name);
    }

    public static Group toDomain(GroupEntity entity, Set<Subject> members) {
        if (entity == null) {
            return null;
        }

        Group domain = new Group();
        domain.identity = toIdentity(entity);
        domain.email = entity.email;
        domain.members = members != null ? new HashSet<>(members) : new HashSet<>();
        domain.version = entity.version;
        domain.lastSynchronizedVersion = entity.lastSynchronizedVersion;
        domain.synchronizedAt = entity.synchronizedAt;
        domain.accessInstructions = entity.accessInstructions;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static GroupEntity toEntity(Group domain, String id) {
        if (domain == null) {
            return null;
        }

        GroupEntity entity = new GroupEntity();
        entity.id = id;
        if (domain.identity instanceof PolicyId policy) {
            entity.kind = GroupEntity.Kind.POLICY;
            entity.policyResourceType = policy.resource().resourceTypeName();
            entity.policyResourceId = policy.resource().resourceId();
            entity.policyName = policy.policyName();
        } else {
            entity.kind = GroupEntity.Kind.GROUP;
            entity.name = ((GroupName) domain.identity).value();
        }
        entity.email = domain.email;
        entity.version = domain.version;
        entity.lastSynchronizedVersion = domain.lastSynchronizedVersion;
        entity.synchronizedAt = domain.synchronizedAt;
        entity.accessInstructions = domain.accessInstructions;
        entity.createdAt = domain.createdAt;
        entity.updatedAt = domain.updatedAt;
        return entity;
    }
}
