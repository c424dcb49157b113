package tech.warden.iam.resource.mapper;

import tech.warden.iam.resource.Resource;
import tech.warden.iam.resource.entity.ResourceEntity;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;

import java.util.Arrays;
import java.util.HashSet;
import java.util.stream.Collectors;

/**
 * Mapper for converting between Resource domain model and JPA entity.
 * The parent is stored as a row id, so callers resolve it on both sides.
 */
public final class ResourceMapper {

    private ResourceMapper() {
    }

    public static Resource toDomain(ResourceEntity entity, FullyQualifiedResourceId parent) {
        if (entity == null) {
            return null;
        }

        Resource domain = new Resource(entity.resourceType, entity.resourceId);
        domain.authDomain = entity.authDomain != null
            ? Arrays.stream(entity.authDomain).map(GroupName::new).collect(Collectors.toCollection(HashSet::new))
            : new HashSet<>();
        domain.parent = parent;
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static ResourceEntity toEntity(Resource domain, String id, String parentId) {
        if (domain == null) {
            return null;
        }

        ResourceEntity entity = new ResourceEntity();
        entity.id = id;
        entity.resourceType = domain.resourceTypeName;
        entity.resourceId = domain.resourceId;
        entity.authDomain = domain.authDomain != null
            ? domain.authDomain.stream().map(GroupName::value).toArray(String[]::new)
            : new String[0];
        entity.parentId = parentId;
        entity.createdAt = domain.createdAt;
        return entity;
    }

    public static FullyQualifiedResourceId toId(ResourceEntity entity) {
        return new FullyQualifiedResourceId(entity.resourceType, entity.resourceId);
    }
}
