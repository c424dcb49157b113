package tech.warden.iam.resource.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.warden.iam.resource.ActionPattern;
import tech.warden.iam.resource.ResourceRole;
import tech.warden.iam.resource.ResourceType;
import tech.warden.iam.resource.entity.ResourceTypeEntity;
import tech.warden.iam.resource.entity.ResourceTypeRoleEntity;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapper for converting between ResourceType and its JPA entities.
 */
public final class ResourceTypeMapper {

    private static final Logger LOG = Logger.getLogger(ResourceTypeMapper.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ResourceTypeMapper() {
    }

    public static ResourceType toDomain(ResourceTypeEntity entity, List<ResourceTypeRoleEntity> roleEntities) {
        if (entity == null) {
            return null;
        }

        Map<String, ResourceRole> roles = new HashMap<>();
        for (ResourceTypeRoleEntity roleEntity : roleEntities) {
            Set<String> actions = roleEntity.actions != null
                ? new HashSet<>(Arrays.asList(roleEntity.actions))
                : new HashSet<>();
            roles.put(roleEntity.roleName,
                new ResourceRole(roleEntity.roleName, actions, parseDescendantRoles(roleEntity.descendantRoles)));
        }
        return new ResourceType(entity.name, parseActionPatterns(entity.actionPatterns), roles,
            entity.ownerRoleName, entity.reuseIds);
    }

    public static ResourceTypeEntity toEntity(ResourceType domain) {
        ResourceTypeEntity entity = new ResourceTypeEntity();
        entity.name = domain.name();
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(ResourceTypeEntity entity, ResourceType domain) {
        entity.ownerRoleName = domain.ownerRoleName();
        entity.reuseIds = domain.reuseIds();
        entity.actionPatterns = toJson(domain.actionPatterns());
        entity.updatedAt = Instant.now();
    }

    public static ResourceTypeRoleEntity toRoleEntity(String resourceType, ResourceRole role) {
        ResourceTypeRoleEntity entity = new ResourceTypeRoleEntity();
        entity.resourceType = resourceType;
        entity.roleName = role.roleName();
        entity.actions = role.actions().toArray(new String[0]);
        entity.descendantRoles = toJson(role.descendantRoles());
        return entity;
    }

    // ========================================================================
    // JSON Utilities
    // ========================================================================

    private static Set<ActionPattern> parseActionPatterns(String json) {
        if (json == null || json.isBlank()) return Set.of();
        try {
            return new HashSet<>(objectMapper.readValue(json, new TypeReference<List<ActionPattern>>() {}));
        } catch (Exception e) {
            LOG.warnf("Failed to parse action patterns: %s", e.getMessage());
            return Set.of();
        }
    }

    private static Map<String, Set<String>> parseDescendantRoles(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Set<String>>>() {});
        } catch (Exception e) {
            LOG.warnf("Failed to parse descendant roles: %s", e.getMessage());
            return Map.of();
        }
    }

    private static String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize resource type definition", e);
        }
    }
}
