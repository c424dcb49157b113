package tech.warden.iam.resource.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.resource.ResourceRole;
import tech.warden.iam.resource.ResourceType;
import tech.warden.iam.resource.entity.ResourceTypeEntity;
import tech.warden.iam.resource.mapper.ResourceTypeMapper;

/**
 * Write-side repository for resource types. Roles are replaced wholesale on upsert.
 */
@ApplicationScoped
public class ResourceTypeWriteRepository implements PanacheRepositoryBase<ResourceTypeEntity, String> {

    @Inject
    ResourceTypeRoleWriteRepository roleWriteRepo;

    public void upsertType(ResourceType type) {
        ResourceTypeEntity entity = findById(type.name());
        if (entity == null) {
            persist(ResourceTypeMapper.toEntity(type));
        } else {
            ResourceTypeMapper.updateEntity(entity, type);
        }

        roleWriteRepo.deleteByResourceType(type.name());
        for (ResourceRole role : type.roles().values()) {
            roleWriteRepo.persist(ResourceTypeMapper.toRoleEntity(type.name(), role));
        }
    }
}
