package tech.warden.iam.resource.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.warden.iam.resource.Resource;
import tech.warden.iam.resource.entity.ResourceEntity;
import tech.warden.iam.resource.mapper.ResourceMapper;
import tech.warden.iam.shared.EntityType;
import tech.warden.iam.shared.TsidGenerator;

/**
 * Write-side repository for Resource entities.
 */
@ApplicationScoped
public class ResourceWriteRepository implements PanacheRepositoryBase<ResourceEntity, String> {

    public void persistResource(Resource resource, String parentId) {
        persist(ResourceMapper.toEntity(resource, TsidGenerator.generate(EntityType.RESOURCE), parentId));
    }

    public void updateParent(ResourceEntity entity, String parentId) {
        entity.parentId = parentId;
    }

    public void deleteResource(ResourceEntity entity) {
        delete(entity);
    }
}
