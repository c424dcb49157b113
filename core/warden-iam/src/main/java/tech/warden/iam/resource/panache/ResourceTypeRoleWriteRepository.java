package tech.warden.iam.resource.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.warden.iam.resource.entity.ResourceTypeRoleEntity;
import tech.warden.iam.resource.entity.ResourceTypeRoleEntity.ResourceTypeRoleId;

/**
 * Write-side repository for resource type roles.
 */
@ApplicationScoped
public class ResourceTypeRoleWriteRepository implements PanacheRepositoryBase<ResourceTypeRoleEntity, ResourceTypeRoleId> {

    public long deleteByResourceType(String resourceType) {
        long deleted = delete("resourceType", resourceType);
        // bulk delete bypasses the persistence context; make re-persisted keys safe
        getEntityManager().flush();
        getEntityManager().clear();
        return deleted;
    }
}
