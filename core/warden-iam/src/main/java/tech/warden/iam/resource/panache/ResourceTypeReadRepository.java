package tech.warden.iam.resource.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.warden.iam.resource.ResourceType;
import tech.warden.iam.resource.ResourceTypeRepository;
import tech.warden.iam.resource.entity.ResourceTypeEntity;
import tech.warden.iam.resource.entity.ResourceTypeRoleEntity;
import tech.warden.iam.resource.mapper.ResourceTypeMapper;

import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for resource types.
 */
@ApplicationScoped
public class ResourceTypeReadRepository implements ResourceTypeRepository {

    @Inject
    EntityManager em;

    @Inject
    ResourceTypeWriteRepository writeRepo;

    @Override
    public Optional<ResourceType> findByName(String name) {
        return Optional.ofNullable(em.find(ResourceTypeEntity.class, name))
            .map(entity -> ResourceTypeMapper.toDomain(entity, rolesOf(name)));
    }

    @Override
    public List<ResourceType> findAll() {
        return em.createQuery("FROM ResourceTypeEntity ORDER BY name", ResourceTypeEntity.class)
            .getResultStream()
            .map(entity -> ResourceTypeMapper.toDomain(entity, rolesOf(entity.name)))
            .toList();
    }

    // Write operations delegate to WriteRepository
    @Override
    public void upsert(ResourceType type) {
        writeRepo.upsertType(type);
    }

    private List<ResourceTypeRoleEntity> rolesOf(String resourceType) {
        return em.createQuery("FROM ResourceTypeRoleEntity WHERE resourceType = :type", ResourceTypeRoleEntity.class)
            .setParameter("type", resourceType)
            .getResultList();
    }
}
