package tech.warden.iam.resource.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.warden.iam.resource.Resource;
import tech.warden.iam.resource.ResourceRepository;
import tech.warden.iam.resource.entity.ResourceEntity;
import tech.warden.iam.resource.mapper.ResourceMapper;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;

import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Resource entities.
 * Uses EntityManager directly to return domain objects.
 */
@ApplicationScoped
public class ResourceReadRepository implements ResourceRepository {

    @Inject
    EntityManager em;

    @Inject
    ResourceWriteRepository writeRepo;

    @Override
    public Optional<Resource> findById(FullyQualifiedResourceId id) {
        return findEntity(id).map(entity -> ResourceMapper.toDomain(entity, parentOf(entity)));
    }

    @Override
    public boolean exists(FullyQualifiedResourceId id) {
        Long count = em.createQuery("SELECT COUNT(e) FROM ResourceEntity e"
                + " WHERE e.resourceType = :type AND e.resourceId = :resourceId", Long.class)
            .setParameter("type", id.resourceTypeName())
            .setParameter("resourceId", id.resourceId())
            .getSingleResult();
        return count > 0;
    }

    @Override
    public Optional<FullyQualifiedResourceId> findParent(FullyQualifiedResourceId id) {
        return findEntity(id).map(this::parentOf);
    }

    @Override
    public List<FullyQualifiedResourceId> findChildren(FullyQualifiedResourceId id) {
        return findEntity(id)
            .map(parent -> em.createQuery("FROM ResourceEntity WHERE parentId = :parentId ORDER BY id", ResourceEntity.class)
                .setParameter("parentId", parent.id)
                .getResultStream()
                .map(ResourceMapper::toId)
                .toList())
            .orElseGet(List::of);
    }

    @Override
    public List<FullyQualifiedResourceId> findByAuthDomainGroup(GroupName group) {
        @SuppressWarnings("unchecked")
        List<Object[]> rows = em.createNativeQuery(
                "SELECT resource_type, resource_id FROM iam_resources WHERE :group = ANY(auth_domain)")
            .setParameter("group", group.value())
            .getResultList();
        return rows.stream()
            .map(row -> new FullyQualifiedResourceId((String) row[0], (String) row[1]))
            .toList();
    }

    // Write operations delegate to WriteRepository

    @Override
    public void insert(Resource resource) {
        String parentId = resource.parent != null ? requireEntity(resource.parent).id : null;
        writeRepo.persistResource(resource, parentId);
    }

    @Override
    public void setParent(FullyQualifiedResourceId child, FullyQualifiedResourceId parent) {
        String parentId = parent != null ? requireEntity(parent).id : null;
        writeRepo.updateParent(requireEntity(child), parentId);
    }

    @Override
    public boolean delete(FullyQualifiedResourceId id) {
        Optional<ResourceEntity> entity = findEntity(id);
        entity.ifPresent(writeRepo::deleteResource);
        return entity.isPresent();
    }

    private Optional<ResourceEntity> findEntity(FullyQualifiedResourceId id) {
        return em.createQuery("FROM ResourceEntity WHERE resourceType = :type AND resourceId = :resourceId",
                ResourceEntity.class)
            .setParameter("type", id.resourceTypeName())
            .setParameter("resourceId", id.resourceId())
            .getResultStream()
            .findFirst();
    }

    private ResourceEntity requireEntity(FullyQualifiedResourceId id) {
        return findEntity(id).orElseThrow(() -> new IllegalStateException("No row for resource " + id));
    }

    private FullyQualifiedResourceId parentOf(ResourceEntity entity) {
        if (entity.parentId == null) {
            return null;
        }
        ResourceEntity parent = em.find(ResourceEntity.class, entity.parentId);
        return parent != null ? ResourceMapper.toId(parent) : null;
    }
}
