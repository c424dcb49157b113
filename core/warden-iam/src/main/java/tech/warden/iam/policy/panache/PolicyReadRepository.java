package tech.warden.iam.policy.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import tech.warden.iam.group.entity.GroupEntity;
import tech.warden.iam.group.panache.GroupKeys;
import tech.warden.iam.policy.PolicyGrants;
import tech.warden.iam.policy.PolicyRepository;
import tech.warden.iam.policy.entity.PolicyDescendantPermissionEntity;
import tech.warden.iam.policy.entity.PolicyEntity;
import tech.warden.iam.policy.mapper.PolicyMapper;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.PolicyId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for policy grants. Policy identities come from the
 * matching iam_groups rows.
 */
@ApplicationScoped
public class PolicyReadRepository implements PolicyRepository {

    private static final String JOINED = "SELECT p, g FROM PolicyEntity p, GroupEntity g WHERE p.groupId = g.id";

    @Inject
    EntityManager em;

    @Inject
    GroupKeys keys;

    @Inject
    PolicyWriteRepository writeRepo;

    @Override
    public Optional<PolicyGrants> findById(PolicyId id) {
        return keys.findId(id)
            .flatMap(groupId -> Optional.ofNullable(em.find(PolicyEntity.class, groupId)))
            .map(entity -> PolicyMapper.toDomain(id, entity, descendantsOf(entity.groupId)));
    }

    @Override
    public List<PolicyGrants> findByResource(FullyQualifiedResourceId resource) {
        return toGrants(em.createQuery(JOINED
                    + " AND g.policyResourceType = :type AND g.policyResourceId = :resourceId ORDER BY g.policyName",
                Object[].class)
            .setParameter("type", resource.resourceTypeName())
            .setParameter("resourceId", resource.resourceId()));
    }

    @Override
    public List<PolicyGrants> findByIds(Collection<PolicyId> ids) {
        List<PolicyGrants> result = new ArrayList<>();
        for (PolicyId id : ids) {
            findById(id).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public List<PolicyGrants> findPublic(String resourceTypeName) {
        if (resourceTypeName == null) {
            return toGrants(em.createQuery(JOINED + " AND p.isPublic = true", Object[].class));
        }
        return toGrants(em.createQuery(JOINED + " AND p.isPublic = true AND g.policyResourceType = :type", Object[].class)
            .setParameter("type", resourceTypeName));
    }

    // Write operations delegate to WriteRepository

    @Override
    public void insert(PolicyGrants grants) {
        writeRepo.persistGrants(grants, requireId(grants.id()));
    }

    @Override
    public void update(PolicyGrants grants) {
        writeRepo.updateGrants(grants, requireId(grants.id()));
    }

    @Override
    public boolean delete(PolicyId id) {
        return keys.findId(id).map(writeRepo::deleteGrants).orElse(false);
    }

    private List<PolicyGrants> toGrants(TypedQuery<Object[]> query) {
        List<PolicyGrants> result = new ArrayList<>();
        for (Object[] row : query.getResultList()) {
            PolicyEntity policy = (PolicyEntity) row[0];
            GroupEntity group = (GroupEntity) row[1];
            PolicyId id = PolicyId.of(group.policyResourceType, group.policyResourceId, group.policyName);
            result.add(PolicyMapper.toDomain(id, policy, descendantsOf(policy.groupId)));
        }
        return result;
    }

    private List<PolicyDescendantPermissionEntity> descendantsOf(String groupId) {
        return em.createQuery("FROM PolicyDescendantPermissionEntity WHERE policyId = :policyId",
                PolicyDescendantPermissionEntity.class)
            .setParameter("policyId", groupId)
            .getResultList();
    }

    private String requireId(PolicyId id) {
        return keys.findId(id).orElseThrow(() -> new IllegalStateException("No group row for policy " + id.key()));
    }
}
