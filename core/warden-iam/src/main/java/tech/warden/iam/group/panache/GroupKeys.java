package tech.warden.iam.group.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import tech.warden.iam.group.entity.GroupEntity;
import tech.warden.iam.group.mapper.GroupMapper;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves group identities to iam_groups row ids and back.
 * Shared by the repositories that store group references by row id.
 */
@ApplicationScoped
public class GroupKeys {

    @Inject
    EntityManager em;

    public Optional<GroupEntity> findEntity(GroupIdentity identity) {
        TypedQuery<GroupEntity> query;
        if (identity instanceof PolicyId policy) {
            query = em.createQuery(
                    "FROM GroupEntity WHERE kind = :kind AND policyResourceType = :type"
                        + " AND policyResourceId = :resourceId AND policyName = :policyName", GroupEntity.class)
                .setParameter("kind", GroupEntity.Kind.POLICY)
                .setParameter("type", policy.resource().resourceTypeName())
                .setParameter("resourceId", policy.resource().resourceId())
                .setParameter("policyName", policy.policyName());
        } else {
            query = em.createQuery("FROM GroupEntity WHERE kind = :kind AND name = :name", GroupEntity.class)
                .setParameter("kind", GroupEntity.Kind.GROUP)
                .setParameter("name", ((GroupName) identity).value());
        }
        return query.getResultStream().findFirst();
    }

    public Optional<String> findId(GroupIdentity identity) {
        return findEntity(identity).map(entity -> entity.id);
    }

    public Map<GroupIdentity, String> findIds(Collection<? extends GroupIdentity> identities) {
        Map<GroupIdentity, String> ids = new HashMap<>();
        for (GroupIdentity identity : identities) {
            findId(identity).ifPresent(id -> ids.put(identity, id));
        }
        return ids;
    }

    public Map<String, GroupIdentity> findIdentities(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        List<GroupEntity> entities = em.createQuery("FROM GroupEntity WHERE id IN :ids", GroupEntity.class)
            .setParameter("ids", ids)
            .getResultList();
        Map<String, GroupIdentity> identities = new HashMap<>();
        for (GroupEntity entity : entities) {
            identities.put(entity.id, GroupMapper.toIdentity(entity));
        }
        return identities;
    }
}
