package tech.warden.iam.policy.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.policy.PolicyGrants;
import tech.warden.iam.policy.entity.PolicyDescendantPermissionEntity;
import tech.warden.iam.policy.entity.PolicyEntity;
import tech.warden.iam.policy.mapper.PolicyMapper;

/**
 * Write-side repository for policy grants.
 */
@ApplicationScoped
public class PolicyWriteRepository implements PanacheRepositoryBase<PolicyEntity, String> {

    @Inject
    PolicyDescendantPermissionWriteRepository descendantWriteRepo;

    public void persistGrants(PolicyGrants grants, String groupId) {
        persist(PolicyMapper.toEntity(grants, groupId));
        for (PolicyDescendantPermissionEntity descendant : PolicyMapper.toDescendantEntities(grants, groupId)) {
            descendantWriteRepo.persist(descendant);
        }
    }

    public void updateGrants(PolicyGrants grants, String groupId) {
        PolicyEntity entity = findById(groupId);
        if (entity == null) {
            return;
        }
        PolicyMapper.updateEntity(entity, grants);
        descendantWriteRepo.deleteByPolicy(groupId);
        for (PolicyDescendantPermissionEntity descendant : PolicyMapper.toDescendantEntities(grants, groupId)) {
            descendantWriteRepo.persist(descendant);
        }
    }

    public boolean deleteGrants(String groupId) {
        descendantWriteRepo.deleteByPolicy(groupId);
        return deleteById(groupId);
    }
}
