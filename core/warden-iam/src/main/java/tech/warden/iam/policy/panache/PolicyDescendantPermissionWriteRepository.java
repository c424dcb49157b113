package tech.warden.iam.policy.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.warden.iam.policy.entity.PolicyDescendantPermissionEntity;
import tech.warden.iam.policy.entity.PolicyDescendantPermissionEntity.PolicyDescendantPermissionId;

/**
 * Write-side repository for descendant permission rows.
 */
@ApplicationScoped
public class PolicyDescendantPermissionWriteRepository
        implements PanacheRepositoryBase<PolicyDescendantPermissionEntity, PolicyDescendantPermissionId> {

    /**
     * Removes the rows one by one so the persistence context forgets them before
     * replacements with the same keys are persisted.
     */
    public void deleteByPolicy(String policyId) {
        list("policyId", policyId).forEach(this::delete);
        flush();
    }
}
