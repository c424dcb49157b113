package tech.warden.iam.policy.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA entity for iam_policy_descendant_permissions table: one row per policy and
 * descendant resource type.
 */
@Entity
@Table(name = "iam_policy_descendant_permissions")
@IdClass(PolicyDescendantPermissionEntity.PolicyDescendantPermissionId.class)
public class PolicyDescendantPermissionEntity {

    @Id
    @Column(name = "policy_id", length = 17)
    public String policyId;

    @Id
    @Column(name = "resource_type", length = 100)
    public String resourceType;

    @Column(name = "roles", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] roles;

    @Column(name = "actions", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] actions;

    public PolicyDescendantPermissionEntity() {
    }

    /**
     * Composite primary key for iam_policy_descendant_permissions.
     */
    public static class PolicyDescendantPermissionId implements Serializable {
        public String policyId;
        public String resourceType;

        public PolicyDescendantPermissionId() {
        }

        public PolicyDescendantPermissionId(String policyId, String resourceType) {
            this.policyId = policyId;
            this.resourceType = resourceType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PolicyDescendantPermissionId that = (PolicyDescendantPermissionId) o;
            return Objects.equals(policyId, that.policyId) && Objects.equals(resourceType, that.resourceType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(policyId, resourceType);
        }
    }
}
