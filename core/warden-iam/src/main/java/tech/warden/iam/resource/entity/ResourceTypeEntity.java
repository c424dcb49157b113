package tech.warden.iam.resource.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for iam_resource_types table. Roles are in iam_resource_type_roles.
 */
@Entity
@Table(name = "iam_resource_types")
public class ResourceTypeEntity {

    @Id
    @Column(name = "name", length = 100)
    public String name;

    @Column(name = "owner_role_name", length = 100)
    public String ownerRoleName;

    @Column(name = "reuse_ids", nullable = false)
    public boolean reuseIds;

    // List of action patterns as JSONB
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "action_patterns", columnDefinition = "jsonb")
    public String actionPatterns;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public ResourceTypeEntity() {
    }
}
