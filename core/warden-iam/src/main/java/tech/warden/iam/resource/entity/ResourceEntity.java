package tech.warden.iam.resource.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for iam_resources table. {@code parentId} points at another row of
 * the same table.
 */
@Entity
@Table(name = "iam_resources")
public class ResourceEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "resource_type", nullable = false, length = 100)
    public String resourceType;

    @Column(name = "resource_id", nullable = false)
    public String resourceId;

    @Column(name = "auth_domain", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] authDomain;

    @Column(name = "parent_id", length = 17)
    public String parentId;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public ResourceEntity() {
    }
}
