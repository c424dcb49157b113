package tech.warden.iam.policy.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * JPA entity for iam_policies table. Shares its id with the policy's iam_groups row.
 */
@Entity
@Table(name = "iam_policies")
public class PolicyEntity {

    @Id
    @Column(name = "group_id", length = 17)
    public String groupId;

    @Column(name = "roles", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] roles;

    @Column(name = "actions", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] actions;

    @Column(name = "is_public", nullable = false)
    public boolean isPublic;

    public PolicyEntity() {
    }
}
