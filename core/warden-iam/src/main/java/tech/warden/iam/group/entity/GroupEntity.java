package tech.warden.iam.group.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for iam_groups table.
 *
 * <p>Holds plain groups and access policies. A plain group is keyed by
 * {@code name}; a policy by its resource and policy name. Policy grants live in
 * iam_policies under the same id.
 */
@Entity
@Table(name = "iam_groups")
public class GroupEntity {

    public enum Kind {
        GROUP,
        POLICY
    }

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "kind", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    public Kind kind;

    @Column(name = "name")
    public String name;

    @Column(name = "policy_resource_type", length = 100)
    public String policyResourceType;

    @Column(name = "policy_resource_id")
    public String policyResourceId;

    @Column(name = "policy_name", length = 100)
    public String policyName;

    @Column(name = "email", nullable = false)
    public String email;

    @Column(name = "version", nullable = false)
    public int version;

    @Column(name = "last_synchronized_version")
    public Integer lastSynchronizedVersion;

    @Column(name = "synchronized_at")
    public Instant synchronizedAt;

    @Column(name = "access_instructions", columnDefinition = "TEXT")
    public String accessInstructions;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public GroupEntity() {
    }
}
