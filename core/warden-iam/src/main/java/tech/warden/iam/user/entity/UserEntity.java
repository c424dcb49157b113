package tech.warden.iam.user.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for iam_users table.
 */
@Entity
@Table(name = "iam_users")
public class UserEntity {

    @Id
    @Column(name = "id", length = 255)
    public String id;

    @Column(name = "email", nullable = false, unique = true)
    public String email;

    @Column(name = "enabled", nullable = false)
    public boolean enabled;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public UserEntity() {
    }
}
