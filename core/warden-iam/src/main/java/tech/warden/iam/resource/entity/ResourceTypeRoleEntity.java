package tech.warden.iam.resource.entity;

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
 * JPA entity for iam_resource_type_roles table.
 */
@Entity
@Table(name = "iam_resource_type_roles")
@IdClass(ResourceTypeRoleEntity.ResourceTypeRoleId.class)
public class ResourceTypeRoleEntity {

    @Id
    @Column(name = "resource_type", length = 100)
    public String resourceType;

    @Id
    @Column(name = "role_name", length = 100)
    public String roleName;

    @Column(name = "actions", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] actions;

    // Map of descendant type name to role names as JSONB
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "descendant_roles", columnDefinition = "jsonb")
    public String descendantRoles;

    public ResourceTypeRoleEntity() {
    }

    /**
     * Composite primary key for iam_resource_type_roles.
     */
    public static class ResourceTypeRoleId implements Serializable {
        public String resourceType;
        public String roleName;

        public ResourceTypeRoleId() {
        }

        public ResourceTypeRoleId(String resourceType, String roleName) {
            this.resourceType = resourceType;
            this.roleName = roleName;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ResourceTypeRoleId that = (ResourceTypeRoleId) o;
            return Objects.equals(resourceType, that.resourceType) && Objects.equals(roleName, that.roleName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(resourceType, roleName);
        }
    }
}
