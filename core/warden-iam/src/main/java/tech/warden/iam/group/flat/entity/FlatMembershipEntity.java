package tech.warden.iam.group.flat.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA entity for iam_group_members_flat table.
 *
 * <p>{@code memberKey} is a user id when {@code memberKind} is USER and an
 * iam_groups id when it is GROUP. The kind is part of the key since both id
 * spaces can produce the same value.
 */
@Entity
@Table(name = "iam_group_members_flat")
@IdClass(FlatMembershipEntity.FlatMembershipId.class)
public class FlatMembershipEntity {

    public enum MemberKind {
        USER,
        GROUP
    }

    @Id
    @Column(name = "group_id", length = 17)
    public String groupId;

    @Id
    @Column(name = "member_key")
    public String memberKey;

    @Id
    @Column(name = "member_kind", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    public MemberKind memberKind;

    public FlatMembershipEntity() {
    }

    /**
     * Composite primary key for iam_group_members_flat.
     */
    public static class FlatMembershipId implements Serializable {
        public String groupId;
        public String memberKey;
        public MemberKind memberKind;

        public FlatMembershipId() {
        }

        public FlatMembershipId(String groupId, String memberKey, MemberKind memberKind) {
            this.groupId = groupId;
            this.memberKey = memberKey;
            this.memberKind = memberKind;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            FlatMembershipId that = (FlatMembershipId) o;
            return Objects.equals(groupId, that.groupId)
                && Objects.equals(memberKey, that.memberKey)
                && memberKind == that.memberKind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(groupId, memberKey, memberKind);
        }
    }
}
