package tech.warden.iam.group.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * JPA entity for iam_group_members table: one direct edge.
 * Exactly one of {@code memberUserId} and {@code memberGroupId} is set.
 */
@Entity
@Table(name = "iam_group_members")
public class GroupMemberEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "group_id", nullable = false, length = 17)
    public String groupId;

    @Column(name = "member_user_id")
    public String memberUserId;

    @Column(name = "member_group_id", length = 17)
    public String memberGroupId;

    public GroupMemberEntity() {
    }

    public GroupMemberEntity(String id, String groupId, String memberUserId, String memberGroupId) {
        this.id = id;
        this.groupId = groupId;
        this.memberUserId = memberUserId;
        this.memberGroupId = memberGroupId;
    }
}
