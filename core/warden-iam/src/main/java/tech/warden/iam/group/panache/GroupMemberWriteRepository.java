package tech.warden.iam.group.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.warden.iam.group.entity.GroupMemberEntity;
import tech.warden.iam.shared.EntityType;
import tech.warden.iam.shared.TsidGenerator;

/**
 * Write-side repository for direct membership edges.
 */
@ApplicationScoped
public class GroupMemberWriteRepository implements PanacheRepositoryBase<GroupMemberEntity, String> {

    public void persistEdge(String groupId, String memberUserId, String memberGroupId) {
        persist(new GroupMemberEntity(TsidGenerator.generate(EntityType.GROUP_MEMBER), groupId, memberUserId, memberGroupId));
    }

    public long deleteUserEdge(String groupId, String userId) {
        return delete("groupId = ?1 AND memberUserId = ?2", groupId, userId);
    }

    public long deleteGroupEdge(String groupId, String memberGroupId) {
        return delete("groupId = ?1 AND memberGroupId = ?2", groupId, memberGroupId);
    }

    public long deleteOutgoing(String groupId) {
        return delete("groupId", groupId);
    }
}
