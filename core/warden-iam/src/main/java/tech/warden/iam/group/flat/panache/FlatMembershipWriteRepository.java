package tech.warden.iam.group.flat.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.Query;
import tech.warden.iam.group.flat.entity.FlatMembershipEntity;
import tech.warden.iam.group.flat.entity.FlatMembershipEntity.FlatMembershipId;
import tech.warden.iam.group.flat.entity.FlatMembershipEntity.MemberKind;

import java.util.Collection;
import java.util.List;

/**
 * Write-side repository for flattened membership rows.
 *
 * <p>Inserts are multi-row native statements with {@code ON CONFLICT DO NOTHING},
 * so re-inserting an existing pair is harmless.
 */
@ApplicationScoped
public class FlatMembershipWriteRepository implements PanacheRepositoryBase<FlatMembershipEntity, FlatMembershipId> {

    private static final int BATCH_SIZE = 500;

    /**
     * A member row to insert under one or more ancestors.
     */
    public record MemberRef(String key, MemberKind kind) {}

    public void insertAll(Collection<String> ancestorIds, List<MemberRef> members) {
        for (String ancestorId : ancestorIds) {
            for (int from = 0; from < members.size(); from += BATCH_SIZE) {
                insertBatch(ancestorId, members.subList(from, Math.min(members.size(), from + BATCH_SIZE)));
            }
        }
    }

    private void insertBatch(String ancestorId, List<MemberRef> batch) {
        StringBuilder sql = new StringBuilder(
            "INSERT INTO iam_group_members_flat (group_id, member_key, member_kind) VALUES ");
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append("(:g, :k").append(i).append(", :m").append(i).append(')');
        }
        sql.append(" ON CONFLICT DO NOTHING");

        Query query = getEntityManager().createNativeQuery(sql.toString()).setParameter("g", ancestorId);
        for (int i = 0; i < batch.size(); i++) {
            query.setParameter("k" + i, batch.get(i).key());
            query.setParameter("m" + i, batch.get(i).kind().name());
        }
        query.executeUpdate();
    }

    public long deleteByGroupIds(Collection<String> groupIds) {
        return groupIds.isEmpty() ? 0 : delete("groupId IN ?1", groupIds);
    }

    public long deleteMember(String memberKey, MemberKind kind) {
        return delete("memberKey = ?1 AND memberKind = ?2", memberKey, kind);
    }

    public long deleteEverything() {
        return deleteAll();
    }
}
