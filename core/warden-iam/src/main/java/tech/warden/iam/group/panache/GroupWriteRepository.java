package tech.warden.iam.group.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.warden.iam.group.Group;
import tech.warden.iam.group.entity.GroupEntity;
import tech.warden.iam.group.mapper.GroupMapper;
import tech.warden.iam.shared.EntityType;
import tech.warden.iam.shared.TsidGenerator;
import tech.warden.iam.subject.PolicyId;

import java.time.Instant;

/**
 * Write-side repository for group rows.
 *
 * <p>Updates load the managed entity and mutate it so that later reads in the
 * same transaction see the new values.
 */
@ApplicationScoped
public class GroupWriteRepository implements PanacheRepositoryBase<GroupEntity, String> {

    /**
     * Persist a new group row.
     *
     * @return the generated row id
     */
    public String persistGroup(Group group) {
        EntityType type = group.identity instanceof PolicyId ? EntityType.POLICY : EntityType.GROUP;
        GroupEntity entity = GroupMapper.toEntity(group, TsidGenerator.generate(type));
        persist(entity);
        return entity.id;
    }

    public void incrementVersion(String id, Instant updatedAt) {
        GroupEntity entity = findById(id);
        if (entity != null) {
            entity.version = entity.version + 1;
            entity.updatedAt = updatedAt;
        }
    }

    public boolean markSynchronized(String id, int version, Instant synchronizedAt) {
        GroupEntity entity = findById(id);
        if (entity == null || version > entity.version) {
            return false;
        }
        int last = entity.lastSynchronizedVersion != null ? entity.lastSynchronizedVersion : 0;
        if (last >= version) {
            return false;
        }
        entity.lastSynchronizedVersion = version;
        entity.synchronizedAt = synchronizedAt;
        return true;
    }

    public void updateAccessInstructions(String id, String instructions, Instant updatedAt) {
        GroupEntity entity = findById(id);
        if (entity != null) {
            entity.accessInstructions = instructions;
            entity.updatedAt = updatedAt;
        }
    }

    public boolean deleteGroupById(String id) {
        return deleteById(id);
    }
}
