package tech.warden.iam.group.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.warden.iam.group.Group;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.group.entity.GroupEntity;
import tech.warden.iam.group.entity.GroupMemberEntity;
import tech.warden.iam.group.mapper.GroupMapper;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-side repository for groups and direct edges.
 * Uses EntityManager directly to return domain objects.
 */
@ApplicationScoped
public class GroupReadRepository implements GroupRepository {

    @Inject
    EntityManager em;

    @Inject
    GroupKeys keys;

    @Inject
    GroupWriteRepository writeRepo;

    @Inject
    GroupMemberWriteRepository memberWriteRepo;

    @Override
    public Optional<Group> findByIdentity(GroupIdentity identity) {
        return keys.findEntity(identity)
            .map(entity -> GroupMapper.toDomain(entity, membersOf(entity.id)));
    }

    @Override
    public boolean exists(GroupIdentity identity) {
        return keys.findId(identity).isPresent();
    }

    @Override
    public Optional<String> findEmail(GroupIdentity identity) {
        return keys.findEntity(identity).map(entity -> entity.email);
    }

    @Override
    public Map<GroupIdentity, String> findEmails(Collection<GroupIdentity> identities) {
        Map<GroupIdentity, String> emails = new HashMap<>();
        for (GroupIdentity identity : identities) {
            findEmail(identity).ifPresent(email -> emails.put(identity, email));
        }
        return emails;
    }

    @Override
    public Optional<GroupIdentity> findIdentityByEmail(String email) {
        return em.createQuery("FROM GroupEntity WHERE lower(email) = lower(:email)", GroupEntity.class)
            .setParameter("email", email)
            .getResultStream()
            .findFirst()
            .map(GroupMapper::toIdentity);
    }

    @Override
    public List<GroupIdentity> listAllIdentities() {
        return em.createQuery("FROM GroupEntity ORDER BY id", GroupEntity.class)
            .getResultList()
            .stream()
            .map(GroupMapper::toIdentity)
            .toList();
    }

    @Override
    public Set<Subject> findDirectMembers(GroupIdentity group) {
        return keys.findId(group).map(this::membersOf).orElseGet(Set::of);
    }

    @Override
    public Set<GroupIdentity> findDirectParents(Subject member) {
        List<String> parentIds;
        if (member instanceof UserId user) {
            parentIds = em.createQuery(
                    "SELECT e.groupId FROM GroupMemberEntity e WHERE e.memberUserId = :id", String.class)
                .setParameter("id", user.value())
                .getResultList();
        } else {
            Optional<String> memberId = keys.findId((GroupIdentity) member);
            if (memberId.isEmpty()) {
                return Set.of();
            }
            parentIds = em.createQuery(
                    "SELECT e.groupId FROM GroupMemberEntity e WHERE e.memberGroupId = :id", String.class)
                .setParameter("id", memberId.get())
                .getResultList();
        }
        return new HashSet<>(keys.findIdentities(parentIds).values());
    }

    @Override
    public Optional<String> findAccessInstructions(GroupName group) {
        return keys.findEntity(group).map(entity -> entity.accessInstructions);
    }

    // Write operations delegate to WriteRepository

    @Override
    public void insert(Group group) {
        String id = writeRepo.persistGroup(group);
        for (Subject member : group.members) {
            insertEdge(id, member);
        }
    }

    @Override
    public boolean delete(GroupIdentity identity) {
        Optional<String> id = keys.findId(identity);
        if (id.isEmpty()) {
            return false;
        }
        memberWriteRepo.deleteOutgoing(id.get());
        return writeRepo.deleteGroupById(id.get());
    }

    @Override
    public boolean insertMember(GroupIdentity group, Subject member) {
        String groupId = requireId(group);
        if (hasEdge(groupId, member)) {
            return false;
        }
        insertEdge(groupId, member);
        return true;
    }

    @Override
    public boolean deleteMember(GroupIdentity group, Subject member) {
        Optional<String> groupId = keys.findId(group);
        if (groupId.isEmpty()) {
            return false;
        }
        if (member instanceof UserId user) {
            return memberWriteRepo.deleteUserEdge(groupId.get(), user.value()) > 0;
        }
        Optional<String> memberId = keys.findId((GroupIdentity) member);
        return memberId.isPresent() && memberWriteRepo.deleteGroupEdge(groupId.get(), memberId.get()) > 0;
    }

    @Override
    public void incrementVersion(GroupIdentity group, Instant updatedAt) {
        writeRepo.incrementVersion(requireId(group), updatedAt);
    }

    @Override
    public boolean updateSynchronized(GroupIdentity group, int version, Instant synchronizedAt) {
        return keys.findId(group)
            .map(id -> writeRepo.markSynchronized(id, version, synchronizedAt))
            .orElse(false);
    }

    @Override
    public void setAccessInstructions(GroupName group, String instructions, Instant updatedAt) {
        writeRepo.updateAccessInstructions(requireId(group), instructions, updatedAt);
    }

    private Set<Subject> membersOf(String groupId) {
        List<GroupMemberEntity> edges = em.createQuery(
                "FROM GroupMemberEntity WHERE groupId = :groupId", GroupMemberEntity.class)
            .setParameter("groupId", groupId)
            .getResultList();

        Set<Subject> members = new HashSet<>();
        List<String> groupIds = new ArrayList<>();
        for (GroupMemberEntity edge : edges) {
            if (edge.memberUserId != null) {
                members.add(new UserId(edge.memberUserId));
            } else {
                groupIds.add(edge.memberGroupId);
            }
        }
        members.addAll(keys.findIdentities(groupIds).values());
        return members;
    }

    private boolean hasEdge(String groupId, Subject member) {
        Long count;
        if (member instanceof UserId user) {
            count = em.createQuery("SELECT COUNT(e) FROM GroupMemberEntity e"
                    + " WHERE e.groupId = :groupId AND e.memberUserId = :memberId", Long.class)
                .setParameter("groupId", groupId)
                .setParameter("memberId", user.value())
                .getSingleResult();
        } else {
            count = em.createQuery("SELECT COUNT(e) FROM GroupMemberEntity e"
                    + " WHERE e.groupId = :groupId AND e.memberGroupId = :memberId", Long.class)
                .setParameter("groupId", groupId)
                .setParameter("memberId", requireId((GroupIdentity) member))
                .getSingleResult();
        }
        return count > 0;
    }

    private void insertEdge(String groupId, Subject member) {
        if (member instanceof UserId user) {
            memberWriteRepo.persistEdge(groupId, user.value(), null);
        } else {
            memberWriteRepo.persistEdge(groupId, null, requireId((GroupIdentity) member));
        }
    }

    private String requireId(GroupIdentity identity) {
        return keys.findId(identity)
            .orElseThrow(() -> new IllegalStateException("No row for group " + identity.key()));
    }
}
