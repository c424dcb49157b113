package tech.warden.iam.group.flat.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.warden.iam.group.flat.FlatMembershipRepository;
import tech.warden.iam.group.flat.entity.FlatMembershipEntity.MemberKind;
import tech.warden.iam.group.flat.panache.FlatMembershipWriteRepository.MemberRef;
import tech.warden.iam.group.panache.GroupKeys;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-side repository for the flattened membership index.
 * Every query is a single indexed lookup by ancestor or by member.
 */
@ApplicationScoped
public class FlatMembershipReadRepository implements FlatMembershipRepository {

    @Inject
    EntityManager em;

    @Inject
    GroupKeys keys;

    @Inject
    FlatMembershipWriteRepository writeRepo;

    @Override
    public boolean exists(GroupIdentity ancestor, Subject member) {
        Optional<String> ancestorId = keys.findId(ancestor);
        Optional<MemberRef> ref = toRef(member);
        if (ancestorId.isEmpty() || ref.isEmpty()) {
            return false;
        }
        Long count = em.createQuery("SELECT COUNT(f) FROM FlatMembershipEntity f"
                + " WHERE f.groupId = :groupId AND f.memberKey = :key AND f.memberKind = :kind", Long.class)
            .setParameter("groupId", ancestorId.get())
            .setParameter("key", ref.get().key())
            .setParameter("kind", ref.get().kind())
            .getSingleResult();
        return count > 0;
    }

    @Override
    public Set<GroupIdentity> findAncestors(Subject member) {
        Optional<MemberRef> ref = toRef(member);
        if (ref.isEmpty()) {
            return Set.of();
        }
        List<String> ancestorIds = em.createQuery("SELECT f.groupId FROM FlatMembershipEntity f"
                + " WHERE f.memberKey = :key AND f.memberKind = :kind", String.class)
            .setParameter("key", ref.get().key())
            .setParameter("kind", ref.get().kind())
            .getResultList();
        return new HashSet<>(keys.findIdentities(ancestorIds).values());
    }

    @Override
    public Set<Subject> findMembers(GroupIdentity ancestor) {
        Optional<String> ancestorId = keys.findId(ancestor);
        if (ancestorId.isEmpty()) {
            return Set.of();
        }
        Set<Subject> members = new HashSet<>(usersUnder(ancestorId.get()));
        List<String> groupIds = em.createQuery("SELECT f.memberKey FROM FlatMembershipEntity f"
                + " WHERE f.groupId = :groupId AND f.memberKind = :kind", String.class)
            .setParameter("groupId", ancestorId.get())
            .setParameter("kind", MemberKind.GROUP)
            .getResultList();
        members.addAll(keys.findIdentities(groupIds).values());
        return members;
    }

    @Override
    public Set<UserId> findUserMembers(GroupIdentity ancestor) {
        return keys.findId(ancestor).map(this::usersUnder).orElseGet(Set::of);
    }

    private Set<UserId> usersUnder(String ancestorId) {
        return em.createQuery("SELECT f.memberKey FROM FlatMembershipEntity f"
                + " WHERE f.groupId = :groupId AND f.memberKind = :kind", String.class)
            .setParameter("groupId", ancestorId)
            .setParameter("kind", MemberKind.USER)
            .getResultStream()
            .map(UserId::new)
            .collect(Collectors.toSet());
    }

    // Write operations delegate to WriteRepository

    @Override
    public void insertAll(Collection<GroupIdentity> ancestors, Collection<Subject> members) {
        if (ancestors.isEmpty() || members.isEmpty()) {
            return;
        }
        List<MemberRef> refs = new ArrayList<>();
        for (Subject member : members) {
            toRef(member).ifPresent(refs::add);
        }
        writeRepo.insertAll(keys.findIds(ancestors).values(), refs);
    }

    @Override
    public void deleteByGroups(Collection<GroupIdentity> ancestors) {
        writeRepo.deleteByGroupIds(keys.findIds(ancestors).values());
    }

    @Override
    public void deleteBySubject(Subject subject) {
        Optional<MemberRef> ref = toRef(subject);
        if (ref.isEmpty()) {
            return;
        }
        writeRepo.deleteMember(ref.get().key(), ref.get().kind());
        if (ref.get().kind() == MemberKind.GROUP) {
            writeRepo.deleteByGroupIds(List.of(ref.get().key()));
        }
    }

    @Override
    public void deleteAll() {
        writeRepo.deleteEverything();
    }

    private Optional<MemberRef> toRef(Subject subject) {
        if (subject instanceof UserId user) {
            return Optional.of(new MemberRef(user.value(), MemberKind.USER));
        }
        return keys.findId((GroupIdentity) subject).map(id -> new MemberRef(id, MemberKind.GROUP));
    }
}
