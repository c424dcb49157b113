package tech.warden.iam.group.flat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link MembershipIndex} that adds rows incrementally and rebuilds on removal.
 *
 * <p>Adding {@code child} to {@code parent} inserts the cross product of
 * {parent and its ancestors} with {child and everything under it}.
 *
 * <p>Removing an edge can disconnect some paths while others survive, so the rows
 * of the parent and of every ancestor are deleted and recomputed from the direct
 * edges. That costs O(ancestors x closure) per removal.
 */
@ApplicationScoped
public class ClosureRebuildMembershipIndex implements MembershipIndex {

    private static final Logger LOG = Logger.getLogger(ClosureRebuildMembershipIndex.class);

    private final FlatMembershipRepository flatRepo;
    private final GroupRepository groupRepo;

    @Inject
    public ClosureRebuildMembershipIndex(FlatMembershipRepository flatRepo, GroupRepository groupRepo) {
        this.flatRepo = flatRepo;
        this.groupRepo = groupRepo;
    }

    @Override
    public void onMemberAdded(GroupIdentity parent, Subject child) {
        Set<GroupIdentity> targets = selfAndAncestors(parent);

        Set<Subject> reach = new HashSet<>();
        reach.add(child);
        if (child instanceof GroupIdentity childGroup) {
            reach.addAll(flatRepo.findMembers(childGroup));
        }

        flatRepo.insertAll(targets, reach);
        LOG.debugf("Flattened %s into %s: %d targets x %d members", child, parent, targets.size(), reach.size());
    }

    @Override
    public void onMemberRemoved(GroupIdentity parent, Subject child) {
        rebuild(selfAndAncestors(parent));
    }

    @Override
    public void onMembersReplaced(GroupIdentity group) {
        rebuild(selfAndAncestors(group));
    }

    @Override
    public void onSubjectDeleted(Subject subject) {
        flatRepo.deleteBySubject(subject);
    }

    @Override
    public int rebuildAll() {
        flatRepo.deleteAll();
        List<GroupIdentity> groups = groupRepo.listAllIdentities();
        Map<GroupIdentity, Set<Subject>> edges = new HashMap<>();
        for (GroupIdentity group : groups) {
            flatRepo.insertAll(List.of(group), closureOf(group, edges));
        }
        LOG.infof("Rebuilt flattened membership for %d groups", groups.size());
        return groups.size();
    }

    @Override
    public boolean isMember(GroupIdentity group, Subject subject) {
        return flatRepo.exists(group, subject);
    }

    @Override
    public Set<GroupIdentity> listAncestorGroups(Subject subject) {
        return flatRepo.findAncestors(subject);
    }

    @Override
    public Set<UserId> listFlattenedMembers(GroupIdentity group) {
        return flatRepo.findUserMembers(group);
    }

    @Override
    public Set<UserId> intersectGroups(Set<? extends GroupIdentity> groups) {
        Set<UserId> result = null;
        for (GroupIdentity group : groups) {
            Set<UserId> users = flatRepo.findUserMembers(group);
            if (result == null) {
                result = new HashSet<>(users);
            } else {
                result.retainAll(users);
            }
            if (result.isEmpty()) {
                break;
            }
        }
        return result == null ? Set.of() : result;
    }

    private Set<GroupIdentity> selfAndAncestors(GroupIdentity group) {
        Set<GroupIdentity> targets = new LinkedHashSet<>();
        targets.add(group);
        targets.addAll(flatRepo.findAncestors(group));
        return targets;
    }

    private void rebuild(Collection<GroupIdentity> groups) {
        flatRepo.deleteByGroups(groups);
        Map<GroupIdentity, Set<Subject>> edges = new HashMap<>();
        for (GroupIdentity group : groups) {
            flatRepo.insertAll(List.of(group), closureOf(group, edges));
        }
        LOG.debugf("Rebuilt flattened membership of %d groups", groups.size());
    }

    /**
     * Breadth-first search over direct edges. {@code edges} memoizes lookups across
     * groups rebuilt in the same pass.
     */
    private Set<Subject> closureOf(GroupIdentity root, Map<GroupIdentity, Set<Subject>> edges) {
        Set<Subject> reached = new HashSet<>();
        Deque<GroupIdentity> pending = new ArrayDeque<>();
        pending.add(root);
        Set<GroupIdentity> expanded = new HashSet<>();

        while (!pending.isEmpty()) {
            GroupIdentity current = pending.poll();
            if (!expanded.add(current)) {
                continue;
            }
            for (Subject member : edges.computeIfAbsent(current, groupRepo::findDirectMembers)) {
                if (reached.add(member) && member instanceof GroupIdentity nested) {
                    pending.add(nested);
                }
            }
        }
        return reached;
    }
}
