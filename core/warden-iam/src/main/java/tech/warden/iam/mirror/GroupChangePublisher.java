package tech.warden.iam.mirror;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.group.flat.MembershipIndex;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.Subject;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Queues mirror notifications for a membership change until the surrounding
 * transaction commits.
 *
 * <p>The mutated group and all of its ancestors are notified, since the effective
 * membership of each of them changed. Ancestors and emails are resolved inside the
 * transaction; the notifier runs after commit and its failures are only logged.
 */
@ApplicationScoped
public class GroupChangePublisher {

    private static final Logger LOG = Logger.getLogger(GroupChangePublisher.class);

    private final TransactionRunner tx;
    private final MembershipIndex membershipIndex;
    private final GroupRepository groupRepo;
    private final GroupMirrorNotifier notifier;

    @Inject
    public GroupChangePublisher(TransactionRunner tx, MembershipIndex membershipIndex,
                                GroupRepository groupRepo, GroupMirrorNotifier notifier) {
        this.tx = tx;
        this.membershipIndex = membershipIndex;
        this.groupRepo = groupRepo;
        this.notifier = notifier;
    }

    /**
     * Direct members of {@code group} were added or removed.
     */
    public void publish(GroupIdentity group, Set<? extends Subject> changedMembers, RequestContext ctx) {
        if (changedMembers.isEmpty()) {
            return;
        }
        queue(group, changedMembers, GroupMembershipChange.Kind.MEMBERS_CHANGED, ctx);
    }

    /**
     * The grants of a policy changed. Only the policy itself is notified since the
     * effective membership of its ancestors is unaffected.
     */
    public void publishGrantsChanged(GroupIdentity policy, RequestContext ctx) {
        queue(policy, Set.of(), GroupMembershipChange.Kind.GRANTS_CHANGED, ctx);
    }

    /**
     * {@code group} is about to be deleted in the current transaction. Must be called
     * before its rows and flattened index entries are removed.
     */
    public void publishDeleted(GroupIdentity group, Set<? extends Subject> formerMembers, RequestContext ctx) {
        queue(group, formerMembers, GroupMembershipChange.Kind.GROUP_DELETED, ctx);
    }

    private void queue(GroupIdentity group, Set<? extends Subject> changedMembers,
                       GroupMembershipChange.Kind kind, RequestContext ctx) {
        Set<GroupIdentity> affected = new LinkedHashSet<>();
        affected.add(group);
        if (kind != GroupMembershipChange.Kind.GRANTS_CHANGED) {
            affected.addAll(membershipIndex.listAncestorGroups(group));
        }
        Map<GroupIdentity, String> emails = groupRepo.findEmails(affected);

        Set<String> changedKeys = changedMembers.stream().map(Subject::key).collect(Collectors.toSet());
        List<GroupMembershipChange> changes = new ArrayList<>();
        for (GroupIdentity target : affected) {
            boolean direct = target.equals(group);
            changes.add(GroupMembershipChange.fromContext(ctx)
                .groupKey(target.key())
                .groupEmail(emails.get(target))
                .direct(direct)
                .kind(direct ? kind : GroupMembershipChange.Kind.MEMBERS_CHANGED)
                .changedMemberKeys(changedKeys)
                .build());
        }

        tx.afterCommit(() -> deliver(changes));
    }

    private void deliver(List<GroupMembershipChange> changes) {
        for (GroupMembershipChange change : changes) {
            try {
                notifier.notify(change);
            } catch (Exception e) {
                LOG.warnf(e, "Mirror notification %s failed for %s (execution %s)",
                    change.kind(), change.groupKey(), change.executionId());
            }
        }
    }
}
