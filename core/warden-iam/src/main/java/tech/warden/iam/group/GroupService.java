package tech.warden.iam.group;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamErrors;
import tech.warden.iam.config.WardenConfig;
import tech.warden.iam.group.flat.MembershipIndex;
import tech.warden.iam.mirror.GroupChangePublisher;
import tech.warden.iam.resource.ResourceRepository;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.user.UserRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups, their direct members and the flattened index that follows them.
 *
 * <p>Every mutation runs in one serializable transaction covering the group row,
 * the edge and the flattened rows. A successful membership mutation bumps the
 * version of the mutated group only.
 */
@ApplicationScoped
public class GroupService {

    private static final Logger LOG = Logger.getLogger(GroupService.class);

    private final TransactionRunner tx;
    private final GroupRepository groupRepo;
    private final UserRepository userRepo;
    private final ResourceRepository resourceRepo;
    private final MembershipIndex membershipIndex;
    private final GroupChangePublisher publisher;
    private final WardenConfig config;

    @Inject
    public GroupService(TransactionRunner tx, GroupRepository groupRepo, UserRepository userRepo,
                        ResourceRepository resourceRepo, MembershipIndex membershipIndex,
                        GroupChangePublisher publisher, WardenConfig config) {
        this.tx = tx;
        this.groupRepo = groupRepo;
        this.userRepo = userRepo;
        this.resourceRepo = resourceRepo;
        this.membershipIndex = membershipIndex;
        this.publisher = publisher;
        this.config = config;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Create a group with optional initial members.
     *
     * @param email null to derive one from the name
     */
    public Group createGroup(GroupName name, String email, Set<? extends Subject> members,
                             String accessInstructions, RequestContext ctx) {
        return tx.serializableWrite("createGroup", ctx, () -> {
            Group group = new Group(name, email != null ? email : name.value() + "@" + config.emailDomain());
            group.accessInstructions = accessInstructions;
            return insertGroup(group, members, ctx);
        });
    }

    /**
     * Insert a group record for any identity. Used for policies, which are groups
     * owned by a resource.
     */
    public Group createGroupRecord(GroupIdentity identity, String email, Set<? extends Subject> members,
                                   RequestContext ctx) {
        return tx.serializableWrite("createGroupRecord", ctx,
            () -> insertGroup(new Group(identity, email), members, ctx));
    }

    private Group insertGroup(Group group, Set<? extends Subject> members, RequestContext ctx) {
        if (groupRepo.exists(group.identity)) {
            throw IamErrors.conflict("GROUP_EXISTS",
                "Group " + describe(group.identity) + " already exists",
                Map.of("group", group.identity.key()));
        }
        if (groupRepo.findIdentityByEmail(group.email).isPresent() || userRepo.existsByEmail(group.email)) {
            throw IamErrors.conflict("EMAIL_IN_USE",
                "Email " + group.email + " is already in use",
                Map.of("email", group.email));
        }
        for (Subject member : members) {
            requireSubjectExists(member);
        }

        Instant now = Instant.now();
        group.version = 1;
        group.createdAt = now;
        group.updatedAt = now;
        group.members = new HashSet<>(members);
        groupRepo.insert(group);
        for (Subject member : members) {
            membershipIndex.onMemberAdded(group.identity, member);
        }
        publisher.publish(group.identity, members, ctx);

        LOG.debugf("Created group %s with %d members (execution %s)",
            group.identity, members.size(), ctx.executionId());
        return group;
    }

    public Optional<Group> loadGroup(GroupIdentity identity, RequestContext ctx) {
        return tx.readOnly("loadGroup", ctx, () -> groupRepo.findByIdentity(identity));
    }

    public Optional<String> loadGroupEmail(GroupIdentity identity, RequestContext ctx) {
        return tx.readOnly("loadGroupEmail", ctx, () -> groupRepo.findEmail(identity));
    }

    public Map<GroupIdentity, String> batchLoadGroupEmail(Collection<GroupIdentity> identities, RequestContext ctx) {
        return tx.readOnly("batchLoadGroupEmail", ctx, () -> groupRepo.findEmails(identities));
    }

    /**
     * Delete a group or policy record that nothing else references.
     *
     * @throws tech.warden.iam.common.errors.IamException ReferentialIntegrity naming a
     *         containing group when the group is still a member elsewhere, or naming a
     *         resource when the group is part of its auth domain
     */
    public void deleteGroup(GroupIdentity identity, RequestContext ctx) {
        tx.serializableWrite("deleteGroup", ctx, () -> {
            if (!groupRepo.exists(identity)) {
                throw notFound(identity);
            }
            Set<GroupIdentity> parents = groupRepo.findDirectParents(identity);
            if (!parents.isEmpty()) {
                GroupIdentity parent = parents.iterator().next();
                throw IamErrors.referentialIntegrity("GROUP_IN_USE",
                    "Cannot delete " + describe(identity) + ": it is a member of " + describe(parent),
                    Map.of("group", identity.key(), "containingGroup", parent.key()));
            }
            if (identity instanceof GroupName name) {
                List<FullyQualifiedResourceId> constrained = resourceRepo.findByAuthDomainGroup(name);
                if (!constrained.isEmpty()) {
                    throw IamErrors.referentialIntegrity("GROUP_IS_AUTH_DOMAIN",
                        "Cannot delete " + describe(identity) + ": it is in the auth domain of " + constrained.get(0),
                        Map.of("group", identity.key(), "resource", constrained.get(0).toString()));
                }
            }
            publisher.publishDeleted(identity, groupRepo.findDirectMembers(identity), ctx);
            membershipIndex.onSubjectDeleted(identity);
            groupRepo.delete(identity);
            LOG.debugf("Deleted group %s (execution %s)", identity, ctx.executionId());
        });
    }

    // ========================================================================
    // Membership
    // ========================================================================

    /**
     * Add a direct member.
     *
     * @return false if the subject already was a direct member; nothing changes then
     */
    public boolean addMember(GroupIdentity group, Subject member, RequestContext ctx) {
        return tx.serializableWrite("addMember", ctx, () -> {
            if (!groupRepo.exists(group)) {
                throw notFound(group);
            }
            requireSubjectExists(member);
            if (member instanceof GroupIdentity memberGroup) {
                requireNoCycle(group, memberGroup);
            }

            if (!groupRepo.insertMember(group, member)) {
                return false;
            }
            groupRepo.incrementVersion(group, Instant.now());
            membershipIndex.onMemberAdded(group, member);
            publisher.publish(group, Set.of(member), ctx);
            return true;
        });
    }

    /**
     * Remove a direct member.
     *
     * @return false if the subject was not a direct member
     */
    public boolean removeMember(GroupIdentity group, Subject member, RequestContext ctx) {
        return tx.serializableWrite("removeMember", ctx, () -> {
            if (!groupRepo.exists(group)) {
                throw notFound(group);
            }
            if (!groupRepo.deleteMember(group, member)) {
                return false;
            }
            groupRepo.incrementVersion(group, Instant.now());
            membershipIndex.onMemberRemoved(group, member);
            publisher.publish(group, Set.of(member), ctx);
            return true;
        });
    }

    /**
     * Replace all direct members at once. The version is bumped once if anything changed.
     *
     * @return the subjects added or removed
     */
    public Set<Subject> replaceMembers(GroupIdentity group, Set<? extends Subject> members, RequestContext ctx) {
        return tx.serializableWrite("replaceMembers", ctx, () -> {
            if (!groupRepo.exists(group)) {
                throw notFound(group);
            }
            Set<Subject> current = groupRepo.findDirectMembers(group);

            Set<Subject> added = new LinkedHashSet<>(members);
            added.removeAll(current);
            Set<Subject> removed = new LinkedHashSet<>(current);
            removed.removeAll(members);
            if (added.isEmpty() && removed.isEmpty()) {
                return Set.of();
            }

            for (Subject member : added) {
                requireSubjectExists(member);
                if (member instanceof GroupIdentity memberGroup) {
                    requireNoCycle(group, memberGroup);
                }
            }
            removed.forEach(member -> groupRepo.deleteMember(group, member));
            added.forEach(member -> groupRepo.insertMember(group, member));
            groupRepo.incrementVersion(group, Instant.now());
            membershipIndex.onMembersReplaced(group);

            Set<Subject> changed = new LinkedHashSet<>(added);
            changed.addAll(removed);
            publisher.publish(group, changed, ctx);
            return changed;
        });
    }

    /**
     * Record that the grants of a policy changed and notify the mirror.
     *
     * @param bumpVersion false when the same transaction already bumped the version
     *                    for a membership change
     */
    public void recordGrantsChanged(GroupIdentity policy, boolean bumpVersion, RequestContext ctx) {
        tx.serializableWrite("recordGrantsChanged", ctx, () -> {
            if (!groupRepo.exists(policy)) {
                throw notFound(policy);
            }
            if (bumpVersion) {
                groupRepo.incrementVersion(policy, Instant.now());
            }
            publisher.publishGrantsChanged(policy, ctx);
        });
    }

    public boolean isMember(GroupIdentity group, Subject subject, RequestContext ctx) {
        return tx.readOnly("isMember", ctx, () -> membershipIndex.isMember(group, subject));
    }

    /**
     * Groups and policies that list the subject directly.
     */
    public Set<GroupIdentity> listDirectMemberships(Subject subject, RequestContext ctx) {
        return tx.readOnly("listDirectMemberships", ctx, () -> groupRepo.findDirectParents(subject));
    }

    /**
     * Plain groups (not policies) that list the group directly.
     */
    public Set<GroupName> listParentGroups(GroupName group, RequestContext ctx) {
        return tx.readOnly("listParentGroups", ctx, () -> groupRepo.findDirectParents(group).stream()
            .filter(GroupName.class::isInstance)
            .map(GroupName.class::cast)
            .collect(Collectors.toSet()));
    }

    public Set<GroupIdentity> listAncestorGroups(Subject subject, RequestContext ctx) {
        return tx.readOnly("listAncestorGroups", ctx, () -> membershipIndex.listAncestorGroups(subject));
    }

    public Set<UserId> listFlattenedMembers(GroupIdentity group, RequestContext ctx) {
        return tx.readOnly("listFlattenedMembers", ctx, () -> membershipIndex.listFlattenedMembers(group));
    }

    public Set<UserId> intersectGroups(Set<? extends GroupIdentity> groups, RequestContext ctx) {
        return tx.readOnly("intersectGroups", ctx, () -> membershipIndex.intersectGroups(groups));
    }

    public int rebuildFlattenedMembership(RequestContext ctx) {
        return tx.serializableWrite("rebuildFlattenedMembership", ctx, membershipIndex::rebuildAll);
    }

    /**
     * Resolve an email to a user, group or policy.
     */
    public Optional<Subject> loadSubjectFromEmail(String email, RequestContext ctx) {
        return tx.readOnly("loadSubjectFromEmail", ctx, () -> {
            Optional<UserId> user = userRepo.findIdByEmail(email);
            if (user.isPresent()) {
                return Optional.<Subject>of(user.get());
            }
            return groupRepo.findIdentityByEmail(email).map(Subject.class::cast);
        });
    }

    // ========================================================================
    // Synchronization bookkeeping
    // ========================================================================

    /**
     * Record that a mirror finished syncing {@code snapshot}. Applies only when the
     * snapshot's version is newer than the last recorded sync, so a slow sync cannot
     * overwrite a faster one.
     *
     * @return true if the record was advanced
     */
    public boolean updateSynchronizedDateAndVersion(Group snapshot, RequestContext ctx) {
        return tx.serializableWrite("updateSynchronizedDateAndVersion", ctx, () -> {
            boolean applied = groupRepo.updateSynchronized(snapshot.identity, snapshot.version, Instant.now());
            if (!applied) {
                LOG.debugf("Ignored stale sync of %s at version %d", snapshot.identity, snapshot.version);
            }
            return applied;
        });
    }

    public Optional<Instant> getSynchronizedDate(GroupIdentity identity, RequestContext ctx) {
        return loadGroup(identity, ctx).map(group -> group.synchronizedAt);
    }

    /**
     * The group email, only once the group has been synchronized at least once.
     */
    public Optional<String> getSynchronizedEmail(GroupIdentity identity, RequestContext ctx) {
        return loadGroup(identity, ctx)
            .filter(group -> group.synchronizedAt != null)
            .map(group -> group.email);
    }

    public Optional<String> getAccessInstructions(GroupName group, RequestContext ctx) {
        return tx.readOnly("getAccessInstructions", ctx, () -> {
            if (!groupRepo.exists(group)) {
                throw notFound(group);
            }
            return groupRepo.findAccessInstructions(group);
        });
    }

    public void setAccessInstructions(GroupName group, String instructions, RequestContext ctx) {
        tx.serializableWrite("setAccessInstructions", ctx, () -> {
            if (!groupRepo.exists(group)) {
                throw notFound(group);
            }
            groupRepo.setAccessInstructions(group, instructions, Instant.now());
        });
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void requireSubjectExists(Subject subject) {
        boolean exists = subject instanceof UserId user
            ? userRepo.exists(user)
            : groupRepo.exists((GroupIdentity) subject);
        if (!exists) {
            throw IamErrors.notFound("SUBJECT_NOT_FOUND",
                "Subject " + subject + " does not exist",
                Map.of("subject", subject.key()));
        }
    }

    /**
     * Adding {@code member} to {@code group} closes a cycle when the two are the same
     * or {@code group} is already reachable from {@code member}.
     */
    private void requireNoCycle(GroupIdentity group, GroupIdentity member) {
        if (!member.equals(group) && !membershipIndex.isMember(member, group)) {
            return;
        }
        GroupIdentity linking = member.equals(group) ? group : findLinkingChild(member, group);
        String memberEmail = groupRepo.findEmail(member).orElse("unknown");
        throw IamErrors.invalidGraph("MEMBERSHIP_CYCLE",
            "Could not add " + describe(member) + " <" + memberEmail + "> to " + describe(group)
                + ": it already contains " + describe(group) + " through " + describe(linking),
            Map.of("group", group.key(), "member", member.key(), "linkingGroup", linking.key()));
    }

    /**
     * The direct child of {@code from} on a path down to {@code target}.
     */
    private GroupIdentity findLinkingChild(GroupIdentity from, GroupIdentity target) {
        for (Subject child : groupRepo.findDirectMembers(from)) {
            if (child instanceof GroupIdentity childGroup
                && (childGroup.equals(target) || membershipIndex.isMember(childGroup, target))) {
                return childGroup;
            }
        }
        return from;
    }

    static String describe(GroupIdentity identity) {
        return identity instanceof PolicyId ? "policy " + identity : "group " + identity;
    }

    private static RuntimeException notFound(GroupIdentity identity) {
        return IamErrors.notFound("GROUP_NOT_FOUND",
            describe(identity) + " does not exist",
            Map.of("group", identity.key()));
    }
}
