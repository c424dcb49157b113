package tech.warden.iam.group.flat;

import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.util.Set;

/**
 * Materialized transitive closure of group membership.
 *
 * <p>The {@code on*} hooks must be called inside the same transaction as the
 * edge change they describe, after the edge has been written. Queries are single
 * lookups against the index, never graph walks.
 */
public interface MembershipIndex {

    void onMemberAdded(GroupIdentity parent, Subject child);

    /**
     * Called after the edge is deleted.
     */
    void onMemberRemoved(GroupIdentity parent, Subject child);

    /**
     * Called after the direct members of {@code group} were replaced wholesale.
     */
    void onMembersReplaced(GroupIdentity group);

    void onSubjectDeleted(Subject subject);

    /**
     * Recompute the whole index from the direct edges.
     *
     * @return number of groups rebuilt
     */
    int rebuildAll();

    boolean isMember(GroupIdentity group, Subject subject);

    /**
     * Every group and policy that transitively contains the subject.
     */
    Set<GroupIdentity> listAncestorGroups(Subject subject);

    /**
     * Every user transitively contained in the group.
     */
    Set<UserId> listFlattenedMembers(GroupIdentity group);

    /**
     * Users that are flattened members of every given group. Empty input gives an empty set.
     */
    Set<UserId> intersectGroups(Set<? extends GroupIdentity> groups);
}
