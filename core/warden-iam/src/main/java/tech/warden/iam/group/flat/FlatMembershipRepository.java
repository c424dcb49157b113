package tech.warden.iam.group.flat;

import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.util.Collection;
import java.util.Set;

/**
 * Rows of the flattened membership index: one per (ancestor group, reachable member).
 */
public interface FlatMembershipRepository {

    /**
     * Insert every (ancestor, member) pair. Existing pairs are left alone.
     */
    void insertAll(Collection<GroupIdentity> ancestors, Collection<Subject> members);

    void deleteByGroups(Collection<GroupIdentity> ancestors);

    /**
     * Drop every row where the subject is the member or the ancestor.
     */
    void deleteBySubject(Subject subject);

    void deleteAll();

    boolean exists(GroupIdentity ancestor, Subject member);

    Set<GroupIdentity> findAncestors(Subject member);

    /**
     * All reachable members, users and groups.
     */
    Set<Subject> findMembers(GroupIdentity ancestor);

    Set<UserId> findUserMembers(GroupIdentity ancestor);
}
