package tech.warden.iam.group;

import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.Subject;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for group rows and their direct membership edges.
 * The flattened closure lives in {@link tech.warden.iam.group.flat.FlatMembershipRepository}.
 */
public interface GroupRepository {

    /**
     * Load a group with its direct members.
     */
    Optional<Group> findByIdentity(GroupIdentity identity);

    boolean exists(GroupIdentity identity);

    Optional<String> findEmail(GroupIdentity identity);

    Map<GroupIdentity, String> findEmails(Collection<GroupIdentity> identities);

    Optional<GroupIdentity> findIdentityByEmail(String email);

    List<GroupIdentity> listAllIdentities();

    /**
     * Insert the group row and the edges to its initial members.
     */
    void insert(Group group);

    /**
     * Delete the group row and its outgoing edges.
     */
    boolean delete(GroupIdentity identity);

    /**
     * @return false if the edge already existed
     */
    boolean insertMember(GroupIdentity group, Subject member);

    /**
     * @return false if there was no such edge
     */
    boolean deleteMember(GroupIdentity group, Subject member);

    Set<Subject> findDirectMembers(GroupIdentity group);

    /**
     * Groups and policies that list the subject as a direct member.
     */
    Set<GroupIdentity> findDirectParents(Subject member);

    void incrementVersion(GroupIdentity group, Instant updatedAt);

    /**
     * Record a completed sync of {@code version}, only if it is newer than the
     * last recorded one.
     *
     * @return true if the row was updated
     */
    boolean updateSynchronized(GroupIdentity group, int version, Instant synchronizedAt);

    Optional<String> findAccessInstructions(GroupName group);

    void setAccessInstructions(GroupName group, String instructions, Instant updatedAt);
}
