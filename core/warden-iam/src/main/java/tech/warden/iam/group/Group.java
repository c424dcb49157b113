package tech.warden.iam.group;

import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.Subject;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A group of subjects. Access policies are groups too; their identity is a
 * {@link tech.warden.iam.subject.PolicyId}.
 *
 * <p>{@code version} starts at 1 and is bumped by exactly one on every
 * membership change of this group. {@code lastSynchronizedVersion} records the
 * version an external mirror last completed and never moves backwards.
 */
public class Group {

    public GroupIdentity identity;

    public String email;

    /**
     * Direct members only.
     */
    public Set<Subject> members = new HashSet<>();

    public int version = 1;

    public Integer lastSynchronizedVersion;

    public Instant synchronizedAt;

    public Instant createdAt;

    public Instant updatedAt;

    public String accessInstructions;

    public Group() {
    }

    public Group(GroupIdentity identity, String email) {
        this.identity = identity;
        this.email = email;
    }
}
