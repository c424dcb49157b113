package tech.warden.iam.user;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamErrors;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.group.flat.MembershipIndex;
import tech.warden.iam.mirror.GroupChangePublisher;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * User records and the subject directory used by evaluation.
 */
@ApplicationScoped
public class UserService implements SubjectDirectory {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    private final TransactionRunner tx;
    private final UserRepository userRepo;
    private final GroupRepository groupRepo;
    private final MembershipIndex membershipIndex;
    private final GroupChangePublisher publisher;

    @Inject
    public UserService(TransactionRunner tx, UserRepository userRepo, GroupRepository groupRepo,
                       MembershipIndex membershipIndex, GroupChangePublisher publisher) {
        this.tx = tx;
        this.userRepo = userRepo;
        this.groupRepo = groupRepo;
        this.membershipIndex = membershipIndex;
        this.publisher = publisher;
    }

    public User createUser(UserId id, String email, RequestContext ctx) {
        return tx.serializableWrite("createUser", ctx, () -> {
            if (userRepo.exists(id)) {
                throw IamErrors.conflict("USER_EXISTS", "User " + id + " already exists", Map.of("userId", id.value()));
            }
            if (userRepo.existsByEmail(email) || groupRepo.findIdentityByEmail(email).isPresent()) {
                throw IamErrors.conflict("EMAIL_IN_USE", "Email " + email + " is already in use", Map.of("email", email));
            }
            User user = new User(id, email);
            user.createdAt = Instant.now();
            userRepo.insert(user);
            return user;
        });
    }

    @Override
    public Optional<User> loadUser(UserId id, RequestContext ctx) {
        return tx.readOnly("loadUser", ctx, () -> userRepo.findById(id));
    }

    /**
     * Delete a user along with its direct memberships. Each group the user leaves
     * gets a version bump and a mirror notification.
     */
    public void deleteUser(UserId id, RequestContext ctx) {
        tx.serializableWrite("deleteUser", ctx, () -> {
            if (!userRepo.exists(id)) {
                throw IamErrors.notFound("USER_NOT_FOUND", "User " + id + " does not exist", Map.of("userId", id.value()));
            }
            Instant now = Instant.now();
            Set<GroupIdentity> parents = groupRepo.findDirectParents(id);
            for (GroupIdentity parent : parents) {
                groupRepo.deleteMember(parent, id);
                groupRepo.incrementVersion(parent, now);
                publisher.publish(parent, Set.of(id), ctx);
            }
            membershipIndex.onSubjectDeleted(id);
            userRepo.delete(id);
            LOG.infof("Deleted user %s, removed from %d groups (execution %s)", id, parents.size(), ctx.executionId());
        });
    }

    public void enableUser(UserId id, RequestContext ctx) {
        setEnabled(id, true, ctx);
    }

    public void disableUser(UserId id, RequestContext ctx) {
        setEnabled(id, false, ctx);
    }

    private void setEnabled(UserId id, boolean enabled, RequestContext ctx) {
        tx.serializableWrite(enabled ? "enableUser" : "disableUser", ctx, () -> {
            if (!userRepo.exists(id)) {
                throw IamErrors.notFound("USER_NOT_FOUND", "User " + id + " does not exist", Map.of("userId", id.value()));
            }
            userRepo.setEnabled(id, enabled, Instant.now());
            LOG.infof("User %s %s (execution %s)", id, enabled ? "enabled" : "disabled", ctx.executionId());
        });
    }

    @Override
    public boolean isEnabled(Subject subject, RequestContext ctx) {
        if (!(subject instanceof UserId user)) {
            return false;
        }
        return loadUser(user, ctx).map(u -> u.enabled).orElse(false);
    }
}
