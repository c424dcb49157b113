package tech.warden.iam.user;

import tech.warden.iam.common.RequestContext;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.util.Optional;

/**
 * What evaluation needs to know about subjects beyond the membership graph.
 */
public interface SubjectDirectory {

    Optional<User> loadUser(UserId id, RequestContext ctx);

    /**
     * True only for existing, enabled users. Groups and policies are never enabled.
     */
    boolean isEnabled(Subject subject, RequestContext ctx);
}
