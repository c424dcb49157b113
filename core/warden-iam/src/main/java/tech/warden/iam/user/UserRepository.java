package tech.warden.iam.user;

import tech.warden.iam.subject.UserId;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for User entities.
 */
public interface UserRepository {

    Optional<User> findById(UserId id);

    Optional<UserId> findIdByEmail(String email);

    boolean exists(UserId id);

    boolean existsByEmail(String email);

    void insert(User user);

    void setEnabled(UserId id, boolean enabled, Instant updatedAt);

    boolean delete(UserId id);
}
