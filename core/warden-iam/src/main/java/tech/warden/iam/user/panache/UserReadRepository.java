package tech.warden.iam.user.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.user.User;
import tech.warden.iam.user.UserRepository;
import tech.warden.iam.user.entity.UserEntity;
import tech.warden.iam.user.mapper.UserMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-side repository for User entities.
 * Uses EntityManager directly to return domain objects.
 */
@ApplicationScoped
public class UserReadRepository implements UserRepository {

    @Inject
    EntityManager em;

    @Inject
    UserWriteRepository writeRepo;

    @Override
    public Optional<User> findById(UserId id) {
        return Optional.ofNullable(UserMapper.toDomain(em.find(UserEntity.class, id.value())));
    }

    @Override
    public Optional<UserId> findIdByEmail(String email) {
        return em.createQuery("SELECT e.id FROM UserEntity e WHERE lower(e.email) = lower(:email)", String.class)
            .setParameter("email", email)
            .getResultStream()
            .findFirst()
            .map(UserId::new);
    }

    @Override
    public boolean exists(UserId id) {
        Long count = em.createQuery("SELECT COUNT(e) FROM UserEntity e WHERE e.id = :id", Long.class)
            .setParameter("id", id.value())
            .getSingleResult();
        return count > 0;
    }

    @Override
    public boolean existsByEmail(String email) {
        return findIdByEmail(email).isPresent();
    }

    // Write operations delegate to WriteRepository
    @Override
    public void insert(User user) {
        writeRepo.persistUser(user);
    }

    @Override
    public void setEnabled(UserId id, boolean enabled, Instant updatedAt) {
        writeRepo.updateEnabled(id.value(), enabled, updatedAt);
    }

    @Override
    public boolean delete(UserId id) {
        return writeRepo.deleteUserById(id.value());
    }
}
