package tech.warden.iam.user.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.warden.iam.user.User;
import tech.warden.iam.user.entity.UserEntity;
import tech.warden.iam.user.mapper.UserMapper;

import java.time.Instant;

/**
 * Write-side repository for User entities.
 */
@ApplicationScoped
public class UserWriteRepository implements PanacheRepositoryBase<UserEntity, String> {

    public void persistUser(User user) {
        if (user.createdAt == null) {
            user.createdAt = Instant.now();
        }
        user.updatedAt = user.createdAt;
        persist(UserMapper.toEntity(user));
    }

    public void updateEnabled(String id, boolean enabled, Instant updatedAt) {
        UserEntity entity = findById(id);
        if (entity != null) {
            entity.enabled = enabled;
            entity.updatedAt = updatedAt;
        }
    }

    public boolean deleteUserById(String id) {
        return deleteById(id);
    }
}
