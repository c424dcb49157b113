package tech.warden.iam.user.mapper;

import tech.warden.iam.subject.UserId;
import tech.warden.iam.user.User;
import tech.warden.iam.user.entity.UserEntity;

/**
 * Mapper for converting between User domain model and JPA entity.
 */
public final class UserMapper {

    private UserMapper() {
    }

    public static User toDomain(UserEntity entity) {
        if (entity == null) {
            return null;
        }

        User domain = new User();
        domain.id = new UserId(entity.id);
        domain.email = entity.email;
        domain.enabled = entity.enabled;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static UserEntity toEntity(User domain) {
        if (domain == null) {
            return null;
        }

        UserEntity entity = new UserEntity();
        entity.id = domain.id.value();
        entity.email = domain.email;
        entity.enabled = domain.enabled;
        entity.createdAt = domain.createdAt;
        entity.updatedAt = domain.updatedAt;
        return entity;
    }
}
