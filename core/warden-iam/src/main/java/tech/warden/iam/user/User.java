package tech.warden.iam.user;

import tech.warden.iam.subject.UserId;

import java.time.Instant;

/**
 * A human or service user known to the directory.
 *
 * <p>Disabled users keep their memberships but are granted nothing.
 */
public class User {

    public UserId id;

    public String email;

    public boolean enabled = true;

    public Instant createdAt;

    public Instant updatedAt;

    public User() {
    }

    public User(UserId id, String email) {
        this.id = id;
        this.email = email;
    }
}
