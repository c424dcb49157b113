package tech.warden.iam.subject;

import java.util.Objects;

public record UserId(String value) implements Subject {

    static final String KEY_PREFIX = "user:";

    public UserId {
        Objects.requireNonNull(value, "user id cannot be null");
    }

    @Override
    public String key() {
        return KEY_PREFIX + value;
    }

    @Override
    public String toString() {
        return value;
    }
}
