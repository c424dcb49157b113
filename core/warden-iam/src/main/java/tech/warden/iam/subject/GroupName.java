package tech.warden.iam.subject;

import java.util.Objects;

public record GroupName(String value) implements GroupIdentity {

    static final String KEY_PREFIX = "group:";

    public GroupName {
        Objects.requireNonNull(value, "group name cannot be null");
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
