package tech.warden.iam.subject;

/**
 * Anything that can be a member of a group or be granted permissions.
 *
 * <p>Variants carry only their own identifying fields. Relationships between
 * subjects are always resolved through the stores by key, never by object
 * reference.
 */
public sealed interface Subject permits UserId, GroupIdentity {

    /**
     * Stable string form, unique across all subject kinds.
     */
    String key();

    /**
     * Parse a key produced by {@link #key()}.
     *
     * @throws IllegalArgumentException if the key has an unknown prefix or shape
     */
    static Subject fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Subject key cannot be null");
        }
        if (key.startsWith(UserId.KEY_PREFIX)) {
            return new UserId(key.substring(UserId.KEY_PREFIX.length()));
        }
        if (key.startsWith(GroupName.KEY_PREFIX)) {
            return new GroupName(key.substring(GroupName.KEY_PREFIX.length()));
        }
        if (key.startsWith(PolicyId.KEY_PREFIX)) {
            return PolicyId.parseKeyBody(key.substring(PolicyId.KEY_PREFIX.length()));
        }
        throw new IllegalArgumentException("Unknown subject key: " + key);
    }
}
