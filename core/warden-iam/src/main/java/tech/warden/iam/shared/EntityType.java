package tech.warden.iam.shared;

/**
 * Row types that get generated ids, with their 3-character prefixes.
 *
 * IDs are stored WITH the prefix: "{prefix}_{tsid}" (e.g., "grp_0HZXEQ5Y8JY5Z"),
 * 17 characters in total.
 */
public enum EntityType {

    GROUP("grp"),
    POLICY("pol"),
    GROUP_MEMBER("gme"),
    RESOURCE("res");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
