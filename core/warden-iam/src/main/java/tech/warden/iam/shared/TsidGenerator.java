package tech.warden.iam.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation.
 *
 * Typed ids have the form "{prefix}_{tsid}" (e.g., "res_0HZXEQ5Y8JY5Z"): time-sortable,
 * URL-safe and self-describing in logs.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    private TsidGenerator() {
    }

    /**
     * Generate a new typed ID for the given entity type.
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Generate a raw TSID without prefix, for execution ids and email local parts.
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }
}
