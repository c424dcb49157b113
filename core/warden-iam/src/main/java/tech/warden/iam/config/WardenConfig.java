package tech.warden.iam.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for the IAM engine.
 */
@ConfigMapping(prefix = "warden")
public interface WardenConfig {

    /**
     * Domain used for generated group and policy emails.
     */
    @WithDefault("warden.local")
    String emailDomain();

    Transactions transactions();

    /**
     * Resource types, keyed by type name. Loaded at boot and immutable afterwards.
     */
    Map<String, ResourceTypeConfig> resourceTypes();

    interface Transactions {
        /**
         * Retries after a serialization failure before giving up.
         */
        @WithDefault("3")
        int maxRetries();

        /**
         * Base backoff between retries; attempt n waits n times this.
         */
        @WithDefault("50ms")
        Duration retryBackoff();
    }

    interface ResourceTypeConfig {
        List<ActionPatternConfig> actionPatterns();

        Map<String, RoleConfig> roles();

        Optional<String> ownerRoleName();

        @WithDefault("false")
        boolean reuseIds();
    }

    interface ActionPatternConfig {
        String value();

        @WithDefault("")
        String description();

        @WithDefault("false")
        boolean authDomainConstrainable();
    }

    interface RoleConfig {
        List<String> actions();

        /**
         * Roles granted on descendant resources, keyed by descendant type name.
         */
        Map<String, List<String>> descendantRoles();
    }
}
