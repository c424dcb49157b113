package tech.warden.iam.resource;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * A regular expression naming the actions valid on a resource type.
 *
 * @param authDomainConstrainable actions matching this pattern also require
 *                                membership in every auth-domain group
 */
public record ActionPattern(String value, String description, boolean authDomainConstrainable) {

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    public boolean matches(String action) {
        return COMPILED.computeIfAbsent(value, Pattern::compile).matcher(action).matches();
    }
}
