package tech.warden.iam.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.resource.ActionPattern;
import tech.warden.iam.resource.ResourceRole;
import tech.warden.iam.resource.ResourceService;
import tech.warden.iam.resource.ResourceType;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the configured resource types at startup, persists them and fills the registry.
 */
@ApplicationScoped
@Startup
public class ResourceTypeBootstrap {

    private static final Logger LOG = Logger.getLogger(ResourceTypeBootstrap.class);

    @Inject
    WardenConfig config;

    @Inject
    ResourceService resourceService;

    void onStart(@Observes StartupEvent event) {
        LOG.info("Loading resource types...");

        RequestContext ctx = RequestContext.system();
        for (Map.Entry<String, WardenConfig.ResourceTypeConfig> entry : config.resourceTypes().entrySet()) {
            resourceService.createResourceType(toResourceType(entry.getKey(), entry.getValue()), ctx);
        }

        LOG.infof("Resource type loading complete. Registered %d types", config.resourceTypes().size());
    }

    static ResourceType toResourceType(String name, WardenConfig.ResourceTypeConfig typeConfig) {
        Set<ActionPattern> patterns = new LinkedHashSet<>();
        for (WardenConfig.ActionPatternConfig pattern : typeConfig.actionPatterns()) {
            patterns.add(new ActionPattern(pattern.value(), pattern.description(), pattern.authDomainConstrainable()));
        }

        Map<String, ResourceRole> roles = new HashMap<>();
        typeConfig.roles().forEach((roleName, role) -> {
            Map<String, Set<String>> descendantRoles = new HashMap<>();
            role.descendantRoles().forEach((type, names) -> descendantRoles.put(type, toSet(names)));
            roles.put(roleName, new ResourceRole(roleName, toSet(role.actions()), descendantRoles));
        });

        return new ResourceType(name, patterns, roles,
            typeConfig.ownerRoleName().orElse(null), typeConfig.reuseIds());
    }

    private static Set<String> toSet(List<String> values) {
        return new HashSet<>(values);
    }
}
