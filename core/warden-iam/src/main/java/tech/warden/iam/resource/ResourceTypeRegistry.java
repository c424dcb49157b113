package tech.warden.iam.resource;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.warden.iam.common.errors.IamErrors;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory lookup of resource types, filled at boot from configuration.
 *
 * <p>Evaluation reads types from here on every call, so it never hits the store
 * for type definitions.
 */
@ApplicationScoped
public class ResourceTypeRegistry {

    private static final Logger LOG = Logger.getLogger(ResourceTypeRegistry.class);

    private final Map<String, ResourceType> types = new ConcurrentHashMap<>();

    public void register(ResourceType type) {
        ResourceType previous = types.put(type.name(), type);
        if (previous != null && !previous.equals(type)) {
            LOG.infof("Replaced definition of resource type %s", type.name());
        }
    }

    public Optional<ResourceType> find(String name) {
        return Optional.ofNullable(types.get(name));
    }

    /**
     * @throws tech.warden.iam.common.errors.IamException ValidationError for an unknown type
     */
    public ResourceType require(String name) {
        ResourceType type = types.get(name);
        if (type == null) {
            throw IamErrors.validation("UNKNOWN_RESOURCE_TYPE",
                "Resource type " + name + " is not defined",
                Map.of("resourceType", String.valueOf(name)));
        }
        return type;
    }

    public Collection<ResourceType> all() {
        return List.copyOf(types.values());
    }
}
