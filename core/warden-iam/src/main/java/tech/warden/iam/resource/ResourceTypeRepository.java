package tech.warden.iam.resource;

import java.util.List;
import java.util.Optional;

/**
 * Persisted copy of the configured resource types.
 */
public interface ResourceTypeRepository {

    /**
     * Insert the type or replace its stored definition.
     */
    void upsert(ResourceType type);

    Optional<ResourceType> findByName(String name);

    List<ResourceType> findAll();
}
