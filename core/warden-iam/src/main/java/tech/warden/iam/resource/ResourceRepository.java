package tech.warden.iam.resource;

import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Resource entities and the resource hierarchy.
 */
public interface ResourceRepository {

    Optional<Resource> findById(FullyQualifiedResourceId id);

    boolean exists(FullyQualifiedResourceId id);

    Optional<FullyQualifiedResourceId> findParent(FullyQualifiedResourceId id);

    List<FullyQualifiedResourceId> findChildren(FullyQualifiedResourceId id);

    /**
     * Resources whose auth domain includes the group.
     */
    List<FullyQualifiedResourceId> findByAuthDomainGroup(GroupName group);

    void insert(Resource resource);

    /**
     * @param parent null to detach
     */
    void setParent(FullyQualifiedResourceId child, FullyQualifiedResourceId parent);

    boolean delete(FullyQualifiedResourceId id);
}
