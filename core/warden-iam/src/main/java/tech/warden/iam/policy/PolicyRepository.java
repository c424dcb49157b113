package tech.warden.iam.policy;

import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.PolicyId;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for policy grants. The policy's group row must exist before
 * {@link #insert(PolicyGrants)}.
 */
public interface PolicyRepository {

    Optional<PolicyGrants> findById(PolicyId id);

    List<PolicyGrants> findByResource(FullyQualifiedResourceId resource);

    List<PolicyGrants> findByIds(Collection<PolicyId> ids);

    /**
     * Public policies on resources of the given type, or of every type when null.
     */
    List<PolicyGrants> findPublic(String resourceTypeName);

    void insert(PolicyGrants grants);

    void update(PolicyGrants grants);

    boolean delete(PolicyId id);
}
