package tech.warden.iam.resource;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamErrors;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.group.flat.MembershipIndex;
import tech.warden.iam.mirror.GroupChangePublisher;
import tech.warden.iam.policy.AccessPolicyMembership;
import tech.warden.iam.policy.PolicyGrants;
import tech.warden.iam.policy.PolicyRepository;
import tech.warden.iam.policy.PolicyService;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resource types, resources and the resource hierarchy.
 */
@ApplicationScoped
public class ResourceService {

    private static final Logger LOG = Logger.getLogger(ResourceService.class);

    private final TransactionRunner tx;
    private final ResourceRepository resourceRepo;
    private final ResourceTypeRepository typeRepo;
    private final ResourceTypeRegistry typeRegistry;
    private final PolicyRepository policyRepo;
    private final PolicyService policyService;
    private final GroupRepository groupRepo;
    private final MembershipIndex membershipIndex;
    private final GroupChangePublisher publisher;

    @Inject
    public ResourceService(TransactionRunner tx, ResourceRepository resourceRepo, ResourceTypeRepository typeRepo,
                           ResourceTypeRegistry typeRegistry, PolicyRepository policyRepo, PolicyService policyService,
                           GroupRepository groupRepo, MembershipIndex membershipIndex,
                           GroupChangePublisher publisher) {
        this.tx = tx;
        this.resourceRepo = resourceRepo;
        this.typeRepo = typeRepo;
        this.typeRegistry = typeRegistry;
        this.policyRepo = policyRepo;
        this.policyService = policyService;
        this.groupRepo = groupRepo;
        this.membershipIndex = membershipIndex;
        this.publisher = publisher;
    }

    // ========================================================================
    // Resource types
    // ========================================================================

    /**
     * Store a resource type and make it available to evaluation. Idempotent.
     */
    public ResourceType createResourceType(ResourceType type, RequestContext ctx) {
        if (type.ownerRoleName() != null && type.role(type.ownerRoleName()).isEmpty()) {
            throw IamErrors.validation("UNKNOWN_OWNER_ROLE",
                "Owner role " + type.ownerRoleName() + " is not defined on resource type " + type.name(),
                Map.of("resourceType", type.name(), "role", type.ownerRoleName()));
        }
        tx.serializableWrite("createResourceType", ctx, () -> typeRepo.upsert(type));
        typeRegistry.register(type);
        return type;
    }

    public Collection<ResourceType> listResourceTypes() {
        return typeRegistry.all();
    }

    // ========================================================================
    // Resources
    // ========================================================================

    /**
     * Create a resource and, when its type has an owner role, an owner policy with
     * the creator as its only member.
     *
     * @param parent  null for a root resource
     * @param creator null for resources created by the system
     */
    public Resource createResource(String resourceTypeName, String resourceId, Set<GroupName> authDomain,
                                   FullyQualifiedResourceId parent, UserId creator, RequestContext ctx) {
        ResourceType type = typeRegistry.require(resourceTypeName);
        return tx.serializableWrite("createResource", ctx, () -> {
            FullyQualifiedResourceId id = new FullyQualifiedResourceId(resourceTypeName, resourceId);
            if (resourceRepo.exists(id)) {
                throw IamErrors.conflict("RESOURCE_EXISTS",
                    "Resource " + id + " already exists",
                    Map.of("resource", id.toString()));
            }
            for (GroupName group : authDomain) {
                if (!groupRepo.exists(group)) {
                    throw IamErrors.notFound("AUTH_DOMAIN_GROUP_NOT_FOUND",
                        "Auth domain group " + group + " does not exist",
                        Map.of("group", group.value()));
                }
            }
            if (parent != null) {
                requireResource(parent);
            }

            Resource resource = new Resource(resourceTypeName, resourceId);
            resource.authDomain = new HashSet<>(authDomain);
            resource.parent = parent;
            resource.createdAt = Instant.now();
            resourceRepo.insert(resource);

            type.ownerRole().ifPresent(ownerRole -> {
                Set<Subject> members = creator != null ? Set.of(creator) : Set.of();
                policyService.createPolicy(new PolicyId(id, ownerRole),
                    AccessPolicyMembership.ofRoles(members, Set.of(ownerRole)), ctx);
            });

            LOG.debugf("Created resource %s (execution %s)", id, ctx.executionId());
            return resource;
        });
    }

    public Optional<Resource> loadResource(FullyQualifiedResourceId id, RequestContext ctx) {
        return tx.readOnly("loadResource", ctx, () -> resourceRepo.findById(id));
    }

    public Set<GroupName> loadResourceAuthDomain(FullyQualifiedResourceId id, RequestContext ctx) {
        return loadResource(id, ctx).map(resource -> resource.authDomain).orElseThrow(() -> notFound(id));
    }

    /**
     * Delete a resource and all of its policies.
     *
     * <p>Refused while the resource has children, or while one of its policies is a
     * member of a group that does not belong to the resource.
     */
    public void deleteResource(FullyQualifiedResourceId id, RequestContext ctx) {
        tx.serializableWrite("deleteResource", ctx, () -> {
            requireResource(id);
            List<FullyQualifiedResourceId> children = resourceRepo.findChildren(id);
            if (!children.isEmpty()) {
                throw IamErrors.referentialIntegrity("RESOURCE_HAS_CHILDREN",
                    "Cannot delete " + id + ": it is the parent of " + children.get(0),
                    Map.of("resource", id.toString(), "child", children.get(0).toString()));
            }

            List<PolicyId> policies = policyRepo.findByResource(id).stream().map(PolicyGrants::id).toList();
            for (PolicyId policy : policies) {
                for (GroupIdentity parent : groupRepo.findDirectParents(policy)) {
                    boolean sameResource = parent instanceof PolicyId parentPolicy && parentPolicy.resource().equals(id);
                    if (!sameResource) {
                        throw IamErrors.referentialIntegrity("POLICY_IN_USE",
                            "Cannot delete " + id + ": policy " + policy.policyName() + " is a member of " + parent,
                            Map.of("resource", id.toString(), "policy", policy.key(), "containingGroup", parent.key()));
                    }
                }
            }

            for (PolicyId policy : policies) {
                publisher.publishDeleted(policy, groupRepo.findDirectMembers(policy), ctx);
            }
            for (PolicyId policy : policies) {
                membershipIndex.onSubjectDeleted(policy);
            }
            for (PolicyId policy : policies) {
                policyRepo.delete(policy);
                groupRepo.delete(policy);
            }
            resourceRepo.delete(id);
            LOG.infof("Deleted resource %s and %d policies (execution %s)", id, policies.size(), ctx.executionId());
        });
    }

    // ========================================================================
    // Hierarchy
    // ========================================================================

    /**
     * Attach {@code child} under {@code parent}.
     *
     * @throws tech.warden.iam.common.errors.IamException InvalidGraph if {@code parent}
     *         is {@code child} or already one of its descendants
     */
    public void setParent(FullyQualifiedResourceId child, FullyQualifiedResourceId parent, RequestContext ctx) {
        tx.serializableWrite("setParent", ctx, () -> {
            requireResource(child);
            requireResource(parent);

            FullyQualifiedResourceId previous = null;
            FullyQualifiedResourceId current = parent;
            Set<FullyQualifiedResourceId> visited = new HashSet<>();
            while (current != null && visited.add(current)) {
                if (current.equals(child)) {
                    FullyQualifiedResourceId linking = previous != null ? previous : parent;
                    throw IamErrors.invalidGraph("RESOURCE_CYCLE",
                        "Cannot set parent of " + child + " to " + parent + ": " + linking
                            + " is already a descendant of " + child,
                        Map.of("resource", child.toString(), "parent", parent.toString(), "linkingResource", linking.toString()));
                }
                previous = current;
                current = resourceRepo.findParent(current).orElse(null);
            }

            resourceRepo.setParent(child, parent);
            LOG.debugf("Set parent of %s to %s (execution %s)", child, parent, ctx.executionId());
        });
    }

    public Optional<FullyQualifiedResourceId> getParent(FullyQualifiedResourceId child, RequestContext ctx) {
        return tx.readOnly("getParent", ctx, () -> {
            requireResource(child);
            return resourceRepo.findParent(child);
        });
    }

    /**
     * Detach a resource from its parent.
     *
     * @return false if it had no parent
     */
    public boolean deleteParent(FullyQualifiedResourceId child, RequestContext ctx) {
        return tx.serializableWrite("deleteParent", ctx, () -> {
            requireResource(child);
            if (resourceRepo.findParent(child).isEmpty()) {
                return false;
            }
            resourceRepo.setParent(child, null);
            return true;
        });
    }

    public List<FullyQualifiedResourceId> listChildren(FullyQualifiedResourceId parent, RequestContext ctx) {
        return tx.readOnly("listChildren", ctx, () -> {
            requireResource(parent);
            return resourceRepo.findChildren(parent);
        });
    }

    /**
     * Ancestors from the direct parent up to the root.
     */
    public List<FullyQualifiedResourceId> listAncestors(FullyQualifiedResourceId id, RequestContext ctx) {
        return tx.readOnly("listAncestors", ctx, () -> {
            requireResource(id);
            Set<FullyQualifiedResourceId> ancestors = new LinkedHashSet<>();
            Optional<FullyQualifiedResourceId> current = resourceRepo.findParent(id);
            while (current.isPresent() && ancestors.add(current.get())) {
                current = resourceRepo.findParent(current.get());
            }
            return List.copyOf(ancestors);
        });
    }

    private void requireResource(FullyQualifiedResourceId id) {
        if (!resourceRepo.exists(id)) {
            throw notFound(id);
        }
    }

    private static RuntimeException notFound(FullyQualifiedResourceId id) {
        return IamErrors.notFound("RESOURCE_NOT_FOUND",
            "Resource " + id + " does not exist",
            Map.of("resource", id.toString()));
    }
}
