package tech.warden.iam.evaluation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamErrors;
import tech.warden.iam.group.flat.MembershipIndex;
import tech.warden.iam.policy.AccessPolicyDescendantPermissions;
import tech.warden.iam.policy.PolicyGrants;
import tech.warden.iam.policy.PolicyRepository;
import tech.warden.iam.resource.Resource;
import tech.warden.iam.resource.ResourceRepository;
import tech.warden.iam.resource.ResourceType;
import tech.warden.iam.resource.ResourceTypeRegistry;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.user.SubjectDirectory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Answers permission checks and listings.
 *
 * <p>Permissions are the union over every policy that includes the subject, either
 * as a flattened member or because the policy is public:
 * <ul>
 *   <li>policies on the resource contribute their actions and the actions of their roles;</li>
 *   <li>policies on each ancestor contribute the descendant permissions they declare for the
 *       resource's type, plus the descendant roles their roles declare for that type.</li>
 * </ul>
 *
 * <p>When the resource has an auth domain, actions matching an auth-domain-constrainable
 * pattern also require membership in every auth-domain group. Disabled and unknown users,
 * and missing resources, get nothing. Unknown types and invalid actions are errors.
 */
@ApplicationScoped
public class PolicyEvaluator {

    private static final Logger LOG = Logger.getLogger(PolicyEvaluator.class);

    private final TransactionRunner tx;
    private final ResourceTypeRegistry typeRegistry;
    private final ResourceRepository resourceRepo;
    private final PolicyRepository policyRepo;
    private final MembershipIndex membershipIndex;
    private final SubjectDirectory directory;

    @Inject
    public PolicyEvaluator(TransactionRunner tx, ResourceTypeRegistry typeRegistry, ResourceRepository resourceRepo,
                           PolicyRepository policyRepo, MembershipIndex membershipIndex, SubjectDirectory directory) {
        this.tx = tx;
        this.typeRegistry = typeRegistry;
        this.resourceRepo = resourceRepo;
        this.policyRepo = policyRepo;
        this.membershipIndex = membershipIndex;
        this.directory = directory;
    }

    /**
     * Receives the roles and actions one matching policy grants on the evaluated resource.
     * Returning true stops the scan.
     */
    @FunctionalInterface
    private interface GrantVisitor {
        boolean visit(PolicyGrants source, boolean inherited, Set<String> roles, Set<String> actions);
    }

    // ========================================================================
    // Checks
    // ========================================================================

    public boolean hasPermission(FullyQualifiedResourceId resource, String action, Subject subject, RequestContext ctx) {
        ResourceType type = typeRegistry.require(resource.resourceTypeName());
        requireValidAction(type, action);

        return tx.readOnly("hasPermission", ctx, () -> {
            Optional<Resource> loaded = loadForSubject(resource, subject, ctx);
            if (loaded.isEmpty()) {
                return false;
            }
            if (type.isAuthDomainConstrainable(action) && !inAuthDomain(loaded.get(), subject)) {
                return false;
            }
            boolean granted = scan(loaded.get(), type, subject,
                (source, inherited, roles, actions) -> actions.contains(action));
            LOG.debugf("hasPermission %s %s %s = %s (execution %s)", resource, action, subject, granted, ctx.executionId());
            return granted;
        });
    }

    /**
     * True if the subject holds at least one of the actions.
     */
    public boolean hasAnyPermission(FullyQualifiedResourceId resource, Set<String> actions, Subject subject,
                                    RequestContext ctx) {
        Set<String> granted = listUserResourceActions(resource, subject, ctx);
        return actions.stream().anyMatch(granted::contains);
    }

    // ========================================================================
    // Listings
    // ========================================================================

    public Set<String> listUserResourceActions(FullyQualifiedResourceId resource, Subject subject, RequestContext ctx) {
        ResourceType type = typeRegistry.require(resource.resourceTypeName());
        return tx.readOnly("listUserResourceActions", ctx, () -> {
            Optional<Resource> loaded = loadForSubject(resource, subject, ctx);
            if (loaded.isEmpty()) {
                return Set.<String>of();
            }
            Set<String> result = new HashSet<>();
            scan(loaded.get(), type, subject, (source, inherited, roles, actions) -> {
                result.addAll(actions);
                return false;
            });
            if (!inAuthDomain(loaded.get(), subject)) {
                result.removeIf(type::isAuthDomainConstrainable);
            }
            return result;
        });
    }

    /**
     * Roles held directly or inherited through descendant grants. Auth domains do not
     * filter roles, only actions.
     */
    public Set<String> listUserResourceRoles(FullyQualifiedResourceId resource, Subject subject, RequestContext ctx) {
        ResourceType type = typeRegistry.require(resource.resourceTypeName());
        return tx.readOnly("listUserResourceRoles", ctx, () -> {
            Optional<Resource> loaded = loadForSubject(resource, subject, ctx);
            if (loaded.isEmpty()) {
                return Set.<String>of();
            }
            Set<String> result = new HashSet<>();
            scan(loaded.get(), type, subject, (source, inherited, roles, actions) -> {
                result.addAll(roles);
                return false;
            });
            return result;
        });
    }

    /**
     * Every resource of the type where the subject is included in some policy, directly,
     * via a public policy, or via descendant grants on an ancestor.
     */
    public Map<String, Set<String>> listResourcesAndRoles(String resourceTypeName, Subject subject, RequestContext ctx) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (FilteredResource resource : listResources(resourceTypeName, subject, ctx)) {
            result.put(resource.resourceId(), resource.roles());
        }
        return result;
    }

    public Set<FilteredResource> listResources(String resourceTypeName, Subject subject, RequestContext ctx) {
        ResourceType type = typeRegistry.require(resourceTypeName);
        return tx.readOnly("listResources", ctx, () -> {
            if (!directory.isEnabled(subject, ctx)) {
                return Set.<FilteredResource>of();
            }

            Map<PolicyId, PolicyGrants> candidates = new LinkedHashMap<>();
            List<PolicyId> memberOf = membershipIndex.listAncestorGroups(subject).stream()
                .filter(PolicyId.class::isInstance)
                .map(PolicyId.class::cast)
                .toList();
            policyRepo.findByIds(memberOf).forEach(p -> candidates.put(p.id(), p));
            policyRepo.findPublic(null).forEach(p -> candidates.putIfAbsent(p.id(), p));

            Map<FullyQualifiedResourceId, Accumulator> found = new LinkedHashMap<>();
            for (PolicyGrants policy : candidates.values()) {
                FullyQualifiedResourceId owner = policy.id().resource();
                if (owner.resourceTypeName().equals(resourceTypeName)) {
                    Accumulator acc = found.computeIfAbsent(owner, k -> new Accumulator());
                    acc.policies.add(policy.id().policyName());
                    acc.roles.addAll(policy.roles());
                    acc.actions.addAll(policy.actions());
                    acc.actions.addAll(type.actionsOf(policy.roles()));
                    acc.isPublic |= policy.isPublic();
                }
                addDescendantGrants(policy, type, found);
            }

            Set<FilteredResource> result = new HashSet<>();
            for (Map.Entry<FullyQualifiedResourceId, Accumulator> entry : found.entrySet()) {
                Optional<Resource> resource = resourceRepo.findById(entry.getKey());
                if (resource.isEmpty()) {
                    continue;
                }
                Accumulator acc = entry.getValue();
                if (!inAuthDomain(resource.get(), subject)) {
                    acc.actions.removeIf(type::isAuthDomainConstrainable);
                }
                result.add(new FilteredResource(resourceTypeName, entry.getKey().resourceId(),
                    Set.copyOf(acc.policies), Set.copyOf(acc.roles), Set.copyOf(acc.actions), acc.isPublic));
            }
            return result;
        });
    }

    /**
     * Users that belong to every group of the resource's auth domain. Empty when the
     * resource has no auth domain.
     */
    public Set<UserId> listAuthDomainMembers(FullyQualifiedResourceId resource, RequestContext ctx) {
        return tx.readOnly("listAuthDomainMembers", ctx, () -> {
            Resource loaded = resourceRepo.findById(resource).orElseThrow(() -> IamErrors.notFound(
                "RESOURCE_NOT_FOUND", "Resource " + resource + " does not exist", Map.of("resource", resource.toString())));
            return membershipIndex.intersectGroups(loaded.authDomain);
        });
    }

    // ========================================================================
    // Traversal
    // ========================================================================

    private Optional<Resource> loadForSubject(FullyQualifiedResourceId resource, Subject subject, RequestContext ctx) {
        if (!directory.isEnabled(subject, ctx)) {
            return Optional.empty();
        }
        return resourceRepo.findById(resource);
    }

    /**
     * Feeds the visitor every grant that applies to {@code resource}: direct policies
     * first, then ancestors from the parent upwards.
     */
    private boolean scan(Resource resource, ResourceType type, Subject subject, GrantVisitor visitor) {
        for (PolicyGrants policy : policyRepo.findByResource(resource.fullyQualifiedId())) {
            if (!includes(policy, subject)) {
                continue;
            }
            Set<String> actions = new HashSet<>(policy.actions());
            actions.addAll(type.actionsOf(policy.roles()));
            if (visitor.visit(policy, false, policy.roles(), actions)) {
                return true;
            }
        }

        Set<FullyQualifiedResourceId> visited = new HashSet<>();
        visited.add(resource.fullyQualifiedId());
        Optional<FullyQualifiedResourceId> ancestor = resourceRepo.findParent(resource.fullyQualifiedId());
        while (ancestor.isPresent() && visited.add(ancestor.get())) {
            for (PolicyGrants policy : policyRepo.findByResource(ancestor.get())) {
                Set<String> roles = inheritedRoles(policy, resource.resourceTypeName);
                Set<String> actions = inheritedActions(policy, type);
                actions.addAll(type.actionsOf(roles));
                if ((roles.isEmpty() && actions.isEmpty()) || !includes(policy, subject)) {
                    continue;
                }
                if (visitor.visit(policy, true, roles, actions)) {
                    return true;
                }
            }
            ancestor = resourceRepo.findParent(ancestor.get());
        }
        return false;
    }

    /**
     * Roles an ancestor policy grants on descendants of the given type: explicit
     * descendant permissions plus descendant roles of the policy's own roles.
     */
    private Set<String> inheritedRoles(PolicyGrants policy, String descendantType) {
        Set<String> roles = new HashSet<>();
        for (AccessPolicyDescendantPermissions descendant : policy.descendantPermissions()) {
            if (descendant.resourceType().equals(descendantType)) {
                roles.addAll(descendant.roles());
            }
        }
        typeRegistry.find(policy.id().resource().resourceTypeName())
            .ifPresent(ownerType -> roles.addAll(ownerType.descendantRolesOf(policy.roles(), descendantType)));
        return roles;
    }

    private static Set<String> inheritedActions(PolicyGrants policy, ResourceType descendantType) {
        Set<String> actions = new HashSet<>();
        for (AccessPolicyDescendantPermissions descendant : policy.descendantPermissions()) {
            if (descendant.resourceType().equals(descendantType.name())) {
                actions.addAll(descendant.actions());
            }
        }
        return actions;
    }

    /**
     * Walks the resources below the policy's resource and credits every one of the
     * listed type with what the policy grants there.
     */
    private void addDescendantGrants(PolicyGrants policy, ResourceType type,
                                     Map<FullyQualifiedResourceId, Accumulator> found) {
        Set<String> roles = inheritedRoles(policy, type.name());
        Set<String> actions = inheritedActions(policy, type);
        if (roles.isEmpty() && actions.isEmpty()) {
            return;
        }
        actions.addAll(type.actionsOf(roles));

        Set<FullyQualifiedResourceId> visited = new HashSet<>();
        Deque<FullyQualifiedResourceId> pending = new ArrayDeque<>(resourceRepo.findChildren(policy.id().resource()));
        while (!pending.isEmpty()) {
            FullyQualifiedResourceId current = pending.poll();
            if (!visited.add(current)) {
                continue;
            }
            if (current.resourceTypeName().equals(type.name())) {
                Accumulator acc = found.computeIfAbsent(current, k -> new Accumulator());
                acc.roles.addAll(roles);
                acc.actions.addAll(actions);
                acc.isPublic |= policy.isPublic();
            }
            pending.addAll(resourceRepo.findChildren(current));
        }
    }

    private boolean includes(PolicyGrants policy, Subject subject) {
        return policy.isPublic() || membershipIndex.isMember(policy.id(), subject);
    }

    private boolean inAuthDomain(Resource resource, Subject subject) {
        for (GroupName group : resource.authDomain) {
            if (!membershipIndex.isMember(group, subject)) {
                return false;
            }
        }
        return true;
    }

    private static void requireValidAction(ResourceType type, String action) {
        if (!type.isValidAction(action)) {
            throw IamErrors.validation("INVALID_ACTION",
                "Action " + action + " is not valid for resource type " + type.name(),
                Map.of("resourceType", type.name(), "action", String.valueOf(action)));
        }
    }

    private static final class Accumulator {
        final Set<String> policies = new HashSet<>();
        final Set<String> roles = new HashSet<>();
        final Set<String> actions = new HashSet<>();
        boolean isPublic;
    }
}
