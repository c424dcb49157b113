package tech.warden.iam.policy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamErrors;
import tech.warden.iam.config.WardenConfig;
import tech.warden.iam.group.Group;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.group.GroupService;
import tech.warden.iam.resource.ResourceRepository;
import tech.warden.iam.resource.ResourceType;
import tech.warden.iam.resource.ResourceTypeRegistry;
import tech.warden.iam.shared.TsidGenerator;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.Subject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Access policies: a group record plus grants, scoped to one resource.
 */
@ApplicationScoped
public class PolicyService {

    private static final Logger LOG = Logger.getLogger(PolicyService.class);

    private final TransactionRunner tx;
    private final PolicyRepository policyRepo;
    private final ResourceRepository resourceRepo;
    private final ResourceTypeRegistry typeRegistry;
    private final GroupService groupService;
    private final GroupRepository groupRepo;
    private final WardenConfig config;

    @Inject
    public PolicyService(TransactionRunner tx, PolicyRepository policyRepo, ResourceRepository resourceRepo,
                         ResourceTypeRegistry typeRegistry, GroupService groupService,
                         GroupRepository groupRepo, WardenConfig config) {
        this.tx = tx;
        this.policyRepo = policyRepo;
        this.resourceRepo = resourceRepo;
        this.typeRegistry = typeRegistry;
        this.groupService = groupService;
        this.groupRepo = groupRepo;
        this.config = config;
    }

    /**
     * @throws tech.warden.iam.common.errors.IamException Conflict if the policy exists,
     *         NotFound if the resource or a member does not, ValidationError for grants
     *         the resource type does not define
     */
    public AccessPolicy createPolicy(PolicyId id, AccessPolicyMembership membership, RequestContext ctx) {
        return tx.serializableWrite("createPolicy", ctx, () -> {
            requireResource(id.resource());
            if (groupRepo.exists(id)) {
                throw IamErrors.conflict("POLICY_EXISTS",
                    "Policy " + id + " already exists",
                    Map.of("policy", id.key()));
            }
            validate(id.resource().resourceTypeName(), membership);
            return insert(id, membership, ctx);
        });
    }

    /**
     * Replace members and grants of a policy in one step, creating it if missing.
     */
    public AccessPolicy overwritePolicy(PolicyId id, AccessPolicyMembership membership, RequestContext ctx) {
        return tx.serializableWrite("overwritePolicy", ctx, () -> {
            requireResource(id.resource());
            validate(id.resource().resourceTypeName(), membership);
            if (!groupRepo.exists(id)) {
                return insert(id, membership, ctx);
            }
            PolicyGrants grants = toGrants(id, membership);
            boolean grantsChanged = policyRepo.findById(id).map(current -> !current.equals(grants)).orElse(true);
            Set<Subject> changedMembers = groupService.replaceMembers(id, membership.members(), ctx);
            if (grantsChanged) {
                policyRepo.update(grants);
                groupService.recordGrantsChanged(id, changedMembers.isEmpty(), ctx);
            }
            LOG.debugf("Overwrote policy %s (execution %s)", id, ctx.executionId());
            return assemble(policyRepo.findById(id).orElseThrow(), groupRepo.findByIdentity(id).orElseThrow());
        });
    }

    public void deletePolicy(PolicyId id, RequestContext ctx) {
        tx.serializableWrite("deletePolicy", ctx, () -> {
            if (policyRepo.findById(id).isEmpty()) {
                throw notFound(id);
            }
            policyRepo.delete(id);
            groupService.deleteGroup(id, ctx);
            LOG.debugf("Deleted policy %s (execution %s)", id, ctx.executionId());
        });
    }

    public Optional<AccessPolicy> loadPolicy(PolicyId id, RequestContext ctx) {
        return tx.readOnly("loadPolicy", ctx, () -> policyRepo.findById(id)
            .flatMap(grants -> groupRepo.findByIdentity(id).map(group -> assemble(grants, group))));
    }

    public List<AccessPolicy> listPolicies(FullyQualifiedResourceId resource, RequestContext ctx) {
        return tx.readOnly("listPolicies", ctx, () -> {
            requireResource(resource);
            return assembleAll(policyRepo.findByResource(resource));
        });
    }

    /**
     * Public policies on resources of the given type, or every public policy when null.
     */
    public List<AccessPolicy> listPublicPolicies(String resourceTypeName, RequestContext ctx) {
        return tx.readOnly("listPublicPolicies", ctx, () -> assembleAll(policyRepo.findPublic(resourceTypeName)));
    }

    public void setPublic(PolicyId id, boolean isPublic, RequestContext ctx) {
        tx.serializableWrite("setPublic", ctx, () -> {
            PolicyGrants grants = policyRepo.findById(id).orElseThrow(() -> notFound(id));
            if (grants.isPublic() != isPublic) {
                policyRepo.update(grants.withPublic(isPublic));
                groupService.recordGrantsChanged(id, true, ctx);
                LOG.infof("Policy %s is now %s (execution %s)", id, isPublic ? "public" : "private", ctx.executionId());
            }
        });
    }

    private AccessPolicy insert(PolicyId id, AccessPolicyMembership membership, RequestContext ctx) {
        String email = "policy-" + TsidGenerator.generateRaw().toLowerCase() + "@" + config.emailDomain();
        Group group = groupService.createGroupRecord(id, email, membership.members(), ctx);
        PolicyGrants grants = toGrants(id, membership);
        policyRepo.insert(grants);
        LOG.debugf("Created policy %s (execution %s)", id, ctx.executionId());
        return assemble(grants, group);
    }

    /**
     * Roles must exist on the type, actions must match one of its patterns, and the
     * same holds for each descendant permission against its own type.
     */
    private void validate(String resourceTypeName, AccessPolicyMembership membership) {
        ResourceType type = typeRegistry.require(resourceTypeName);
        validateGrants(type, membership.roles(), membership.actions());
        for (AccessPolicyDescendantPermissions descendant : membership.descendantPermissions()) {
            validateGrants(typeRegistry.require(descendant.resourceType()), descendant.roles(), descendant.actions());
        }
    }

    private static void validateGrants(ResourceType type, Set<String> roles, Set<String> actions) {
        for (String role : roles) {
            if (type.role(role).isEmpty()) {
                throw IamErrors.validation("UNKNOWN_ROLE",
                    "Role " + role + " is not defined on resource type " + type.name(),
                    Map.of("resourceType", type.name(), "role", role));
            }
        }
        for (String action : actions) {
            if (!type.isValidAction(action)) {
                throw IamErrors.validation("INVALID_ACTION",
                    "Action " + action + " is not valid for resource type " + type.name(),
                    Map.of("resourceType", type.name(), "action", action));
            }
        }
    }

    private void requireResource(FullyQualifiedResourceId resource) {
        if (!resourceRepo.exists(resource)) {
            throw IamErrors.notFound("RESOURCE_NOT_FOUND",
                "Resource " + resource + " does not exist",
                Map.of("resource", resource.toString()));
        }
    }

    private List<AccessPolicy> assembleAll(List<PolicyGrants> grantsList) {
        List<AccessPolicy> policies = new ArrayList<>();
        for (PolicyGrants grants : grantsList) {
            groupRepo.findByIdentity(grants.id()).ifPresent(group -> policies.add(assemble(grants, group)));
        }
        return policies;
    }

    private static PolicyGrants toGrants(PolicyId id, AccessPolicyMembership membership) {
        return new PolicyGrants(id, membership.roles(), membership.actions(),
            membership.descendantPermissions(), membership.isPublic());
    }

    static AccessPolicy assemble(PolicyGrants grants, Group group) {
        AccessPolicy policy = new AccessPolicy();
        policy.id = grants.id();
        policy.members.addAll(group.members);
        policy.email = group.email;
        policy.roles.addAll(grants.roles());
        policy.actions.addAll(grants.actions());
        policy.descendantPermissions.addAll(grants.descendantPermissions());
        policy.isPublic = grants.isPublic();
        policy.version = group.version;
        policy.lastSynchronizedVersion = group.lastSynchronizedVersion;
        return policy;
    }

    private static RuntimeException notFound(PolicyId id) {
        return IamErrors.notFound("POLICY_NOT_FOUND",
            "Policy " + id + " does not exist",
            Map.of("policy", id.key()));
    }
}
