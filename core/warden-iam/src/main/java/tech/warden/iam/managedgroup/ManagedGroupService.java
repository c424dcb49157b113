package tech.warden.iam.managedgroup;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamErrors;
import tech.warden.iam.config.WardenConfig;
import tech.warden.iam.evaluation.PolicyEvaluator;
import tech.warden.iam.group.Group;
import tech.warden.iam.group.GroupService;
import tech.warden.iam.policy.AccessPolicy;
import tech.warden.iam.policy.AccessPolicyMembership;
import tech.warden.iam.policy.PolicyService;
import tech.warden.iam.resource.ResourceService;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Groups whose membership is governed by policies on a {@code managed-group} resource.
 *
 * <p>A managed group {@code g} consists of the resource {@code managed-group/g}, its
 * {@code admin} (owner) and {@code member} policies, and a plain group {@code g}
 * whose direct members are those two policies. Adding someone to a policy makes
 * them a flattened member of the group.
 */
@ApplicationScoped
public class ManagedGroupService {

    private static final Logger LOG = Logger.getLogger(ManagedGroupService.class);

    public static final String MANAGED_GROUP_TYPE = "managed-group";
    public static final String ADMIN_POLICY = "admin";
    public static final String MEMBER_POLICY = "member";
    public static final Set<String> MANAGED_POLICIES = Set.of(ADMIN_POLICY, MEMBER_POLICY);

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_-]{1,60}");

    private final TransactionRunner tx;
    private final ResourceService resourceService;
    private final PolicyService policyService;
    private final GroupService groupService;
    private final PolicyEvaluator evaluator;
    private final WardenConfig config;

    @Inject
    public ManagedGroupService(TransactionRunner tx, ResourceService resourceService, PolicyService policyService,
                               GroupService groupService, PolicyEvaluator evaluator, WardenConfig config) {
        this.tx = tx;
        this.resourceService = resourceService;
        this.policyService = policyService;
        this.groupService = groupService;
        this.evaluator = evaluator;
        this.config = config;
    }

    public static FullyQualifiedResourceId resourceOf(GroupName group) {
        return new FullyQualifiedResourceId(MANAGED_GROUP_TYPE, group.value());
    }

    public static PolicyId policyOf(GroupName group, String policyName) {
        return new PolicyId(resourceOf(group), policyName);
    }

    /**
     * Create the resource, its policies and the aggregate group in one transaction.
     */
    public Group createManagedGroup(GroupName name, UserId creator, String accessInstructions, RequestContext ctx) {
        if (!VALID_NAME.matcher(name.value()).matches()) {
            throw IamErrors.validation("INVALID_GROUP_NAME",
                "Group name " + name + " must be 1 to 60 letters, digits, '_' or '-'",
                Map.of("group", name.value()));
        }
        return tx.serializableWrite("createManagedGroup", ctx, () -> {
            resourceService.createResource(MANAGED_GROUP_TYPE, name.value(), Set.of(), null, creator, ctx);
            policyService.createPolicy(policyOf(name, MEMBER_POLICY),
                AccessPolicyMembership.ofRoles(Set.of(), Set.of(MEMBER_POLICY)), ctx);

            Set<Subject> policies = Set.of(policyOf(name, ADMIN_POLICY), policyOf(name, MEMBER_POLICY));
            Group group = groupService.createGroup(name, name.value() + "@" + config.emailDomain(),
                policies, accessInstructions, ctx);
            LOG.infof("Created managed group %s for %s (execution %s)", name, creator, ctx.executionId());
            return group;
        });
    }

    public Optional<Group> loadManagedGroup(GroupName name, RequestContext ctx) {
        return groupService.loadGroup(name, ctx);
    }

    /**
     * Delete the aggregate group first, so a group still used elsewhere keeps its
     * resource, then the resource with its policies.
     */
    public void deleteManagedGroup(GroupName name, RequestContext ctx) {
        tx.serializableWrite("deleteManagedGroup", ctx, () -> {
            groupService.deleteGroup(name, ctx);
            resourceService.deleteResource(resourceOf(name), ctx);
            LOG.infof("Deleted managed group %s (execution %s)", name, ctx.executionId());
        });
    }

    public Set<Subject> listManagedGroupMembers(GroupName name, String policyName, RequestContext ctx) {
        requireManagedPolicy(policyName);
        return policyService.loadPolicy(policyOf(name, policyName), ctx)
            .map(policy -> policy.members)
            .orElseThrow(() -> IamErrors.notFound("MANAGED_GROUP_NOT_FOUND",
                "Managed group " + name + " does not exist",
                Map.of("group", name.value())));
    }

    public boolean addManagedGroupMember(GroupName name, String policyName, Subject member, RequestContext ctx) {
        requireManagedPolicy(policyName);
        return groupService.addMember(policyOf(name, policyName), member, ctx);
    }

    public boolean removeManagedGroupMember(GroupName name, String policyName, Subject member, RequestContext ctx) {
        requireManagedPolicy(policyName);
        return groupService.removeMember(policyOf(name, policyName), member, ctx);
    }

    public Optional<String> getAccessInstructions(GroupName name, RequestContext ctx) {
        return groupService.getAccessInstructions(name, ctx);
    }

    public void setAccessInstructions(GroupName name, String instructions, RequestContext ctx) {
        groupService.setAccessInstructions(name, instructions, ctx);
    }

    /**
     * Managed groups the user can see, with the policy roles it holds on each.
     */
    public Map<String, Set<String>> listManagedGroups(UserId user, RequestContext ctx) {
        return evaluator.listResourcesAndRoles(MANAGED_GROUP_TYPE, user, ctx);
    }

    public Optional<AccessPolicy> loadManagedPolicy(GroupName name, String policyName, RequestContext ctx) {
        requireManagedPolicy(policyName);
        return policyService.loadPolicy(policyOf(name, policyName), ctx);
    }

    private static void requireManagedPolicy(String policyName) {
        if (!MANAGED_POLICIES.contains(policyName)) {
            throw IamErrors.validation("INVALID_MANAGED_POLICY",
                "Policy " + policyName + " is not one of " + MANAGED_POLICIES,
                Map.of("policy", String.valueOf(policyName)));
        }
    }
}
