package tech.warden.iam.integration;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.evaluation.PolicyEvaluator;
import tech.warden.iam.group.GroupService;
import tech.warden.iam.policy.AccessPolicy;
import tech.warden.iam.policy.AccessPolicyDescendantPermissions;
import tech.warden.iam.policy.AccessPolicyMembership;
import tech.warden.iam.policy.PolicyService;
import tech.warden.iam.resource.ResourceService;
import tech.warden.iam.shared.TsidGenerator;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.user.UserService;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for evaluation over stored resources, policies and the
 * resource types registered from configuration at startup.
 */
@Tag("integration")
@QuarkusTest
class PolicyEvaluationIntegrationTest {

    @Inject
    PolicyEvaluator evaluator;

    @Inject
    ResourceService resourceService;

    @Inject
    PolicyService policyService;

    @Inject
    GroupService groupService;

    @Inject
    UserService userService;

    private final RequestContext ctx = RequestContext.system();

    private String unique(String prefix) {
        return prefix + "-" + TsidGenerator.generateRaw().toLowerCase();
    }

    private UserId user(String prefix) {
        UserId id = new UserId(unique(prefix));
        userService.createUser(id, id.value() + "@test.warden.local", ctx);
        return id;
    }

    @Test
    @DisplayName("the creator of a folder should own it and nobody else should read it")
    void createResource_shouldGrantOwnerToCreator() {
        UserId owner = user("owner");
        UserId stranger = user("stranger");
        String folderId = unique("folder");
        FullyQualifiedResourceId folder = new FullyQualifiedResourceId("folder", folderId);

        resourceService.createResource("folder", folderId, Set.of(), null, owner, ctx);

        assertThat(evaluator.hasPermission(folder, "read", owner, ctx)).isTrue();
        assertThat(evaluator.hasPermission(folder, "read", stranger, ctx)).isFalse();
        assertThat(evaluator.listResourcesAndRoles("folder", owner, ctx)).containsEntry(folderId, Set.of("owner"));
    }

    @Test
    @DisplayName("descendant permissions on a workspace should reach folders beneath it")
    void hasPermission_shouldInheritFromAncestors() {
        UserId owner = user("owner");
        UserId reader = user("reader");
        String workspaceId = unique("ws");
        FullyQualifiedResourceId workspace = new FullyQualifiedResourceId("workspace", workspaceId);
        FullyQualifiedResourceId folder = new FullyQualifiedResourceId("folder", unique("folder"));
        resourceService.createResource("workspace", workspaceId, Set.of(), null, owner, ctx);
        resourceService.createResource("folder", folder.resourceId(), Set.of(), workspace, owner, ctx);

        policyService.createPolicy(new PolicyId(workspace, "readers"), new AccessPolicyMembership(Set.of(reader),
            Set.of(), Set.of(), Set.of(new AccessPolicyDescendantPermissions("folder", Set.of(), Set.of("read"))),
            false), ctx);

        assertThat(evaluator.hasPermission(folder, "read", reader, ctx)).isTrue();
        assertThat(evaluator.hasPermission(folder, "write", reader, ctx)).isFalse();
    }

    @Test
    @DisplayName("constrainable actions should require every auth domain group")
    void hasPermission_shouldEnforceAuthDomain() {
        UserId owner = user("owner");
        UserId outsider = user("outsider");
        GroupName cleared = new GroupName(unique("cleared"));
        groupService.createGroup(cleared, null, Set.of(owner), null, ctx);
        String folderId = unique("folder");
        FullyQualifiedResourceId folder = new FullyQualifiedResourceId("folder", folderId);
        resourceService.createResource("folder", folderId, Set.of(cleared), null, owner, ctx);
        policyService.createPolicy(new PolicyId(folder, "writers"),
            AccessPolicyMembership.ofRoles(Set.of(outsider), Set.of("writer")), ctx);

        assertThat(evaluator.hasPermission(folder, "download", owner, ctx)).isTrue();
        assertThat(evaluator.hasPermission(folder, "download", outsider, ctx)).isFalse();
        assertThat(evaluator.hasPermission(folder, "write", outsider, ctx)).isTrue();
        assertThat(evaluator.listAuthDomainMembers(folder, ctx)).containsExactly(owner);
    }

    @Test
    @DisplayName("changing only the grants of a stored policy should bump its version")
    void overwritePolicy_shouldBumpVersionOnGrantChange() {
        UserId owner = user("owner");
        UserId reader = user("reader");
        String folderId = unique("folder");
        FullyQualifiedResourceId folder = new FullyQualifiedResourceId("folder", folderId);
        resourceService.createResource("folder", folderId, Set.of(), null, owner, ctx);
        PolicyId readers = new PolicyId(folder, "readers");
        policyService.createPolicy(readers, AccessPolicyMembership.ofRoles(Set.of(reader), Set.of("viewer")), ctx);

        AccessPolicy updated = policyService.overwritePolicy(readers,
            AccessPolicyMembership.ofRoles(Set.of(reader), Set.of("writer")), ctx);
        policyService.setPublic(readers, true, ctx);

        assertThat(updated.version).isEqualTo(2);
        assertThat(policyService.loadPolicy(readers, ctx).orElseThrow().version).isEqualTo(3);
        assertThat(evaluator.hasPermission(folder, "write", reader, ctx)).isTrue();
    }
}
