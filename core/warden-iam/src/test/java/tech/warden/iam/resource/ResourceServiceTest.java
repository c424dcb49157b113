package tech.warden.iam.resource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.errors.IamException;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.mirror.GroupMembershipChange;
import tech.warden.iam.policy.AccessPolicyMembership;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.PolicyId;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.testing.IamFixture;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ResourceServiceTest {

    private static final FullyQualifiedResourceId A = new FullyQualifiedResourceId("folder", "a");
    private static final FullyQualifiedResourceId B = new FullyQualifiedResourceId("folder", "b");
    private static final FullyQualifiedResourceId C = new FullyQualifiedResourceId("folder", "c");

    private IamFixture fx;
    private ResourceService service;
    private RequestContext ctx;
    private UserId alice;

    @BeforeEach
    void setUp() {
        fx = new IamFixture();
        service = fx.resourceService;
        alice = fx.user("alice");
        ctx = IamFixture.as(alice);
    }

    @Test
    @DisplayName("createResource should add an owner policy holding the creator")
    void createResource_shouldCreateOwnerPolicy() {
        Resource resource = service.createResource("folder", "a", Set.of(), null, alice, ctx);

        assertThat(resource.fullyQualifiedId()).isEqualTo(A);
        assertThat(fx.policyService.loadPolicy(new PolicyId(A, "owner"), ctx)).get()
            .satisfies(policy -> {
                assertThat(policy.members).containsExactly(alice);
                assertThat(policy.roles).containsExactly("owner");
                assertThat(policy.email).endsWith("@test.warden.local");
            });
    }

    @Test
    @DisplayName("createResource should reject duplicates, unknown types and missing auth domain groups")
    void createResource_shouldValidateInput() {
        service.createResource("folder", "a", Set.of(), null, alice, ctx);

        assertThatThrownBy(() -> service.createResource("folder", "a", Set.of(), null, alice, ctx))
            .extracting(e -> ((IamException) e).error())
            .isInstanceOf(UseCaseError.ConflictError.class);
        assertThatThrownBy(() -> service.createResource("spaceship", "x", Set.of(), null, alice, ctx))
            .extracting(e -> ((IamException) e).error().code())
            .isEqualTo("UNKNOWN_RESOURCE_TYPE");
        assertThatThrownBy(() -> service.createResource("folder", "x", Set.of(new GroupName("ghosts")), null, alice, ctx))
            .extracting(e -> ((IamException) e).error().code())
            .isEqualTo("AUTH_DOMAIN_GROUP_NOT_FOUND");
        assertThatThrownBy(() -> service.createResource("folder", "x", Set.of(), B, alice, ctx))
            .extracting(e -> ((IamException) e).error())
            .isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(service.loadResource(new FullyQualifiedResourceId("folder", "x"), ctx)).isEmpty();
    }

    @Test
    @DisplayName("createResourceType should reject an owner role the type does not define")
    void createResourceType_shouldValidateOwnerRole() {
        ResourceType broken = new ResourceType("broken", Set.of(new ActionPattern("read", "", false)),
            Map.of("viewer", new ResourceRole("viewer", Set.of("read"))), "owner", false);

        assertThatThrownBy(() -> service.createResourceType(broken, ctx))
            .extracting(e -> ((IamException) e).error().code())
            .isEqualTo("UNKNOWN_OWNER_ROLE");
        assertThat(service.listResourceTypes()).extracting(ResourceType::name)
            .containsExactlyInAnyOrder("folder", "workspace", "managed-group");
    }

    // ========================================
    // HIERARCHY
    // ========================================

    @Test
    @DisplayName("setParent should reject a cycle and name the linking resource")
    void setParent_shouldRejectCycle() {
        // Arrange: a > b > c
        service.createResource("folder", "a", Set.of(), null, alice, ctx);
        service.createResource("folder", "b", Set.of(), A, alice, ctx);
        service.createResource("folder", "c", Set.of(), B, alice, ctx);

        // Act + Assert
        assertThatThrownBy(() -> service.setParent(A, C, ctx))
            .isInstanceOf(IamException.class)
            .satisfies(e -> {
                UseCaseError error = ((IamException) e).error();
                assertThat(error).isInstanceOf(UseCaseError.InvalidGraphError.class);
                assertThat(error.details()).containsEntry("linkingResource", B.toString());
            });
        assertThatThrownBy(() -> service.setParent(A, A, ctx))
            .extracting(e -> ((IamException) e).error())
            .isInstanceOf(UseCaseError.InvalidGraphError.class);

        assertThat(service.getParent(A, ctx)).isEmpty();
        assertThat(service.listAncestors(C, ctx)).containsExactly(B, A);
    }

    @Test
    @DisplayName("setParent and deleteParent should move resources around")
    void setParent_shouldReparent() {
        service.createResource("folder", "a", Set.of(), null, alice, ctx);
        service.createResource("folder", "b", Set.of(), null, alice, ctx);

        service.setParent(B, A, ctx);
        assertThat(service.listChildren(A, ctx)).containsExactly(B);

        assertThat(service.deleteParent(B, ctx)).isTrue();
        assertThat(service.deleteParent(B, ctx)).isFalse();
        assertThat(service.listChildren(A, ctx)).isEmpty();
    }

    // ========================================
    // DELETE
    // ========================================

    @Test
    @DisplayName("deleteResource should refuse while the resource has children")
    void deleteResource_shouldRefuseWithChildren() {
        service.createResource("folder", "a", Set.of(), null, alice, ctx);
        service.createResource("folder", "b", Set.of(), A, alice, ctx);

        assertThatThrownBy(() -> service.deleteResource(A, ctx))
            .extracting(e -> ((IamException) e).error().code())
            .isEqualTo("RESOURCE_HAS_CHILDREN");
        assertThat(service.loadResource(A, ctx)).isPresent();
    }

    @Test
    @DisplayName("deleteResource should remove every policy and the flattened rows they own")
    void deleteResource_shouldCascadeToPolicies() {
        UserId bob = fx.user("bob");
        service.createResource("folder", "a", Set.of(), null, alice, ctx);
        fx.policyService.createPolicy(new PolicyId(A, "readers"),
            AccessPolicyMembership.ofRoles(Set.of(bob), Set.of("viewer")), ctx);

        service.deleteResource(A, ctx);

        assertThat(service.loadResource(A, ctx)).isEmpty();
        assertThat(fx.policyRepo.findByResource(A)).isEmpty();
        assertThat(fx.groupRepo.exists(new PolicyId(A, "owner"))).isFalse();
        assertThat(fx.groupRepo.exists(new PolicyId(A, "readers"))).isFalse();
        assertThat(fx.groupService.listAncestorGroups(bob, ctx)).isEmpty();

        // The id is free again
        service.createResource("folder", "a", Set.of(), null, bob, ctx);
        assertThat(fx.evaluator.hasPermission(A, "read", alice, ctx)).isFalse();
    }

    @Test
    @DisplayName("deleteResource should notify the mirror for every deleted policy")
    void deleteResource_shouldNotifyMirrorPerPolicy() {
        UserId bob = fx.user("bob");
        service.createResource("folder", "a", Set.of(), null, alice, ctx);
        fx.policyService.createPolicy(new PolicyId(A, "readers"),
            AccessPolicyMembership.ofRoles(Set.of(bob), Set.of("viewer")), ctx);
        fx.notifier.clear();

        service.deleteResource(A, ctx);

        assertThat(fx.notifier.changes())
            .allSatisfy(change -> assertThat(change.kind()).isEqualTo(GroupMembershipChange.Kind.GROUP_DELETED))
            .extracting(GroupMembershipChange::groupKey)
            .containsExactlyInAnyOrder(new PolicyId(A, "owner").key(), new PolicyId(A, "readers").key());
        assertThat(fx.notifier.changes())
            .filteredOn(change -> change.groupKey().equals(new PolicyId(A, "readers").key()))
            .singleElement()
            .satisfies(change -> assertThat(change.changedMemberKeys()).containsExactly(bob.key()));
    }

    @Test
    @DisplayName("deleteResource should refuse while one of its policies is nested in another group")
    void deleteResource_shouldRefuseWhenPolicyInUse() {
        service.createResource("folder", "a", Set.of(), null, alice, ctx);
        GroupName admins = new GroupName("admins");
        fx.groupService.createGroup(admins, null, Set.of(new PolicyId(A, "owner")), null, ctx);

        assertThatThrownBy(() -> service.deleteResource(A, ctx))
            .extracting(e -> ((IamException) e).error())
            .isInstanceOf(UseCaseError.ReferentialIntegrityError.class);
        assertThat(fx.policyRepo.findByResource(A)).hasSize(1);
    }

    @Test
    @DisplayName("loadResourceAuthDomain should return the groups given at creation")
    void loadResourceAuthDomain_shouldReturnGroups() {
        GroupName cleared = new GroupName("cleared");
        fx.groupService.createGroup(cleared, null, Set.of(alice), null, ctx);
        service.createResource("folder", "a", Set.of(cleared), null, alice, ctx);

        assertThat(service.loadResourceAuthDomain(A, ctx)).containsExactly(cleared);
        assertThatThrownBy(() -> service.loadResourceAuthDomain(B, ctx)).isInstanceOf(IamException.class);
    }
}
