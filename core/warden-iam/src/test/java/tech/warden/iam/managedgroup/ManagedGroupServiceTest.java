package tech.warden.iam.managedgroup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.errors.IamException;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.group.Group;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.testing.IamFixture;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ManagedGroupServiceTest {

    private static final GroupName RESEARCHERS = new GroupName("researchers");

    private IamFixture fx;
    private ManagedGroupService service;
    private RequestContext ctx;
    private UserId alice;
    private UserId bob;

    @BeforeEach
    void setUp() {
        fx = new IamFixture();
        service = fx.managedGroupService;
        alice = fx.user("alice");
        bob = fx.user("bob");
        ctx = IamFixture.as(alice);
    }

    @Test
    @DisplayName("createManagedGroup should make the creator an admin and a flattened member")
    void createManagedGroup_shouldWireResourcePoliciesAndGroup() {
        Group group = service.createManagedGroup(RESEARCHERS, alice, "Ask Alice", ctx);

        assertThat(group.email).isEqualTo("researchers@test.warden.local");
        assertThat(group.members).containsExactlyInAnyOrder(
            ManagedGroupService.policyOf(RESEARCHERS, "admin"),
            ManagedGroupService.policyOf(RESEARCHERS, "member"));
        assertThat(service.listManagedGroupMembers(RESEARCHERS, "admin", ctx)).containsExactly(alice);
        assertThat(service.listManagedGroupMembers(RESEARCHERS, "member", ctx)).isEmpty();
        assertThat(fx.groupService.isMember(RESEARCHERS, alice, ctx)).isTrue();
        assertThat(service.getAccessInstructions(RESEARCHERS, ctx)).contains("Ask Alice");
        assertThat(fx.evaluator.hasPermission(ManagedGroupService.resourceOf(RESEARCHERS), "alter_policies", alice, ctx))
            .isTrue();
    }

    @Test
    @DisplayName("createManagedGroup should reject invalid names and existing groups")
    void createManagedGroup_shouldValidate() {
        assertThatThrownBy(() -> service.createManagedGroup(new GroupName("no spaces"), alice, null, ctx))
            .extracting(e -> ((IamException) e).error())
            .isInstanceOf(UseCaseError.ValidationError.class);

        fx.groupService.createGroup(RESEARCHERS, null, Set.of(), null, ctx);
        assertThatThrownBy(() -> service.createManagedGroup(RESEARCHERS, alice, null, ctx))
            .extracting(e -> ((IamException) e).error())
            .isInstanceOf(UseCaseError.ConflictError.class);
        // The resource created before the conflict was rolled back
        assertThat(fx.resourceService.loadResource(ManagedGroupService.resourceOf(RESEARCHERS), ctx)).isEmpty();
    }

    @Test
    @DisplayName("adding to the member policy should make the subject a group member")
    void addManagedGroupMember_shouldFlattenIntoGroup() {
        service.createManagedGroup(RESEARCHERS, alice, null, ctx);

        assertThat(service.addManagedGroupMember(RESEARCHERS, "member", bob, ctx)).isTrue();
        assertThat(fx.groupService.listFlattenedMembers(RESEARCHERS, ctx)).containsExactlyInAnyOrder(alice, bob);
        assertThat(service.listManagedGroups(bob, ctx)).containsEntry("researchers", Set.of("member"));

        assertThat(service.removeManagedGroupMember(RESEARCHERS, "member", bob, ctx)).isTrue();
        assertThat(fx.groupService.isMember(RESEARCHERS, bob, ctx)).isFalse();
    }

    @Test
    @DisplayName("only the admin and member policies should be addressable")
    void addManagedGroupMember_shouldRejectOtherPolicies() {
        service.createManagedGroup(RESEARCHERS, alice, null, ctx);

        assertThatThrownBy(() -> service.addManagedGroupMember(RESEARCHERS, "owner", bob, ctx))
            .extracting(e -> ((IamException) e).error().code())
            .isEqualTo("INVALID_MANAGED_POLICY");
    }

    @Test
    @DisplayName("deleteManagedGroup should remove group, resource and policies")
    void deleteManagedGroup_shouldRemoveEverything() {
        service.createManagedGroup(RESEARCHERS, alice, null, ctx);
        service.addManagedGroupMember(RESEARCHERS, "member", bob, ctx);

        service.deleteManagedGroup(RESEARCHERS, ctx);

        assertThat(service.loadManagedGroup(RESEARCHERS, ctx)).isEmpty();
        assertThat(fx.resourceService.loadResource(ManagedGroupService.resourceOf(RESEARCHERS), ctx)).isEmpty();
        assertThat(fx.groupService.listAncestorGroups(bob, ctx)).isEmpty();
    }

    @Test
    @DisplayName("deleteManagedGroup should refuse while the group is nested elsewhere")
    void deleteManagedGroup_shouldRefuseWhenInUse() {
        service.createManagedGroup(RESEARCHERS, alice, null, ctx);
        fx.groupService.createGroup(new GroupName("everyone"), null, Set.of(RESEARCHERS), null, ctx);

        assertThatThrownBy(() -> service.deleteManagedGroup(RESEARCHERS, ctx))
            .extracting(e -> ((IamException) e).error())
            .isInstanceOf(UseCaseError.ReferentialIntegrityError.class);
        assertThat(fx.resourceService.loadResource(ManagedGroupService.resourceOf(RESEARCHERS), ctx)).isPresent();
    }
}
