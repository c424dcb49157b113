package tech.warden.iam.resource.operations.deleteparent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.warden.iam.common.Result;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.testing.IamFixture;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DeleteParentUseCaseTest {

    private static final FullyQualifiedResourceId PARENT = new FullyQualifiedResourceId("folder", "parent");
    private static final FullyQualifiedResourceId CHILD = new FullyQualifiedResourceId("folder", "child");

    private IamFixture fx;
    private DeleteParentUseCase useCase;
    private UserId alice;
    private UserId bob;

    @BeforeEach
    void setUp() {
        fx = new IamFixture();
        useCase = new DeleteParentUseCase();
        useCase.resourceService = fx.resourceService;
        useCase.accessGuard = fx.accessGuard;
        alice = fx.user("alice");
        bob = fx.user("bob");
        fx.resourceService.createResource("folder", "parent", Set.of(), null, alice, fx.system);
    }

    @Test
    @DisplayName("detaching should need remove_child on the current parent")
    void execute_shouldRequireRemoveChildOnParent() {
        fx.resourceService.createResource("folder", "child", Set.of(), PARENT, bob, fx.system);

        Result<Boolean> denied = useCase.execute(new DeleteParentCommand(CHILD), IamFixture.as(bob));

        assertThat(((Result.Failure<Boolean>) denied).error()).isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(fx.resourceRepo.findParent(CHILD)).contains(PARENT);
    }

    @Test
    @DisplayName("the owner of both resources should detach the child")
    void execute_shouldDetach() {
        fx.resourceService.createResource("folder", "child", Set.of(), PARENT, alice, fx.system);

        Result<Boolean> first = useCase.execute(new DeleteParentCommand(CHILD), IamFixture.as(alice));
        Result<Boolean> second = useCase.execute(new DeleteParentCommand(CHILD), IamFixture.as(alice));

        assertThat(((Result.Success<Boolean>) first).value()).isTrue();
        assertThat(((Result.Success<Boolean>) second).value()).isFalse();
    }
}
