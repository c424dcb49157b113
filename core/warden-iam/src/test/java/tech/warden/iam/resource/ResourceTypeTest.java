package tech.warden.iam.resource;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ResourceTypeTest {

    private final ResourceType type = new ResourceType("managed-group",
        Set.of(new ActionPattern("delete", "", false), new ActionPattern("read_policy::.+", "", false)),
        Map.of("admin", new ResourceRole("admin", Set.of("delete", "read_policy::admin"))),
        "admin", false);

    @Test
    @DisplayName("action patterns should match whole actions only")
    void isValidAction_shouldMatchWholeAction() {
        assertThat(type.isValidAction("read_policy::member")).isTrue();
        assertThat(type.isValidAction("read_policy::")).isFalse();
        assertThat(type.isValidAction("delete_all")).isFalse();
    }

    @Test
    @DisplayName("unknown roles should contribute no actions")
    void actionsOf_shouldIgnoreUnknownRoles() {
        assertThat(type.actionsOf(Set.of("admin", "ghost"))).containsExactlyInAnyOrder("delete", "read_policy::admin");
        assertThat(type.ownerRole()).contains("admin");
        assertThat(type.role("ghost")).isEmpty();
    }
}
