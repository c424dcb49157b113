package tech.warden.iam.subject;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SubjectTest {

    @Test
    @DisplayName("policy keys should keep slashes inside the resource id")
    void fromKey_shouldParsePolicyWithSlashInResourceId() {
        PolicyId policy = PolicyId.of("folder", "a/b", "owner");

        assertThat(policy.key()).isEqualTo("policy:folder/a/b/owner");
        assertThat(Subject.fromKey(policy.key())).isEqualTo(policy);
    }

    @Test
    @DisplayName("keys of different kinds should never collide")
    void key_shouldBeDistinctAcrossKinds() {
        assertThat(new UserId("x").key()).isNotEqualTo(new GroupName("x").key());
        assertThat(Subject.fromKey("user:x")).isEqualTo(new UserId("x"));
        assertThat(Subject.fromKey("group:x")).isEqualTo(new GroupName("x"));
    }

    @Test
    @DisplayName("malformed keys should be rejected")
    void fromKey_shouldRejectMalformedKeys() {
        assertThatThrownBy(() -> Subject.fromKey("robot:x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Subject.fromKey("policy:folder")).isInstanceOf(IllegalArgumentException.class);
    }
}
