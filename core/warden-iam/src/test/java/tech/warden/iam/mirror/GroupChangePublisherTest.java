package tech.warden.iam.mirror;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.group.flat.MembershipIndex;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.UserId;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GroupChangePublisher.
 * Notifications go out only after commit and never fail the request.
 */
@ExtendWith(MockitoExtension.class)
class GroupChangePublisherTest {

    private static final GroupName TEAM = new GroupName("team");
    private static final GroupName ORG = new GroupName("org");
    private static final UserId ALICE = new UserId("alice");

    @Mock
    private TransactionRunner tx;

    @Mock
    private MembershipIndex membershipIndex;

    @Mock
    private GroupRepository groupRepo;

    @Mock
    private GroupMirrorNotifier notifier;

    private GroupChangePublisher publisher;
    private RequestContext ctx;

    @BeforeEach
    void setUp() {
        publisher = new GroupChangePublisher(tx, membershipIndex, groupRepo, notifier);
        ctx = RequestContext.create("alice");
    }

    @Test
    @DisplayName("publish should queue one change per affected group for after commit")
    void publish_shouldNotifyGroupAndAncestorsAfterCommit() {
        // Arrange
        when(membershipIndex.listAncestorGroups(TEAM)).thenReturn(Set.of(ORG));
        when(groupRepo.findEmails(anyCollection())).thenReturn(Map.<GroupIdentity, String>of(
            TEAM, "team@x.org", ORG, "org@x.org"));

        // Act
        publisher.publish(TEAM, Set.of(ALICE), ctx);

        // Assert: nothing sent until the callback runs
        ArgumentCaptor<Runnable> callback = ArgumentCaptor.forClass(Runnable.class);
        verify(tx).afterCommit(callback.capture());
        verifyNoInteractions(notifier);

        callback.getValue().run();

        ArgumentCaptor<GroupMembershipChange> sent = ArgumentCaptor.forClass(GroupMembershipChange.class);
        verify(notifier, times(2)).notify(sent.capture());
        List<GroupMembershipChange> changes = sent.getAllValues();
        assertThat(changes).extracting(GroupMembershipChange::groupKey)
            .containsExactlyInAnyOrder(TEAM.key(), ORG.key());
        assertThat(changes).filteredOn(GroupMembershipChange::direct)
            .singleElement()
            .satisfies(change -> {
                assertThat(change.groupEmail()).isEqualTo("team@x.org");
                assertThat(change.executionId()).isEqualTo(ctx.executionId());
                assertThat(change.changedMemberKeys()).containsExactly(ALICE.key());
            });
    }

    @Test
    @DisplayName("a failing notifier should be logged and not stop other notifications")
    void deliver_shouldSwallowNotifierFailures() {
        when(membershipIndex.listAncestorGroups(TEAM)).thenReturn(Set.of(ORG));
        when(groupRepo.findEmails(anyCollection())).thenReturn(Map.of());
        doThrow(new IllegalStateException("mirror down")).when(notifier).notify(any());

        publisher.publish(TEAM, Set.of(ALICE), ctx);
        ArgumentCaptor<Runnable> callback = ArgumentCaptor.forClass(Runnable.class);
        verify(tx).afterCommit(callback.capture());

        assertThatCode(() -> callback.getValue().run()).doesNotThrowAnyException();
        verify(notifier, times(2)).notify(any());
    }

    @Test
    @DisplayName("publish should do nothing when no member changed")
    void publish_shouldSkipEmptyChanges() {
        publisher.publish(TEAM, Set.of(), ctx);

        verifyNoInteractions(tx, membershipIndex, groupRepo, notifier);
    }

    @Test
    @DisplayName("a grants change should notify only the policy itself")
    void publishGrantsChanged_shouldSkipAncestors() {
        when(groupRepo.findEmails(anyCollection())).thenReturn(Map.<GroupIdentity, String>of(TEAM, "team@x.org"));

        publisher.publishGrantsChanged(TEAM, ctx);
        ArgumentCaptor<Runnable> callback = ArgumentCaptor.forClass(Runnable.class);
        verify(tx).afterCommit(callback.capture());
        callback.getValue().run();

        verify(membershipIndex, never()).listAncestorGroups(any());
        ArgumentCaptor<GroupMembershipChange> sent = ArgumentCaptor.forClass(GroupMembershipChange.class);
        verify(notifier).notify(sent.capture());
        assertThat(sent.getValue().kind()).isEqualTo(GroupMembershipChange.Kind.GRANTS_CHANGED);
        assertThat(sent.getValue().changedMemberKeys()).isEmpty();
    }

    @Test
    @DisplayName("a deletion should mark the group deleted and its ancestors as changed")
    void publishDeleted_shouldCarryFormerMembers() {
        RequestContext traced = RequestContext.withCorrelation("alice", "corr-42");
        when(membershipIndex.listAncestorGroups(TEAM)).thenReturn(Set.of(ORG));
        when(groupRepo.findEmails(anyCollection())).thenReturn(Map.of());

        publisher.publishDeleted(TEAM, Set.of(ALICE), traced);
        ArgumentCaptor<Runnable> callback = ArgumentCaptor.forClass(Runnable.class);
        verify(tx).afterCommit(callback.capture());
        callback.getValue().run();

        ArgumentCaptor<GroupMembershipChange> sent = ArgumentCaptor.forClass(GroupMembershipChange.class);
        verify(notifier, times(2)).notify(sent.capture());
        assertThat(sent.getAllValues())
            .allSatisfy(change -> {
                assertThat(change.correlationId()).isEqualTo("corr-42");
                assertThat(change.changedMemberKeys()).containsExactly(ALICE.key());
            })
            .extracting(GroupMembershipChange::groupKey, GroupMembershipChange::kind)
            .containsExactlyInAnyOrder(
                tuple(TEAM.key(), GroupMembershipChange.Kind.GROUP_DELETED),
                tuple(ORG.key(), GroupMembershipChange.Kind.MEMBERS_CHANGED));
    }

    @Test
    @DisplayName("a change should serialize to JSON with ISO timestamps")
    void toJson_shouldWriteIsoTime() {
        GroupMembershipChange change = GroupMembershipChange.fromContext(ctx)
            .groupKey(TEAM.key())
            .groupEmail("team@x.org")
            .direct(true)
            .kind(GroupMembershipChange.Kind.MEMBERS_CHANGED)
            .changedMemberKeys(Set.of(ALICE.key()))
            .build();

        assertThat(change.toJson())
            .contains("\"groupKey\":\"group:team\"")
            .contains("\"kind\":\"MEMBERS_CHANGED\"")
            .contains("\"changedMemberKeys\":[\"user:alice\"]")
            .containsPattern("\"time\":\"\\d{4}-\\d{2}-\\d{2}T");
    }
}
