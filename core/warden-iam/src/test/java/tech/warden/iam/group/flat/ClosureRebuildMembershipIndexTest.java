package tech.warden.iam.group.flat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.Subject;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.testing.IamFixture;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Checks the flattened index against a breadth-first closure of the direct edges
 * after random sequences of graph mutations.
 */
class ClosureRebuildMembershipIndexTest {

    private IamFixture fx;
    private RequestContext ctx;
    private List<GroupName> groups;
    private List<UserId> users;

    @BeforeEach
    void setUp() {
        fx = new IamFixture();
        ctx = RequestContext.system();
        users = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            users.add(fx.user("u" + i));
        }
        groups = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            GroupName group = new GroupName("g" + i);
            fx.groupService.createGroup(group, null, Set.of(), null, ctx);
            groups.add(group);
        }
    }

    @RepeatedTest(5)
    @DisplayName("flattened index should match the closure after every add and remove")
    void randomMutations_shouldKeepIndexEqualToClosure() {
        Random random = new Random();
        for (int step = 0; step < 120; step++) {
            // Edges only point from lower to higher index, so the graph stays acyclic
            int parentIndex = random.nextInt(groups.size() - 1);
            GroupName parent = groups.get(parentIndex);
            Subject member = random.nextBoolean()
                ? users.get(random.nextInt(users.size()))
                : groups.get(parentIndex + 1 + random.nextInt(groups.size() - parentIndex - 1));

            if (random.nextInt(3) == 0) {
                fx.groupService.removeMember(parent, member, ctx);
            } else {
                fx.groupService.addMember(parent, member, ctx);
            }

            assertIndexMatchesClosure();
        }
    }

    @Test
    @DisplayName("rebuildAll should restore a wiped index")
    void rebuildAll_shouldRecomputeEverything() {
        fx.groupService.addMember(groups.get(0), groups.get(1), ctx);
        fx.groupService.addMember(groups.get(1), groups.get(2), ctx);
        fx.groupService.addMember(groups.get(2), users.get(0), ctx);
        fx.flatRepo.deleteAll();

        int rebuilt = fx.groupService.rebuildFlattenedMembership(ctx);

        assertThat(rebuilt).isEqualTo(groups.size());
        assertThat(fx.groupService.isMember(groups.get(0), users.get(0), ctx)).isTrue();
        assertIndexMatchesClosure();
    }

    @RepeatedTest(3)
    @DisplayName("intersectGroups should equal the intersection of closures on deep wide graphs")
    void intersectGroups_shouldMatchClosureIntersection() {
        // Arrange: three levels, each group with five or more children
        Random random = new Random();
        List<UserId> pool = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            pool.add(fx.user("p" + i));
        }
        List<GroupName> roots = new ArrayList<>();
        for (int r = 0; r < 3; r++) {
            GroupName root = group("root" + r);
            roots.add(root);
            for (int m = 0; m < 5; m++) {
                GroupName mid = group("mid" + r + "_" + m);
                fx.groupService.addMember(root, mid, ctx);
                for (int l = 0; l < 5; l++) {
                    GroupName leaf = group("leaf" + r + "_" + m + "_" + l);
                    fx.groupService.addMember(mid, leaf, ctx);
                    for (int u = 0; u < 5; u++) {
                        fx.groupService.addMember(leaf, pool.get(random.nextInt(pool.size())), ctx);
                    }
                }
            }
        }

        // Act
        Set<UserId> actual = fx.groupService.intersectGroups(Set.copyOf(roots), ctx);

        // Assert
        Map<GroupIdentity, Set<Subject>> edges = fx.directory.directEdges();
        Set<UserId> expected = null;
        for (GroupName root : roots) {
            Set<UserId> closureUsers = closure(root, edges).stream()
                .filter(UserId.class::isInstance)
                .map(UserId.class::cast)
                .collect(Collectors.toSet());
            if (expected == null) {
                expected = closureUsers;
            } else {
                expected.retainAll(closureUsers);
            }
        }
        assertThat(actual).isEqualTo(expected);
    }

    private GroupName group(String name) {
        GroupName group = new GroupName(name);
        fx.groupService.createGroup(group, null, Set.of(), null, ctx);
        return group;
    }

    private void assertIndexMatchesClosure() {
        Map<GroupIdentity, Set<Subject>> edges = fx.directory.directEdges();
        Map<GroupIdentity, Set<Subject>> flat = fx.directory.flattened();
        for (GroupIdentity group : edges.keySet()) {
            assertThat(flat.getOrDefault(group, Set.of()))
                .as("flattened members of %s", group)
                .isEqualTo(closure(group, edges));
        }
    }

    private static Set<Subject> closure(GroupIdentity root, Map<GroupIdentity, Set<Subject>> edges) {
        Set<Subject> reached = new HashSet<>();
        Deque<GroupIdentity> pending = new ArrayDeque<>(List.of(root));
        Set<GroupIdentity> seen = new HashSet<>();
        while (!pending.isEmpty()) {
            GroupIdentity current = pending.poll();
            if (!seen.add(current)) {
                continue;
            }
            for (Subject member : edges.getOrDefault(current, Set.of())) {
                reached.add(member);
                if (member instanceof GroupIdentity nested) {
                    pending.add(nested);
                }
            }
        }
        return reached;
    }
}
