package tech.warden.iam.testing;

import tech.warden.iam.group.Group;
import tech.warden.iam.group.GroupRepository;
import tech.warden.iam.subject.GroupIdentity;
import tech.warden.iam.subject.GroupName;
import tech.warden.iam.subject.Subject;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryGroupRepository implements GroupRepository {

    private final InMemoryDirectory directory;

    public InMemoryGroupRepository(InMemoryDirectory directory) {
        this.directory = directory;
    }

    @Override
    public Optional<Group> findByIdentity(GroupIdentity identity) {
        synchronized (directory) {
            Group group = directory.groups.get(identity);
            if (group == null) {
                return Optional.empty();
            }
            Group copy = InMemoryDirectory.copy(group);
            copy.members = new HashSet<>(directory.edges.getOrDefault(identity, Set.of()));
            return Optional.of(copy);
        }
    }

    @Override
    public boolean exists(GroupIdentity identity) {
        synchronized (directory) {
            return directory.groups.containsKey(identity);
        }
    }

    @Override
    public Optional<String> findEmail(GroupIdentity identity) {
        synchronized (directory) {
            return Optional.ofNullable(directory.groups.get(identity)).map(group -> group.email);
        }
    }

    @Override
    public Map<GroupIdentity, String> findEmails(Collection<GroupIdentity> identities) {
        synchronized (directory) {
            Map<GroupIdentity, String> emails = new LinkedHashMap<>();
            for (GroupIdentity identity : identities) {
                Group group = directory.groups.get(identity);
                if (group != null) {
                    emails.put(identity, group.email);
                }
            }
            return emails;
        }
    }

    @Override
    public Optional<GroupIdentity> findIdentityByEmail(String email) {
        synchronized (directory) {
            return directory.groups.values().stream()
                .filter(group -> group.email.equalsIgnoreCase(email))
                .map(group -> group.identity)
                .findFirst();
        }
    }

    @Override
    public List<GroupIdentity> listAllIdentities() {
        synchronized (directory) {
            return List.copyOf(directory.groups.keySet());
        }
    }

    @Override
    public void insert(Group group) {
        synchronized (directory) {
            Group stored = InMemoryDirectory.copy(group);
            stored.members = new HashSet<>();
            directory.groups.put(group.identity, stored);
            directory.edges.put(group.identity, new HashSet<>(group.members));
        }
    }

    @Override
    public boolean delete(GroupIdentity identity) {
        synchronized (directory) {
            if (!directory.groups.containsKey(identity)) {
                return false;
            }
            directory.cascadeGroupDeleted(identity);
            return true;
        }
    }

    @Override
    public boolean insertMember(GroupIdentity group, Subject member) {
        synchronized (directory) {
            return directory.edges.computeIfAbsent(group, k -> new HashSet<>()).add(member);
        }
    }

    @Override
    public boolean deleteMember(GroupIdentity group, Subject member) {
        synchronized (directory) {
            Set<Subject> members = directory.edges.get(group);
            return members != null && members.remove(member);
        }
    }

    @Override
    public Set<Subject> findDirectMembers(GroupIdentity group) {
        synchronized (directory) {
            return new HashSet<>(directory.edges.getOrDefault(group, Set.of()));
        }
    }

    @Override
    public Set<GroupIdentity> findDirectParents(Subject member) {
        synchronized (directory) {
            Set<GroupIdentity> parents = new LinkedHashSet<>();
            directory.edges.forEach((group, members) -> {
                if (members.contains(member)) {
                    parents.add(group);
                }
            });
            return parents;
        }
    }

    @Override
    public void incrementVersion(GroupIdentity group, Instant updatedAt) {
        synchronized (directory) {
            Group stored = directory.groups.get(group);
            if (stored != null) {
                stored.version++;
                stored.updatedAt = updatedAt;
            }
        }
    }

    @Override
    public boolean updateSynchronized(GroupIdentity group, int version, Instant synchronizedAt) {
        synchronized (directory) {
            Group stored = directory.groups.get(group);
            if (stored == null) {
                return false;
            }
            int last = stored.lastSynchronizedVersion == null ? 0 : stored.lastSynchronizedVersion;
            if (version > stored.version || last >= version) {
                return false;
            }
            stored.lastSynchronizedVersion = version;
            stored.synchronizedAt = synchronizedAt;
            return true;
        }
    }

    @Override
    public Optional<String> findAccessInstructions(GroupName group) {
        synchronized (directory) {
            return Optional.ofNullable(directory.groups.get(group)).map(stored -> stored.accessInstructions);
        }
    }

    @Override
    public void setAccessInstructions(GroupName group, String instructions, Instant updatedAt) {
        synchronized (directory) {
            Group stored = directory.groups.get(group);
            if (stored != null) {
                stored.accessInstructions = instructions;
                stored.updatedAt = updatedAt;
            }
        }
    }
}
