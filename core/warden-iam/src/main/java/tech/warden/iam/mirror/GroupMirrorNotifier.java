package tech.warden.iam.mirror;

/**
 * Receives committed membership changes for an external group mirror.
 *
 * <p>Called after commit. Implementations must not block for long; failures are
 * logged by the caller and never reach the request.
 */
public interface GroupMirrorNotifier {

    void notify(GroupMembershipChange change);
}
