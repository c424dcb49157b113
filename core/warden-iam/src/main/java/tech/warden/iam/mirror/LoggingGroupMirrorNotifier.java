package tech.warden.iam.mirror;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Default notifier when no mirror is deployed: logs the payload at debug level.
 */
@DefaultBean
@ApplicationScoped
public class LoggingGroupMirrorNotifier implements GroupMirrorNotifier {

    private static final Logger LOG = Logger.getLogger(LoggingGroupMirrorNotifier.class);

    @Override
    public void notify(GroupMembershipChange change) {
        LOG.debugf("%s for %s: %s", change.kind(), change.groupKey(), change.toJson());
    }
}
