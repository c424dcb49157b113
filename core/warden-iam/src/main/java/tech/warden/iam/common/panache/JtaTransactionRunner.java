package tech.warden.iam.common.panache;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Synchronization;
import jakarta.transaction.TransactionSynchronizationRegistry;
import org.jboss.logging.Logger;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamErrors;
import tech.warden.iam.common.errors.IamException;
import tech.warden.iam.config.WardenConfig;

import java.sql.SQLException;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JTA implementation of {@link TransactionRunner} for PostgreSQL.
 *
 * <p>The isolation level is set with {@code SET TRANSACTION}, which must be the
 * first statement of the transaction. A nested call joins the active transaction
 * and leaves retries to the outermost caller.
 *
 * <p>SQLSTATE 40001 (serialization failure) and 40P01 (deadlock) are retried with
 * linear backoff. 23505 (unique violation) becomes a conflict.
 */
@ApplicationScoped
public class JtaTransactionRunner implements TransactionRunner {

    private static final Logger LOG = Logger.getLogger(JtaTransactionRunner.class);

    private static final String SERIALIZABLE = "SET TRANSACTION ISOLATION LEVEL SERIALIZABLE";
    private static final String SNAPSHOT_READ = "SET TRANSACTION ISOLATION LEVEL REPEATABLE READ READ ONLY";

    private static final String SERIALIZATION_FAILURE = "40001";
    private static final String DEADLOCK_DETECTED = "40P01";
    private static final String UNIQUE_VIOLATION = "23505";

    // jakarta.transaction.Status.STATUS_COMMITTED
    private static final int STATUS_COMMITTED = 3;

    @Inject
    EntityManager em;

    @Inject
    TransactionSynchronizationRegistry txSyncRegistry;

    @Inject
    WardenConfig config;

    @Override
    public <T> T serializableWrite(String operation, RequestContext ctx, Supplier<T> work) {
        return run(operation, ctx, SERIALIZABLE, work);
    }

    @Override
    public <T> T readOnly(String operation, RequestContext ctx, Supplier<T> work) {
        return run(operation, ctx, SNAPSHOT_READ, work);
    }

    @Override
    public void afterCommit(Runnable callback) {
        if (!QuarkusTransaction.isActive()) {
            callback.run();
            return;
        }
        txSyncRegistry.registerInterposedSynchronization(new Synchronization() {
            @Override
            public void beforeCompletion() {
                // nothing to flush
            }

            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    callback.run();
                }
            }
        });
    }

    private <T> T run(String operation, RequestContext ctx, String isolation, Supplier<T> work) {
        if (QuarkusTransaction.isActive()) {
            return work.get();
        }

        int maxRetries = config.transactions().maxRetries();
        long backoffMs = config.transactions().retryBackoff().toMillis();

        for (int attempt = 1; ; attempt++) {
            try {
                return QuarkusTransaction.requiringNew().call(() -> {
                    em.createNativeQuery(isolation).executeUpdate();
                    return work.get();
                });
            } catch (IamException e) {
                throw e;
            } catch (RuntimeException e) {
                String sqlState = sqlState(e);
                if (isRetryable(sqlState) && attempt <= maxRetries) {
                    LOG.debugf("Retrying %s after SQLSTATE %s (attempt %d of %d, execution %s)",
                        operation, sqlState, attempt, maxRetries, ctx.executionId());
                    sleep(backoffMs * attempt);
                    continue;
                }
                throw translate(operation, ctx, sqlState, attempt, e);
            }
        }
    }

    private RuntimeException translate(String operation, RequestContext ctx, String sqlState,
                                       int attempts, RuntimeException e) {
        if (isRetryable(sqlState)) {
            LOG.warnf("Giving up on %s after %d attempts (execution %s)", operation, attempts, ctx.executionId());
            return IamErrors.concurrency(
                "Concurrent modification, retry later",
                Map.of("operation", operation, "attempts", attempts),
                e
            );
        }
        if (UNIQUE_VIOLATION.equals(sqlState)) {
            return IamErrors.conflict(
                "ALREADY_EXISTS",
                "Entity already exists",
                Map.of("operation", operation)
            );
        }
        return e;
    }

    private static boolean isRetryable(String sqlState) {
        return SERIALIZATION_FAILURE.equals(sqlState) || DEADLOCK_DETECTED.equals(sqlState);
    }

    private static String sqlState(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw IamErrors.concurrency("Interrupted while waiting to retry", Map.of(), e);
        }
    }
}
