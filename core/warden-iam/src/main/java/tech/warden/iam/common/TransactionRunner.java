package tech.warden.iam.common;

import java.util.function.Supplier;

/**
 * Runs store work inside a database transaction.
 *
 * <p>Writes run SERIALIZABLE and are retried a bounded number of times on
 * serialization failure. Reads run against a read-only snapshot. A call made
 * while a transaction is already active joins it.
 */
public interface TransactionRunner {

    /**
     * Run mutating work in a serializable transaction.
     *
     * @param operation name used in logs and error details
     */
    <T> T serializableWrite(String operation, RequestContext ctx, Supplier<T> work);

    /**
     * Run read-only work against a consistent snapshot.
     */
    <T> T readOnly(String operation, RequestContext ctx, Supplier<T> work);

    /**
     * Run the callback once the current transaction has committed, or right away
     * when no transaction is active. Never runs on rollback.
     */
    void afterCommit(Runnable callback);

    default void serializableWrite(String operation, RequestContext ctx, Runnable work) {
        serializableWrite(operation, ctx, () -> {
            work.run();
            return null;
        });
    }
}
