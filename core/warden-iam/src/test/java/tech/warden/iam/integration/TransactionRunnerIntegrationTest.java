package tech.warden.iam.integration;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.IamException;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.config.WardenConfig;
import tech.warden.iam.shared.TsidGenerator;
import tech.warden.iam.subject.UserId;
import tech.warden.iam.user.UserService;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the JTA transaction runner: isolation levels, joining,
 * retries on serialization failure and SQLSTATE translation.
 */
@Tag("integration")
@QuarkusTest
class TransactionRunnerIntegrationTest {

    @Inject
    TransactionRunner tx;

    @Inject
    EntityManager em;

    @Inject
    UserService userService;

    @Inject
    WardenConfig config;

    private final RequestContext ctx = RequestContext.system();

    private UserId newUserId() {
        return new UserId("tx-" + TsidGenerator.generateRaw().toLowerCase());
    }

    private static PersistenceException sqlFailure(String sqlState) {
        return new PersistenceException("simulated", new SQLException("simulated " + sqlState, sqlState));
    }

    // ========================================
    // ISOLATION
    // ========================================

    @Test
    @DisplayName("writes should run serializable and reads repeatable read, read only")
    void isolation_shouldBeSetPerTransactionKind() {
        String writeLevel = tx.serializableWrite("showIsolation", ctx,
            () -> (String) em.createNativeQuery("SHOW transaction_isolation").getSingleResult());
        String readLevel = tx.readOnly("showIsolation", ctx,
            () -> (String) em.createNativeQuery("SHOW transaction_isolation").getSingleResult());
        String readOnly = tx.readOnly("showReadOnly", ctx,
            () -> (String) em.createNativeQuery("SHOW transaction_read_only").getSingleResult());

        assertThat(writeLevel).isEqualTo("serializable");
        assertThat(readLevel).isEqualTo("repeatable read");
        assertThat(readOnly).isEqualTo("on");
    }

    @Test
    @DisplayName("a nested call should join the outer transaction and roll back with it")
    void nestedCall_shouldJoinOuterTransaction() {
        UserId id = newUserId();

        assertThatThrownBy(() -> tx.serializableWrite("outer", ctx, () -> {
            userService.createUser(id, id.value() + "@test.warden.local", ctx);
            assertThat(tx.readOnly("inner", ctx, QuarkusTransaction::isActive)).isTrue();
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(userService.loadUser(id, ctx)).isEmpty();
    }

    // ========================================
    // RETRIES AND TRANSLATION
    // ========================================

    @Test
    @DisplayName("a serialization failure should be retried and then succeed")
    void serializationFailure_shouldBeRetried() {
        AtomicInteger attempts = new AtomicInteger();

        String result = tx.serializableWrite("flaky", ctx, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw sqlFailure("40001");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(2);
    }

    @Test
    @DisplayName("persistent deadlocks should surface as a concurrency error after the retry budget")
    void deadlock_shouldGiveUpAfterMaxRetries() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> tx.serializableWrite("deadlocked", ctx, () -> {
            attempts.incrementAndGet();
            throw sqlFailure("40P01");
        }))
            .isInstanceOf(IamException.class)
            .satisfies(e -> assertThat(((IamException) e).error()).isInstanceOf(UseCaseError.ConcurrencyError.class));

        assertThat(attempts).hasValue(config.transactions().maxRetries() + 1);
    }

    @Test
    @DisplayName("a unique violation from the database should become a conflict")
    void uniqueViolation_shouldBecomeConflict() {
        UserId id = newUserId();
        userService.createUser(id, id.value() + "@test.warden.local", ctx);

        assertThatThrownBy(() -> tx.serializableWrite("duplicateInsert", ctx, () -> em.createNativeQuery(
                "INSERT INTO iam_users (id, email, enabled, created_at, updated_at)"
                    + " VALUES (:id, :email, TRUE, now(), now())")
            .setParameter("id", id.value())
            .setParameter("email", "other-" + id.value() + "@test.warden.local")
            .executeUpdate()))
            .isInstanceOf(IamException.class)
            .satisfies(e -> assertThat(((IamException) e).error()).isInstanceOf(UseCaseError.ConflictError.class));
    }

    @Test
    @DisplayName("after-commit callbacks should run on commit only")
    void afterCommit_shouldSkipRolledBackTransactions() {
        AtomicBoolean committed = new AtomicBoolean();
        AtomicBoolean rolledBack = new AtomicBoolean();

        tx.serializableWrite("commit", ctx, () -> tx.afterCommit(() -> committed.set(true)));
        assertThatThrownBy(() -> tx.serializableWrite("rollback", ctx, () -> {
            tx.afterCommit(() -> rolledBack.set(true));
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(committed).isTrue();
        assertThat(rolledBack).isFalse();
    }
}
