package tech.warden.iam.common;

import tech.warden.iam.shared.TsidGenerator;
import tech.warden.iam.subject.UserId;

import java.time.Instant;

/**
 * Tracing and caller identity for one request.
 *
 * <p>Passed explicitly as the last argument of every store, service and use case
 * call. The core never reads it from ambient state; it only logs it and uses
 * {@link #caller()} for authorization checks.
 *
 * @param executionId   Unique ID for this execution (generated)
 * @param correlationId ID for distributed tracing (usually from the inbound request)
 * @param principalId   ID of the user performing the action, null for system work
 * @param initiatedAt   When the execution was initiated
 */
public record RequestContext(
    String executionId,
    String correlationId,
    String principalId,
    Instant initiatedAt
) {

    /**
     * Create a context for a fresh request by the given user.
     */
    public static RequestContext create(String principalId) {
        String execId = "exec-" + TsidGenerator.generateRaw();
        return new RequestContext(execId, execId, principalId, Instant.now());
    }

    /**
     * Create a context that continues an existing trace.
     */
    public static RequestContext withCorrelation(String principalId, String correlationId) {
        String execId = "exec-" + TsidGenerator.generateRaw();
        return new RequestContext(execId, correlationId != null ? correlationId : execId, principalId, Instant.now());
    }

    /**
     * Context for work not initiated by a user (startup, repair jobs).
     */
    public static RequestContext system() {
        return create(null);
    }

    /**
     * The calling user.
     *
     * @throws IllegalStateException for system contexts
     */
    public UserId caller() {
        if (principalId == null) {
            throw new IllegalStateException("System request context has no caller");
        }
        return new UserId(principalId);
    }
}
