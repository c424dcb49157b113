package tech.warden.iam.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for IAM failures.
 *
 * Errors are categorized by kind so a request-handling layer can map them to
 * stable status codes. The {@code code} is stable, the {@code message} is for humans.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Malformed request: unknown resource type, action matching no pattern,
     * role not defined on the type, etc.
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Identity already exists (group, user, resource, policy).
     * Maps to HTTP 409 Conflict.
     */
    record ConflictError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Entity not found, or the caller cannot see it at all.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Membership or resource hierarchy change would introduce a cycle.
     * Maps to HTTP 400 Bad Request.
     */
    record InvalidGraphError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Deleting something that is still referenced elsewhere.
     * Maps to HTTP 409 Conflict.
     */
    record ReferentialIntegrityError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Caller can see the resource but lacks the required action.
     * Maps to HTTP 403 Forbidden.
     */
    record AuthorizationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Serialization failure that survived the bounded retries. Transient.
     * Maps to HTTP 503 Service Unavailable.
     */
    record ConcurrencyError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
