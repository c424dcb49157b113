package tech.warden.iam.common.errors;

import tech.warden.iam.common.errors.UseCaseError.AuthorizationError;
import tech.warden.iam.common.errors.UseCaseError.ConcurrencyError;
import tech.warden.iam.common.errors.UseCaseError.ConflictError;
import tech.warden.iam.common.errors.UseCaseError.InvalidGraphError;
import tech.warden.iam.common.errors.UseCaseError.NotFoundError;
import tech.warden.iam.common.errors.UseCaseError.ReferentialIntegrityError;
import tech.warden.iam.common.errors.UseCaseError.ValidationError;

import java.util.Map;

/**
 * Factories for the exceptions thrown by stores and services.
 */
public final class IamErrors {

    private IamErrors() {
    }

    public static IamException validation(String code, String message, Map<String, Object> details) {
        return new IamException(new ValidationError(code, message, details));
    }

    public static IamException conflict(String code, String message, Map<String, Object> details) {
        return new IamException(new ConflictError(code, message, details));
    }

    public static IamException notFound(String code, String message, Map<String, Object> details) {
        return new IamException(new NotFoundError(code, message, details));
    }

    public static IamException invalidGraph(String code, String message, Map<String, Object> details) {
        return new IamException(new InvalidGraphError(code, message, details));
    }

    public static IamException referentialIntegrity(String code, String message, Map<String, Object> details) {
        return new IamException(new ReferentialIntegrityError(code, message, details));
    }

    public static IamException forbidden(String code, String message, Map<String, Object> details) {
        return new IamException(new AuthorizationError(code, message, details));
    }

    public static IamException concurrency(String message, Map<String, Object> details, Throwable cause) {
        return new IamException(new ConcurrencyError("SERIALIZATION_FAILURE", message, details), cause);
    }
}
