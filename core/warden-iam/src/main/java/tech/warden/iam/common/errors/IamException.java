package tech.warden.iam.common.errors;

/**
 * Carries a {@link UseCaseError} out of the store and service layers.
 *
 * <p>Thrown inside a transaction it also forces rollback. The use-case layer
 * converts it back to a {@code Result.Failure}.
 */
public class IamException extends RuntimeException {

    private final UseCaseError error;

    public IamException(UseCaseError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public IamException(UseCaseError error, Throwable cause) {
        super(error.code() + ": " + error.message(), cause);
        this.error = error;
    }

    public UseCaseError error() {
        return error;
    }
}
