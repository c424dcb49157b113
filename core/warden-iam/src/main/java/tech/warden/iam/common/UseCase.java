package tech.warden.iam.common;

import tech.warden.iam.common.errors.IamException;
import tech.warden.iam.common.errors.UseCaseError;

import java.util.Optional;

/**
 * Base interface for authorization-gated mutations.
 *
 * <p>{@link #execute(Object, RequestContext)} checks {@link #authorizeResource}
 * before delegating to {@link #doExecute}. Store and service failures raised as
 * {@link IamException} come back as {@link Result.Failure}.
 *
 * <p>Implementation example:
 * <pre>{@code
 * @ApplicationScoped
 * public class DeleteResourceUseCase implements UseCase<DeleteResourceCommand, FullyQualifiedResourceId> {
 *
 *     @Override
 *     public Optional<UseCaseError> authorizeResource(DeleteResourceCommand command, RequestContext context) {
 *         return accessGuard.requireAction(command.resource(), Set.of("delete"), context);
 *     }
 *
 *     @Override
 *     public Result<FullyQualifiedResourceId> doExecute(DeleteResourceCommand command, RequestContext context) {
 *         resourceService.deleteResource(command.resource(), context);
 *         return Result.success(command.resource());
 *     }
 * }
 * }</pre>
 *
 * @param <C> The command type
 * @param <R> The result value type
 */
public interface UseCase<C, R> {

    /**
     * Execute the use case with resource-level authorization.
     *
     * @param command The command to execute
     * @param context The request context with tracing and caller info
     * @return Success with the value, or Failure with error
     */
    default Result<R> execute(C command, RequestContext context) {
        try {
            Optional<UseCaseError> denied = authorizeResource(command, context);
            if (denied.isPresent()) {
                return Result.failure(denied.get());
            }
            return doExecute(command, context);
        } catch (IamException e) {
            return Result.failure(e.error());
        }
    }

    /**
     * Resource-level authorization guard.
     *
     * @return empty if the caller may proceed, otherwise the error to report
     */
    Optional<UseCaseError> authorizeResource(C command, RequestContext context);

    /**
     * Business logic implementation.
     */
    Result<R> doExecute(C command, RequestContext context);
}
