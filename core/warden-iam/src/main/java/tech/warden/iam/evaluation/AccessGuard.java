package tech.warden.iam.evaluation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.common.TransactionRunner;
import tech.warden.iam.common.errors.UseCaseError;
import tech.warden.iam.resource.ResourceRepository;
import tech.warden.iam.subject.FullyQualifiedResourceId;
import tech.warden.iam.subject.UserId;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Authorization checks for gated mutations.
 *
 * <p>A caller that holds no action at all on a resource gets NotFound, so the
 * existence of resources it cannot see does not leak. A caller that can see the
 * resource but lacks a required action gets an {@link UseCaseError.AuthorizationError}.
 */
@ApplicationScoped
public class AccessGuard {

    private final PolicyEvaluator evaluator;
    private final ResourceRepository resourceRepo;
    private final TransactionRunner tx;

    @Inject
    public AccessGuard(PolicyEvaluator evaluator, ResourceRepository resourceRepo, TransactionRunner tx) {
        this.evaluator = evaluator;
        this.resourceRepo = resourceRepo;
        this.tx = tx;
    }

    /**
     * Require every one of {@code actions} on the resource.
     *
     * @return empty if allowed, otherwise the error to report
     */
    public Optional<UseCaseError> requireAction(FullyQualifiedResourceId resource, Set<String> actions,
                                                RequestContext ctx) {
        UserId caller = ctx.caller();
        Set<String> granted = evaluator.listUserResourceActions(resource, caller, ctx);
        if (granted.containsAll(actions)) {
            return Optional.empty();
        }
        if (granted.isEmpty()) {
            return Optional.of(notFound(resource));
        }
        Set<String> missing = new TreeSet<>(actions);
        missing.removeAll(granted);
        return Optional.of(new UseCaseError.AuthorizationError(
            "FORBIDDEN",
            "You may not perform " + String.join(", ", missing) + " on " + resource,
            Map.of("resource", resource.toString(), "missingActions", missing)
        ));
    }

    /**
     * Require at least one of {@code actions} on the resource.
     */
    public Optional<UseCaseError> requireOneOfAction(FullyQualifiedResourceId resource, Set<String> actions,
                                                     RequestContext ctx) {
        Set<String> granted = evaluator.listUserResourceActions(resource, ctx.caller(), ctx);
        if (actions.stream().anyMatch(granted::contains)) {
            return Optional.empty();
        }
        if (granted.isEmpty()) {
            return Optional.of(notFound(resource));
        }
        return Optional.of(new UseCaseError.AuthorizationError(
            "FORBIDDEN",
            "You may not perform any of " + String.join(", ", new TreeSet<>(actions)) + " on " + resource,
            Map.of("resource", resource.toString(), "requiredActions", new TreeSet<>(actions))
        ));
    }

    /**
     * Require {@code actions} on the parent of {@code child}: {@code newParent} when given,
     * otherwise the current parent. Passes when there is no parent.
     */
    public Optional<UseCaseError> requireParentAction(FullyQualifiedResourceId child, FullyQualifiedResourceId newParent,
                                                      Set<String> actions, RequestContext ctx) {
        Optional<FullyQualifiedResourceId> parent = newParent != null
            ? Optional.of(newParent)
            : tx.readOnly("findParent", ctx, () -> resourceRepo.findParent(child));
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        return requireAction(parent.get(), actions, ctx);
    }

    private static UseCaseError notFound(FullyQualifiedResourceId resource) {
        return new UseCaseError.NotFoundError(
            "RESOURCE_NOT_FOUND",
            "Resource " + resource + " not found",
            Map.of("resource", resource.toString())
        );
    }
}
