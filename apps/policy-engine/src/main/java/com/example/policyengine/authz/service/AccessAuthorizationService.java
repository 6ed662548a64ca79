package com.example.policyengine.authz.service;

import com.example.policyengine.authz.engine.PolicyEvaluator;
import com.example.policyengine.authz.exception.AccessDeniedException;
import com.example.policyengine.authz.model.AccessEvaluation;
import com.example.policyengine.authz.model.ActorSnapshot;
import com.example.policyengine.authz.model.PermissionAction;
import com.example.policyengine.authz.model.PolicyDecision;
import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.PreconditionFailure;
import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.ResourceSnapshot;
import com.example.policyengine.authz.model.SubjectKind;
import com.example.policyengine.authz.provider.ActorProvider;
import com.example.policyengine.authz.provider.ResourceProvider;
import com.example.policyengine.authz.source.PolicySource;
import com.example.policyengine.authz.source.PolicyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Authorization workflow around the {@link PolicyEvaluator}.
 * Loads candidate policies for the resource, evaluates, and exposes the result reactively.
 * Granting and revoking per-user access requires {@link PermissionAction#MANAGE} on the
 * resource and a writable {@link PolicyStore}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.authz.enabled", havingValue = "true")
public class AccessAuthorizationService {

    private final PolicyEvaluator evaluator;
    private final PolicySource policySource;

    @Nullable
    private final PolicyStore policyStore;

    @Nullable
    private final ActorProvider actorProvider;

    @Nullable
    private final ResourceProvider resourceProvider;

    public AccessAuthorizationService(
            PolicyEvaluator evaluator,
            PolicySource policySource,
            @Nullable PolicyStore policyStore,
            @Nullable ActorProvider actorProvider,
            @Nullable ResourceProvider resourceProvider) {
        this.evaluator = evaluator;
        this.policySource = policySource;
        this.policyStore = policyStore;
        this.actorProvider = actorProvider;
        this.resourceProvider = resourceProvider;
    }

    /**
     * Evaluate a permission check against the policies stored for the resource.
     */
    public Mono<AccessEvaluation> check(ActorSnapshot actor, ResourceSnapshot resource, PermissionAction action) {
        return candidatesFor(resource)
                .map(candidates -> evaluator.evaluate(actor, resource, action, candidates));
    }

    /**
     * Evaluate a permission check by identifiers, resolving snapshots through the providers.
     *
     * @return Mono emitting the evaluation, empty if a provider is missing or a snapshot is not found
     */
    public Mono<AccessEvaluation> check(String actorId, ResourceKind kind, String resourceId,
            PermissionAction action) {
        if (actorProvider == null || resourceProvider == null) {
            log.warn("ActorProvider or ResourceProvider not available");
            return Mono.empty();
        }

        return actorProvider.findActor(actorId)
                .zipWith(resourceProvider.findResource(kind, resourceId))
                .flatMap(pair -> check(pair.getT1(), pair.getT2(), action));
    }

    /**
     * Check if access is allowed (convenience method). Precondition failures emit false.
     */
    public Mono<Boolean> isAllowed(ActorSnapshot actor, ResourceSnapshot resource, PermissionAction action) {
        return check(actor, resource, action).map(AccessEvaluation::orElseDeny);
    }

    /**
     * Every action the actor may perform on the resource.
     */
    public Mono<Set<PermissionAction>> grantedActions(ActorSnapshot actor, ResourceSnapshot resource) {
        return candidatesFor(resource)
                .map(candidates -> evaluator.grantedActions(actor, resource, candidates));
    }

    /**
     * Evaluate and explain which policy (or override, or precondition) decided.
     */
    public Mono<PolicyDecision> explain(ActorSnapshot actor, ResourceSnapshot resource, PermissionAction action) {
        return candidatesFor(resource)
                .map(candidates -> evaluator.explain(actor, resource, action, candidates));
    }

    /**
     * Complete empty when access is granted; error with {@link AccessDeniedException} otherwise.
     * Precondition failures and missing grants are both denials.
     */
    public Mono<Void> requirePermission(ActorSnapshot actor, ResourceSnapshot resource, PermissionAction action) {
        return check(actor, resource, action)
                .flatMap(evaluation -> {
                    if (evaluation.isGranted()) {
                        return Mono.<Void>empty();
                    }
                    log.warn("Access DENIED: actor={}, resource={}/{}, action={}, reason={}",
                            actor.id(), resource.kind().label(), resource.id(), action.label(),
                            evaluation.failure().map(PreconditionFailure::message)
                                    .orElse("no policy grants the action"));
                    return Mono.<Void>error(new AccessDeniedException(
                            actor.id(), resource.id(), action, evaluation.failure().orElse(null)));
                });
    }

    /**
     * Grant a user actions on one resource by saving a user-scoped, resource-specific policy.
     *
     * @param actor     who is granting; must hold MANAGE on the resource
     * @param resource  the resource being shared
     * @param granteeId user receiving the grant
     * @param actions   actions to grant, at least one
     * @param priority  priority of the new policy
     * @return Mono emitting the saved policy, or erroring with {@link AccessDeniedException}
     *         or {@link com.example.policyengine.authz.exception.PolicyValidationException}
     */
    public Mono<PolicyRecord> grantAccess(ActorSnapshot actor, ResourceSnapshot resource, String granteeId,
            Collection<PermissionAction> actions, int priority) {
        if (policyStore == null) {
            return Mono.error(new IllegalStateException("No writable PolicyStore configured"));
        }

        return requirePermission(actor, resource, PermissionAction.MANAGE)
                .then(Mono.fromCallable(() -> PolicyRecord.builder()
                        .id(UUID.randomUUID().toString())
                        .name(String.format("Access to %s %s", resource.kind().label(), resource.id()))
                        .description(String.format("Granted by %s to %s", actor.id(), granteeId))
                        .subjectKind(SubjectKind.USER)
                        .subjectId(granteeId)
                        .resourceKind(resource.kind())
                        .resourceId(resource.id())
                        .actions(actions == null ? null : new HashSet<>(actions))
                        .active(true)
                        .priority(priority)
                        .build()))
                .flatMap(policyStore::save)
                .doOnNext(saved -> log.info(
                        "Access GRANTED: policy={}, grantedBy={}, grantee={}, resource={}/{}, actions={}",
                        saved.id(), actor.id(), granteeId, resource.kind().label(), resource.id(), saved.actions()));
    }

    /**
     * Remove the user's grants on one resource. Role and global policies are untouched.
     *
     * @param actor     who is revoking; must hold MANAGE on the resource
     * @param resource  the shared resource
     * @param granteeId user losing access
     * @return Mono emitting the number of removed policies, or erroring with {@link AccessDeniedException}
     */
    public Mono<Long> revokeAccess(ActorSnapshot actor, ResourceSnapshot resource, String granteeId) {
        if (policyStore == null) {
            return Mono.error(new IllegalStateException("No writable PolicyStore configured"));
        }

        return requirePermission(actor, resource, PermissionAction.MANAGE)
                .then(Mono.defer(() -> policyStore.deleteByResourceAndSubject(
                        resource.kind(), resource.id(), granteeId)))
                .doOnNext(removed -> log.info("Access REVOKED: revokedBy={}, grantee={}, resource={}/{}, removed={}",
                        actor.id(), granteeId, resource.kind().label(), resource.id(), removed));
    }

    private Mono<List<PolicyRecord>> candidatesFor(ResourceSnapshot resource) {
        return policySource.findForResource(resource.kind(), resource.id())
                .collectList()
                .doOnError(e -> log.error("Failed to load policies for {}/{}: {}",
                        resource.kind().label(), resource.id(), e.getMessage()));
    }
}
