package com.example.policyengine.authz.engine;

import com.example.policyengine.authz.model.AccessEvaluation;
import com.example.policyengine.authz.model.ActorSnapshot;
import com.example.policyengine.authz.model.PermissionAction;
import com.example.policyengine.authz.model.PolicyDecision;
import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.PreconditionFailure;
import com.example.policyengine.authz.model.ResourceSnapshot;
import com.example.policyengine.authz.model.SubjectKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Access policy evaluator - decides whether an actor may perform an action on a resource.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>Inactive actor: precondition failure {@link PreconditionFailure#ACTOR_INACTIVE}</li>
 *   <li>Deleted resource: precondition failure {@link PreconditionFailure#RESOURCE_UNAVAILABLE}</li>
 *   <li>Admin role: granted, policies are not inspected</li>
 *   <li>Otherwise: granted iff any applicable policy grants the action</li>
 * </ol>
 *
 * <p>A policy is applicable when it is active, names the actor (by user id or by role
 * label) and covers the resource (same kind, and same id unless the policy is global).
 * Grants are additive. There are no deny rules, so priority never excludes a grant.
 *
 * <p>Candidate policies are re-filtered here regardless of how the caller loaded them.
 * The evaluator holds no state and does no I/O; one instance can be shared by any
 * number of threads.
 */
@Slf4j
public class PolicyEvaluator {

    private static final Set<PermissionAction> ALL_ACTIONS =
            Collections.unmodifiableSet(EnumSet.allOf(PermissionAction.class));

    /**
     * Evaluate a permission check.
     *
     * @param actor      the acting user
     * @param resource   the target resource
     * @param action     the action requested
     * @param candidates policies to consider, may be null or contain policies for other subjects/resources
     * @return granted/denied, or the precondition failure that stopped evaluation
     */
    public AccessEvaluation evaluate(ActorSnapshot actor, ResourceSnapshot resource, PermissionAction action,
            @Nullable Collection<PolicyRecord> candidates) {
        Objects.requireNonNull(action, "action");

        Optional<PreconditionFailure> failure = checkPreconditions(actor, resource);
        if (failure.isPresent()) {
            log.debug("Precondition failed: {} (actor={}, resource={}/{}, action={})",
                    failure.get(), actor.id(), resource.kind().label(), resource.id(), action.label());
            return AccessEvaluation.failed(failure.get());
        }

        if (actor.isAdmin()) {
            log.debug("Admin override: actor={}, resource={}/{}, action={}",
                    actor.id(), resource.kind().label(), resource.id(), action.label());
            return AccessEvaluation.granted();
        }

        boolean granted = applicable(actor, resource, candidates).stream()
                .anyMatch(policy -> policy.grantsAction(action));

        log.debug("Access {}: actor={}, resource={}/{}, action={}",
                granted ? "GRANTED" : "DENIED", actor.id(), resource.kind().label(), resource.id(), action.label());
        return AccessEvaluation.of(granted);
    }

    /**
     * Evaluate a permission check, treating precondition failures as "no access".
     */
    public boolean evaluateOrDefault(ActorSnapshot actor, ResourceSnapshot resource, PermissionAction action,
            @Nullable Collection<PolicyRecord> candidates) {
        return evaluate(actor, resource, action, candidates).orElseDeny();
    }

    /**
     * Every action the actor may perform on the resource.
     * Full vocabulary for an admin, the union of applicable grants otherwise,
     * and an empty set when a precondition fails.
     */
    public Set<PermissionAction> grantedActions(ActorSnapshot actor, ResourceSnapshot resource,
            @Nullable Collection<PolicyRecord> candidates) {
        if (checkPreconditions(actor, resource).isPresent()) {
            return Set.of();
        }
        if (actor.isAdmin()) {
            return ALL_ACTIONS;
        }

        EnumSet<PermissionAction> granted = EnumSet.noneOf(PermissionAction.class);
        for (PolicyRecord policy : applicable(actor, resource, candidates)) {
            granted.addAll(policy.actions());
            if (granted.size() == ALL_ACTIONS.size()) {
                break;
            }
        }
        return Collections.unmodifiableSet(granted);
    }

    /**
     * Check if the actor may grant or revoke access on the resource.
     */
    public boolean canManage(ActorSnapshot actor, ResourceSnapshot resource,
            @Nullable Collection<PolicyRecord> candidates) {
        return evaluateOrDefault(actor, resource, PermissionAction.MANAGE, candidates);
    }

    /**
     * Ownership is a structural fact, independent of any policy.
     */
    public boolean isOwner(ActorSnapshot actor, ResourceSnapshot resource) {
        return actor.id().equals(resource.ownerId());
    }

    /**
     * The applicable set for this actor and resource, highest precedence first.
     * Preconditions and the admin override are not applied here.
     */
    public List<PolicyRecord> applicablePolicies(ActorSnapshot actor, ResourceSnapshot resource,
            @Nullable Collection<PolicyRecord> candidates) {
        return applicable(actor, resource, candidates).stream()
                .sorted(PolicyRecord.PRECEDENCE)
                .toList();
    }

    /**
     * Evaluate and explain. The outcome always matches {@link #evaluate}; for a grant the
     * deciding policy is the highest-precedence applicable policy granting the action.
     */
    public PolicyDecision explain(ActorSnapshot actor, ResourceSnapshot resource, PermissionAction action,
            @Nullable Collection<PolicyRecord> candidates) {
        Objects.requireNonNull(action, "action");

        Optional<PreconditionFailure> failure = checkPreconditions(actor, resource);
        if (failure.isPresent()) {
            return PolicyDecision.preconditionFailed(failure.get());
        }
        if (actor.isAdmin()) {
            return PolicyDecision.adminOverride(actor.id());
        }

        List<PolicyRecord> ordered = applicablePolicies(actor, resource, candidates);
        return ordered.stream()
                .filter(policy -> policy.grantsAction(action))
                .findFirst()
                .map(policy -> PolicyDecision.allow(policy, action))
                .orElseGet(() -> PolicyDecision.defaultDeny(action, ordered.size()));
    }

    private Optional<PreconditionFailure> checkPreconditions(ActorSnapshot actor, ResourceSnapshot resource) {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(resource, "resource");

        if (!actor.active()) {
            return Optional.of(PreconditionFailure.ACTOR_INACTIVE);
        }
        if (resource.deleted()) {
            return Optional.of(PreconditionFailure.RESOURCE_UNAVAILABLE);
        }
        return Optional.empty();
    }

    private List<PolicyRecord> applicable(ActorSnapshot actor, ResourceSnapshot resource,
            @Nullable Collection<PolicyRecord> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .filter(Objects::nonNull)
                .filter(PolicyRecord::active)
                .filter(policy -> appliesToActor(policy, actor))
                .filter(policy -> policy.appliesToResource(resource.kind(), resource.id()))
                .toList();
    }

    private static boolean appliesToActor(PolicyRecord policy, ActorSnapshot actor) {
        return policy.appliesToSubject(SubjectKind.USER, actor.id())
                || policy.appliesToSubject(SubjectKind.ROLE, actor.role().label());
    }
}
