package com.example.policyengine.authz.model;

import org.springframework.lang.Nullable;

/**
 * Explained access decision: the outcome plus what produced it.
 *
 * @param decision   ALLOW or DENY
 * @param reason     human-readable explanation
 * @param policyId   the deciding policy, {@link #ADMIN_OVERRIDE} or {@link #DEFAULT_DENY};
 *                   null when a precondition failed
 * @param priority   priority of the deciding policy, null when no policy decided
 * @param failure    the precondition that stopped evaluation, if any
 */
public record PolicyDecision(
        Decision decision,
        String reason,
        @Nullable String policyId,
        @Nullable Integer priority,
        @Nullable PreconditionFailure failure
) {
    public static final String ADMIN_OVERRIDE = "ADMIN_OVERRIDE";
    public static final String DEFAULT_DENY = "DEFAULT_DENY";

    public enum Decision {
        ALLOW,
        DENY
    }

    /**
     * Create an ALLOW decision attributed to a policy.
     */
    public static PolicyDecision allow(PolicyRecord policy, PermissionAction action) {
        return new PolicyDecision(Decision.ALLOW,
                String.format("Policy %s grants %s", policy.id(), action.label()),
                policy.id(), policy.priority(), null);
    }

    /**
     * Create an ALLOW decision for the administrative override.
     */
    public static PolicyDecision adminOverride(String actorId) {
        return new PolicyDecision(Decision.ALLOW,
                String.format("Actor %s holds the admin role", actorId),
                ADMIN_OVERRIDE, null, null);
    }

    /**
     * Create a DENY decision when no applicable policy grants the action.
     */
    public static PolicyDecision defaultDeny(PermissionAction action, int applicableCount) {
        return new PolicyDecision(Decision.DENY,
                String.format("None of %d applicable policies grants %s", applicableCount, action.label()),
                DEFAULT_DENY, null, null);
    }

    /**
     * Create a DENY decision for a failed precondition.
     */
    public static PolicyDecision preconditionFailed(PreconditionFailure failure) {
        return new PolicyDecision(Decision.DENY, failure.message(), null, null, failure);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }

    /**
     * Same outcome as an {@link AccessEvaluation}.
     */
    public AccessEvaluation toEvaluation() {
        if (failure != null) {
            return AccessEvaluation.failed(failure);
        }
        return AccessEvaluation.of(isAllowed());
    }
}
