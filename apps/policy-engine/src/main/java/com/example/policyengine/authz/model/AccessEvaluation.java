package com.example.policyengine.authz.model;

import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Outcome of a single permission check: either a boolean decision or a
 * {@link PreconditionFailure}. Precondition failures are values, not exceptions,
 * so callers can tell "inactive/deleted" apart from "no policy grants it".
 *
 * @param allowed      whether the action is permitted
 * @param precondition the actor or resource state that stopped the check, if any
 */
public record AccessEvaluation(
        boolean allowed,
        @Nullable PreconditionFailure precondition
) {
    private static final AccessEvaluation GRANTED = new AccessEvaluation(true, null);
    private static final AccessEvaluation DENIED = new AccessEvaluation(false, null);

    public AccessEvaluation {
        if (allowed && precondition != null) {
            throw new IllegalArgumentException("A precondition failure cannot be granted");
        }
    }

    public static AccessEvaluation granted() {
        return GRANTED;
    }

    public static AccessEvaluation denied() {
        return DENIED;
    }

    public static AccessEvaluation of(boolean allowed) {
        return allowed ? GRANTED : DENIED;
    }

    public static AccessEvaluation failed(PreconditionFailure failure) {
        return new AccessEvaluation(false, failure);
    }

    /**
     * Check if the check completed and access was granted.
     */
    public boolean isGranted() {
        return allowed;
    }

    /**
     * Check if the check stopped on actor or resource state.
     */
    public boolean isPreconditionFailure() {
        return precondition != null;
    }

    public Optional<PreconditionFailure> failure() {
        return Optional.ofNullable(precondition);
    }

    /**
     * Collapse to a boolean, treating precondition failures as "no access".
     */
    public boolean orElseDeny() {
        return precondition == null && allowed;
    }
}
