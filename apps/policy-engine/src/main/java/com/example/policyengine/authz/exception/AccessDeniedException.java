package com.example.policyengine.authz.exception;

import com.example.policyengine.authz.model.PermissionAction;
import com.example.policyengine.authz.model.PreconditionFailure;
import lombok.Getter;
import org.springframework.lang.Nullable;

// Access refused by requirePermission. Callers map this to a 403-equivalent response.
@Getter
public class AccessDeniedException extends RuntimeException {

    private final String actorId;
    private final String resourceId;
    private final PermissionAction action;

    @Nullable
    private final PreconditionFailure failure;

    public AccessDeniedException(String actorId, String resourceId, PermissionAction action,
            @Nullable PreconditionFailure failure) {
        super(failure != null
                ? String.format("Access denied: %s (actor=%s, resource=%s, action=%s)",
                        failure.message(), actorId, resourceId, action.label())
                : String.format("Access denied: actor %s cannot %s resource %s",
                        actorId, action.label(), resourceId));
        this.actorId = actorId;
        this.resourceId = resourceId;
        this.action = action;
        this.failure = failure;
    }

    /**
     * Check if the denial came from actor/resource state rather than a missing grant.
     */
    public boolean isPreconditionFailure() {
        return failure != null;
    }
}
