package com.example.policyengine.authz.source;

import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.SubjectKind;
import org.springframework.lang.Nullable;

/**
 * Query filter for a {@link PolicySource}. Null fields are not constrained.
 *
 * <p>{@code includeGlobal} widens a resource-id constraint to also match policies
 * with no resource id (global policies of the same kind).
 */
public record PolicyFilter(
        @Nullable SubjectKind subjectKind,
        @Nullable String subjectId,
        @Nullable ResourceKind resourceKind,
        @Nullable String resourceId,
        boolean includeGlobal,
        @Nullable Boolean active
) {
    /**
     * Match every policy.
     */
    public static PolicyFilter all() {
        return new PolicyFilter(null, null, null, null, false, null);
    }

    /**
     * Policies that can apply to the resource: specific to it, or global for its kind.
     */
    public static PolicyFilter forResource(ResourceKind kind, String resourceId) {
        return new PolicyFilter(null, null, kind, resourceId, true, null);
    }

    /**
     * Policies scoped to exactly this resource id (globals excluded).
     */
    public static PolicyFilter forResourceId(String resourceId) {
        return new PolicyFilter(null, null, null, resourceId, false, null);
    }

    /**
     * Policies written for a subject.
     */
    public static PolicyFilter forSubject(SubjectKind kind, String subjectId) {
        return new PolicyFilter(kind, subjectId, null, null, false, null);
    }

    /**
     * Copy of this filter restricted to active (or inactive) policies.
     */
    public PolicyFilter withActive(boolean activeOnly) {
        return new PolicyFilter(subjectKind, subjectId, resourceKind, resourceId, includeGlobal, activeOnly);
    }

    public boolean matches(PolicyRecord policy) {
        if (subjectKind != null && policy.subjectKind() != subjectKind) {
            return false;
        }
        if (subjectId != null && !subjectId.equals(policy.subjectId())) {
            return false;
        }
        if (resourceKind != null && policy.resourceKind() != resourceKind) {
            return false;
        }
        if (resourceId != null && !resourceId.equals(policy.resourceId())
                && !(includeGlobal && policy.isGlobal())) {
            return false;
        }
        return active == null || policy.active() == active;
    }
}
