package com.example.policyengine.authz.model;

import com.example.policyengine.authz.exception.PolicyValidationException;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One access grant: who (subject) may perform which actions on which resource.
 *
 * <p>Instances are validated on construction and never change. Update methods
 * ({@link #withActions}, {@link #activate}, {@link #deactivate}, {@link #withPriority})
 * return a new record.
 *
 * <h3>Scope</h3>
 * <ul>
 *   <li>Resource-specific: {@code resourceId} set, applies to that one resource</li>
 *   <li>Global: {@code resourceId} null, applies to every resource of {@code resourceKind}</li>
 * </ul>
 *
 * <h3>Priority</h3>
 * Lower number = higher precedence. Priority orders policies for diagnostics; it
 * never removes a grant from the union of applicable policies.
 *
 * <p>{@link #builder()} starts active with {@link #DEFAULT_PRIORITY}.
 */
@Builder
public record PolicyRecord(
        String id,
        String name,
        String description,
        SubjectKind subjectKind,
        String subjectId,
        ResourceKind resourceKind,
        @Nullable String resourceId,
        Set<PermissionAction> actions,
        boolean active,
        int priority,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 1000;
    public static final int DEFAULT_PRIORITY = 100;

    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 1000;

    /**
     * Highest precedence first; ties broken by id so the order is stable.
     */
    public static final Comparator<PolicyRecord> PRECEDENCE =
            Comparator.comparingInt(PolicyRecord::priority).thenComparing(PolicyRecord::id);

    public static PolicyRecordBuilder builder() {
        return new PolicyRecordBuilder()
                .active(true)
                .priority(DEFAULT_PRIORITY);
    }

    public PolicyRecord {
        requireNonBlank("id", id);
        requireNonBlank("name", name);
        if (name.length() > MAX_NAME_LENGTH) {
            throw PolicyValidationException.forField("name", name,
                    "must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (description == null) {
            description = "";
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw PolicyValidationException.forField("description", description.length() + " characters",
                    "must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (subjectKind == null) {
            throw PolicyValidationException.forField("subjectKind", null, "is required");
        }
        requireNonBlank("subjectId", subjectId);
        if (resourceKind == null) {
            throw PolicyValidationException.forField("resourceKind", null, "is required");
        }
        if (resourceId != null && resourceId.isBlank()) {
            throw PolicyValidationException.forField("resourceId", resourceId, "must not be blank when present");
        }
        actions = validActions(actions);
        requireValidPriority(priority);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Check if the policy is written for the given subject.
     */
    public boolean appliesToSubject(SubjectKind kind, String id) {
        return subjectKind == kind && subjectId.equals(id);
    }

    /**
     * Check if the policy covers the given resource. A global policy covers every
     * resource of its kind.
     */
    public boolean appliesToResource(ResourceKind kind, String id) {
        if (resourceKind != kind) {
            return false;
        }
        return resourceId == null || resourceId.equals(id);
    }

    /**
     * Check if the policy applies to every resource of its kind.
     */
    public boolean isGlobal() {
        return resourceId == null;
    }

    public boolean grantsAction(PermissionAction action) {
        return actions.contains(action);
    }

    /**
     * Lower priority number wins.
     */
    public boolean hasHigherPrecedenceThan(PolicyRecord other) {
        return priority < other.priority;
    }

    public PolicyRecord withActions(Collection<PermissionAction> newActions) {
        return new PolicyRecord(id, name, description, subjectKind, subjectId, resourceKind, resourceId,
                validActions(newActions), active, priority, createdAt, Instant.now());
    }

    public PolicyRecord activate() {
        return new PolicyRecord(id, name, description, subjectKind, subjectId, resourceKind, resourceId,
                actions, true, priority, createdAt, Instant.now());
    }

    public PolicyRecord deactivate() {
        return new PolicyRecord(id, name, description, subjectKind, subjectId, resourceKind, resourceId,
                actions, false, priority, createdAt, Instant.now());
    }

    public PolicyRecord withPriority(int newPriority) {
        requireValidPriority(newPriority);
        return new PolicyRecord(id, name, description, subjectKind, subjectId, resourceKind, resourceId,
                actions, active, newPriority, createdAt, Instant.now());
    }

    private static Set<PermissionAction> validActions(Collection<PermissionAction> actions) {
        if (actions == null || actions.isEmpty()) {
            throw PolicyValidationException.forField("actions", actions, "at least one action is required");
        }
        if (actions.stream().anyMatch(Objects::isNull)) {
            throw PolicyValidationException.forField("actions", actions, "must not contain null");
        }
        return Set.copyOf(EnumSet.copyOf(actions));
    }

    private static void requireValidPriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw PolicyValidationException.forField("priority", priority,
                    "must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
    }

    private static void requireNonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw PolicyValidationException.forField(field, value, "must not be blank");
        }
    }
}
