package com.example.policyengine.authz.mapper;

import com.example.policyengine.authz.exception.PolicyValidationException;
import com.example.policyengine.authz.model.PermissionAction;
import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.StoredPolicy;
import com.example.policyengine.authz.model.SubjectKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts between {@link PolicyRecord} and its persistence form.
 */
public final class PolicyRecordMapper {

    private PolicyRecordMapper() {
    }

    public static StoredPolicy toStored(PolicyRecord policy) {
        List<String> actions = EnumSet.copyOf(policy.actions()).stream()
                .map(PermissionAction::label)
                .toList();

        return new StoredPolicy(
                policy.id(),
                policy.name(),
                policy.description(),
                policy.subjectKind().label(),
                policy.subjectId(),
                policy.resourceKind().label(),
                policy.resourceId(),
                actions,
                policy.active(),
                policy.priority(),
                policy.createdAt(),
                policy.updatedAt()
        );
    }

    /**
     * Rebuild a policy from stored data.
     *
     * @throws PolicyValidationException if any label is unknown or the row breaks a policy invariant
     */
    public static PolicyRecord fromStored(StoredPolicy stored) {
        if (stored == null) {
            throw PolicyValidationException.forField("AccessPolicy", null, "stored policy is required");
        }
        if (stored.actions() == null) {
            throw PolicyValidationException.forField("actions", null, "at least one action is required");
        }

        Set<PermissionAction> actions = stored.actions().stream()
                .map(PermissionAction::fromLabel)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(PermissionAction.class)));

        return PolicyRecord.builder()
                .id(stored.id())
                .name(stored.name())
                .description(stored.description())
                .subjectKind(SubjectKind.fromLabel(stored.subjectType()))
                .subjectId(stored.subjectId())
                .resourceKind(ResourceKind.fromLabel(stored.resourceType()))
                .resourceId(stored.resourceId())
                .actions(actions)
                .active(stored.active())
                .priority(stored.priority())
                .createdAt(stored.createdAt())
                .updatedAt(stored.updatedAt())
                .build();
    }
}
