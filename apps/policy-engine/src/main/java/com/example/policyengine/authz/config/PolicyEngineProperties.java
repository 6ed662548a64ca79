package com.example.policyengine.authz.config;

import com.example.policyengine.authz.model.PermissionAction;
import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.SubjectKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the access policy engine.
 * Seed policies are loaded from {@code app.authz.policies}.
 */
@ConfigurationProperties(prefix = "app.authz")
public record PolicyEngineProperties(
        boolean enabled,
        List<PolicyDefinition> policies
) {

    public PolicyEngineProperties {
        if (policies == null) {
            policies = List.of();
        }
    }

    public record PolicyDefinition(
            String id,
            String name,
            String description,
            SubjectKind subjectKind,
            String subjectId,
            ResourceKind resourceKind,
            String resourceId,
            Set<PermissionAction> actions,
            Boolean active,
            Integer priority
    ) {
        public PolicyDefinition {
            if (name == null || name.isBlank()) name = id;
            if (active == null) active = Boolean.TRUE;
            if (priority == null) priority = PolicyRecord.DEFAULT_PRIORITY;
        }

        /**
         * Build the validated policy this definition describes.
         */
        public PolicyRecord toPolicyRecord() {
            return PolicyRecord.builder()
                    .id(id)
                    .name(name)
                    .description(description)
                    .subjectKind(subjectKind)
                    .subjectId(subjectId)
                    .resourceKind(resourceKind)
                    .resourceId(resourceId)
                    .actions(actions)
                    .active(active)
                    .priority(priority)
                    .build();
        }
    }
}
