package com.example.policyengine.authz.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Flat persistence form of a {@link PolicyRecord}: kinds and actions as their
 * string labels, optional resource id as null.
 *
 * <p>Rows in this form are untrusted; convert with
 * {@link com.example.policyengine.authz.mapper.PolicyRecordMapper#fromStored(StoredPolicy)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredPolicy(
        String id,
        String name,
        String description,
        String subjectType,
        String subjectId,
        String resourceType,
        String resourceId,
        List<String> actions,
        @JsonProperty("isActive") boolean active,
        int priority,
        Instant createdAt,
        Instant updatedAt
) {
}
