package com.example.policyengine.authz.model;

import com.example.policyengine.authz.exception.PolicyValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who a policy is written for.
 */
public enum SubjectKind {
    USER("user"),   // subjectId is a concrete user id
    ROLE("role");   // subjectId is a role label, e.g. "user"

    private final String label;

    SubjectKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static SubjectKind fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SubjectKind kind : values()) {
                if (kind.label.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw PolicyValidationException.forField("subjectKind", value, "expected user or role");
    }
}
