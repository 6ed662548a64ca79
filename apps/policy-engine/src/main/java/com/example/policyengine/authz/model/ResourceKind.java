package com.example.policyengine.authz.model;

import com.example.policyengine.authz.exception.PolicyValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of resource a policy can target.
 */
public enum ResourceKind {
    DOCUMENT("document"),
    USER("user");

    private final String label;

    ResourceKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ResourceKind fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ResourceKind kind : values()) {
                if (kind.label.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw PolicyValidationException.forField("resourceKind", value, "expected document or user");
    }
}
