package com.example.policyengine.authz.model;

import com.example.policyengine.authz.exception.PolicyValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Actions a policy can grant on a resource.
 *
 * <p>The set is closed and unordered: {@code MANAGE} does not imply {@code READ},
 * each action must be granted on its own.
 */
public enum PermissionAction {
    /**
     * View the resource.
     */
    READ("read"),

    /**
     * Modify the resource.
     */
    WRITE("write"),

    /**
     * Remove the resource.
     */
    DELETE("delete"),

    /**
     * Grant or revoke access to the resource.
     */
    MANAGE("manage");

    private final String label;

    PermissionAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parse a stored or configured action label (case-insensitive).
     */
    @JsonCreator
    public static PermissionAction fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PermissionAction action : values()) {
                if (action.label.equals(normalized)) {
                    return action;
                }
            }
        }
        throw PolicyValidationException.forField("action", value, "expected one of read, write, delete, manage");
    }
}
