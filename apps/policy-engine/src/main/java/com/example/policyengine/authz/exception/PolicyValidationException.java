package com.example.policyengine.authz.exception;

import lombok.Getter;

// Invalid policy input (empty actions, priority out of range, blank ids). Caller-correctable, never retried.
@Getter
public class PolicyValidationException extends RuntimeException {

    private final String field;
    private final transient Object value;

    public PolicyValidationException(String message, String field, Object value) {
        super(message);
        this.field = field;
        this.value = value;
    }

    public static PolicyValidationException forField(String field, Object value, String details) {
        return new PolicyValidationException(
                String.format("Invalid access policy field %s: %s - %s", field, value, details),
                field,
                value);
    }
}
