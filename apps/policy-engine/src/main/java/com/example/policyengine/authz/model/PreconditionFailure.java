package com.example.policyengine.authz.model;

/**
 * Deny outcomes caused by actor or resource state rather than by a missing grant.
 * Deterministic for a given input, so never retried.
 */
public enum PreconditionFailure {
    ACTOR_INACTIVE("Actor is inactive"),
    RESOURCE_UNAVAILABLE("Resource is deleted");

    private final String message;

    PreconditionFailure(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
