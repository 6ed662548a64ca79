package com.example.policyengine.authz.model;

/**
 * Flat role labels an actor can hold. Roles do not inherit from each other.
 *
 * <p>A {@link SubjectKind#ROLE} policy matches an actor when its subject id equals
 * the actor's role {@link #label()}.
 */
public enum ActorRole {
    /**
     * Administrative override: every action on every live resource.
     */
    ADMIN("admin"),

    /**
     * Ordinary user, access comes from policies only.
     */
    USER("user");

    private final String label;

    ActorRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
