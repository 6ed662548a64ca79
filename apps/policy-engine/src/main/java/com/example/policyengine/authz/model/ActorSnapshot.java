package com.example.policyengine.authz.model;

import java.util.Objects;

/**
 * Read-only view of the user requesting access, supplied by the caller.
 *
 * @param id     the user's identifier
 * @param role   the user's role
 * @param active false when the account has been deactivated
 */
public record ActorSnapshot(
        String id,
        ActorRole role,
        boolean active
) {
    public ActorSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }

    /**
     * Create an active actor.
     */
    public static ActorSnapshot active(String id, ActorRole role) {
        return new ActorSnapshot(id, role, true);
    }

    /**
     * Check if the actor holds the administrative role.
     */
    public boolean isAdmin() {
        return role == ActorRole.ADMIN;
    }
}
