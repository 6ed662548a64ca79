package com.example.policyengine.authz.model;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * Read-only view of the resource being acted upon, supplied by the caller.
 *
 * @param id      the resource identifier
 * @param ownerId the owning user, null when the resource has no owner
 * @param deleted true when the resource has been soft-deleted
 * @param kind    document or user record
 */
public record ResourceSnapshot(
        String id,
        @Nullable String ownerId,
        boolean deleted,
        ResourceKind kind
) {
    public ResourceSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Create a live document snapshot.
     */
    public static ResourceSnapshot document(String documentId, String ownerId) {
        return new ResourceSnapshot(documentId, ownerId, false, ResourceKind.DOCUMENT);
    }

    /**
     * Create a live user-record snapshot. A user record is owned by that user.
     */
    public static ResourceSnapshot user(String userId) {
        return new ResourceSnapshot(userId, userId, false, ResourceKind.USER);
    }

    /**
     * Copy of this snapshot marked as soft-deleted.
     */
    public ResourceSnapshot asDeleted() {
        return new ResourceSnapshot(id, ownerId, true, kind);
    }
}
