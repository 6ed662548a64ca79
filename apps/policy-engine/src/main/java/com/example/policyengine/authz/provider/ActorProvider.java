package com.example.policyengine.authz.provider;

import com.example.policyengine.authz.model.ActorSnapshot;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Produces actor snapshots from whatever store backs users.
 */
public interface ActorProvider {

    /**
     * Load the actor, or complete empty when the user does not exist.
     */
    @NonNull
    Mono<ActorSnapshot> findActor(@NonNull String actorId);
}
