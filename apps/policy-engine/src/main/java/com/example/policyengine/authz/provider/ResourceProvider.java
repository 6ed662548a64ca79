package com.example.policyengine.authz.provider;

import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.ResourceSnapshot;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Produces resource snapshots from whatever store backs documents and user records.
 * Soft-deleted resources are returned with {@code deleted=true}, not omitted.
 */
public interface ResourceProvider {

    @NonNull
    Mono<ResourceSnapshot> findResource(@NonNull ResourceKind kind, @NonNull String resourceId);
}
