package com.example.policyengine.authz.source;

import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.ResourceKind;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Writable {@link PolicySource}. Required by the grant and revoke workflows;
 * read-only sources only need to implement {@link PolicySource}.
 */
public interface PolicyStore extends PolicySource {

    @NonNull
    Mono<PolicyRecord> findById(@NonNull String id);

    /**
     * Insert or replace a policy by id.
     */
    @NonNull
    Mono<PolicyRecord> save(@NonNull PolicyRecord policy);

    /**
     * @return true if a policy was removed
     */
    @NonNull
    Mono<Boolean> deleteById(@NonNull String id);

    /**
     * Remove every policy scoped to the resource. Global policies are kept.
     *
     * @return number of removed policies
     */
    @NonNull
    Mono<Long> deleteByResourceId(@NonNull String resourceId);

    /**
     * Remove every policy written for the user.
     *
     * @return number of removed policies
     */
    @NonNull
    Mono<Long> deleteBySubjectId(@NonNull String userId);

    /**
     * Remove the user's grants scoped to one resource. Role policies and global
     * policies are kept.
     *
     * @return number of removed policies
     */
    @NonNull
    Mono<Long> deleteByResourceAndSubject(@NonNull ResourceKind kind, @NonNull String resourceId,
            @NonNull String userId);
}
