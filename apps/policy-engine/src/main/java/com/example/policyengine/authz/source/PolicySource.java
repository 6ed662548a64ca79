package com.example.policyengine.authz.source;

import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.SubjectKind;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;

/**
 * Supplies candidate policies to the evaluator.
 * Implementations may be backed by a database, configuration, or memory.
 */
public interface PolicySource {

    /**
     * Find policies matching the filter.
     */
    @NonNull
    Flux<PolicyRecord> findMany(@NonNull PolicyFilter filter);

    /**
     * Find policies that can apply to a resource: those scoped to it and the globals of its kind.
     */
    @NonNull
    default Flux<PolicyRecord> findForResource(@NonNull ResourceKind kind, @NonNull String resourceId) {
        return findMany(PolicyFilter.forResource(kind, resourceId));
    }

    /**
     * Find policies written for a subject.
     */
    @NonNull
    default Flux<PolicyRecord> findBySubject(@NonNull SubjectKind kind, @NonNull String subjectId) {
        return findMany(PolicyFilter.forSubject(kind, subjectId));
    }
}
