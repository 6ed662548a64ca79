package com.example.policyengine.authz.source;

import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.SubjectKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link PolicyStore} for single-instance deployments and tests.
 * Policies are replaced whole on save; records are immutable so readers never see partial updates.
 */
@Slf4j
public class InMemoryPolicySource implements PolicyStore {

    private final Map<String, PolicyRecord> policies = new ConcurrentHashMap<>();

    public InMemoryPolicySource() {
    }

    public InMemoryPolicySource(Collection<PolicyRecord> initial) {
        initial.forEach(policy -> policies.put(policy.id(), policy));
        log.info("In-memory policy source initialized with {} policies", policies.size());
    }

    @Override
    @NonNull
    public Flux<PolicyRecord> findMany(@NonNull PolicyFilter filter) {
        return Flux.defer(() -> Flux.fromIterable(snapshot()))
                .filter(filter::matches)
                .sort(PolicyRecord.PRECEDENCE);
    }

    @Override
    @NonNull
    public Mono<PolicyRecord> findById(@NonNull String id) {
        return Mono.justOrEmpty(policies.get(id));
    }

    @Override
    @NonNull
    public Mono<PolicyRecord> save(@NonNull PolicyRecord policy) {
        return Mono.fromSupplier(() -> {
            PolicyRecord previous = policies.put(policy.id(), policy);
            log.debug("{} policy {} (subject={}:{}, resource={}:{}, actions={})",
                    previous == null ? "Created" : "Replaced", policy.id(),
                    policy.subjectKind().label(), policy.subjectId(),
                    policy.resourceKind().label(), policy.isGlobal() ? "*" : policy.resourceId(),
                    policy.actions());
            return policy;
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteById(@NonNull String id) {
        return Mono.fromSupplier(() -> policies.remove(id) != null);
    }

    @Override
    @NonNull
    public Mono<Long> deleteByResourceId(@NonNull String resourceId) {
        return deleteMatching(PolicyFilter.forResourceId(resourceId));
    }

    @Override
    @NonNull
    public Mono<Long> deleteBySubjectId(@NonNull String userId) {
        return deleteMatching(PolicyFilter.forSubject(SubjectKind.USER, userId));
    }

    @Override
    @NonNull
    public Mono<Long> deleteByResourceAndSubject(@NonNull ResourceKind kind, @NonNull String resourceId,
            @NonNull String userId) {
        return deleteMatching(new PolicyFilter(SubjectKind.USER, userId, kind, resourceId, false, null));
    }

    public int size() {
        return policies.size();
    }

    private Mono<Long> deleteMatching(PolicyFilter filter) {
        return Mono.fromSupplier(() -> {
            long removed = snapshot().stream()
                    .filter(filter::matches)
                    .filter(policy -> policies.remove(policy.id(), policy))
                    .count();
            log.debug("Removed {} policies matching {}", removed, filter);
            return removed;
        });
    }

    private List<PolicyRecord> snapshot() {
        return List.copyOf(policies.values());
    }
}
