package com.example.policyengine.authz.service;

import com.example.policyengine.authz.engine.PolicyEvaluator;
import com.example.policyengine.authz.exception.AccessDeniedException;
import com.example.policyengine.authz.exception.PolicyValidationException;
import com.example.policyengine.authz.model.AccessEvaluation;
import com.example.policyengine.authz.model.ActorRole;
import com.example.policyengine.authz.model.ActorSnapshot;
import com.example.policyengine.authz.model.PermissionAction;
import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.model.PreconditionFailure;
import com.example.policyengine.authz.model.ResourceKind;
import com.example.policyengine.authz.model.ResourceSnapshot;
import com.example.policyengine.authz.model.SubjectKind;
import com.example.policyengine.authz.provider.ActorProvider;
import com.example.policyengine.authz.provider.ResourceProvider;
import com.example.policyengine.authz.source.InMemoryPolicySource;
import com.example.policyengine.authz.source.PolicySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static com.example.policyengine.util.PolicyRecordTestBuilder.aRolePolicy;
import static com.example.policyengine.util.PolicyRecordTestBuilder.aUserPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessAuthorizationService")
class AccessAuthorizationServiceTest {

    private static final ActorSnapshot USER_U1 = ActorSnapshot.active("u1", ActorRole.USER);
    private static final ResourceSnapshot DOC_D1 = ResourceSnapshot.document("d1", "u1");

    @Mock
    private PolicySource policySource;

    @Mock
    private ActorProvider actorProvider;

    @Mock
    private ResourceProvider resourceProvider;

    private AccessAuthorizationService service;

    @BeforeEach
    void setUp() {
        service = new AccessAuthorizationService(
                new PolicyEvaluator(), policySource, null, actorProvider, resourceProvider);
    }

    private void givenPolicies(PolicyRecord... policies) {
        when(policySource.findForResource(ResourceKind.DOCUMENT, "d1")).thenReturn(Flux.just(policies));
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("should evaluate against policies loaded for the resource")
        void shouldEvaluateLoadedPolicies() {
            givenPolicies(aUserPolicy("u1").onDocument("d1").granting(PermissionAction.READ).build());

            StepVerifier.create(service.check(USER_U1, DOC_D1, PermissionAction.READ))
                    .expectNext(AccessEvaluation.granted())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should propagate precondition failures as values")
        void shouldEmitPreconditionFailure() {
            givenPolicies(aUserPolicy("u1").onDocument("d1").build());
            ActorSnapshot inactive = new ActorSnapshot("u1", ActorRole.USER, false);

            StepVerifier.create(service.check(inactive, DOC_D1, PermissionAction.READ))
                    .assertNext(result -> assertThat(result.failure()).contains(PreconditionFailure.ACTOR_INACTIVE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should resolve snapshots by id through the providers")
        void shouldResolveSnapshots() {
            givenPolicies(aRolePolicy("user").onAllDocuments().granting(PermissionAction.WRITE).build());
            when(actorProvider.findActor("u1")).thenReturn(Mono.just(USER_U1));
            when(resourceProvider.findResource(ResourceKind.DOCUMENT, "d1")).thenReturn(Mono.just(DOC_D1));

            StepVerifier.create(service.check("u1", ResourceKind.DOCUMENT, "d1", PermissionAction.WRITE))
                    .expectNext(AccessEvaluation.granted())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty when the actor is unknown")
        void shouldCompleteEmptyForUnknownActor() {
            when(actorProvider.findActor("ghost")).thenReturn(Mono.empty());
            when(resourceProvider.findResource(ResourceKind.DOCUMENT, "d1")).thenReturn(Mono.just(DOC_D1));

            StepVerifier.create(service.check("ghost", ResourceKind.DOCUMENT, "d1", PermissionAction.READ))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty when providers are not configured")
        void shouldCompleteEmptyWithoutProviders() {
            AccessAuthorizationService bare = new AccessAuthorizationService(
                    new PolicyEvaluator(), policySource, null, null, null);

            StepVerifier.create(bare.check("u1", ResourceKind.DOCUMENT, "d1", PermissionAction.READ))
                    .verifyComplete();
            verifyNoInteractions(policySource);
        }

        @Test
        @DisplayName("should propagate policy source errors")
        void shouldPropagateSourceErrors() {
            when(policySource.findForResource(ResourceKind.DOCUMENT, "d1"))
                    .thenReturn(Flux.error(new IllegalStateException("store offline")));

            StepVerifier.create(service.check(USER_U1, DOC_D1, PermissionAction.READ))
                    .expectErrorMessage("store offline")
                    .verify();
        }
    }

    @Nested
    @DisplayName("requirePermission")
    class RequirePermission {

        @Test
        @DisplayName("should complete when access is granted")
        void shouldCompleteWhenGranted() {
            givenPolicies(aUserPolicy("u1").onDocument("d1").granting(PermissionAction.DELETE).build());

            StepVerifier.create(service.requirePermission(USER_U1, DOC_D1, PermissionAction.DELETE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should error with AccessDeniedException when no policy grants the action")
        void shouldErrorWithoutGrant() {
            givenPolicies(aUserPolicy("u1").onDocument("d1").granting(PermissionAction.READ).build());

            StepVerifier.create(service.requirePermission(USER_U1, DOC_D1, PermissionAction.MANAGE))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AccessDeniedException.class);
                        AccessDeniedException denied = (AccessDeniedException) error;
                        assertThat(denied.isPreconditionFailure()).isFalse();
                        assertThat(denied.getActorId()).isEqualTo("u1");
                        assertThat(denied.getAction()).isEqualTo(PermissionAction.MANAGE);
                    })
                    .verify();
        }

        @Test
        @DisplayName("should error with the precondition when the resource is deleted")
        void shouldErrorForDeletedResource() {
            when(policySource.findForResource(ResourceKind.DOCUMENT, "d1")).thenReturn(Flux.empty());

            StepVerifier.create(service.requirePermission(USER_U1, DOC_D1.asDeleted(), PermissionAction.READ))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AccessDeniedException.class);
                        assertThat(((AccessDeniedException) error).getFailure())
                                .isEqualTo(PreconditionFailure.RESOURCE_UNAVAILABLE);
                    })
                    .verify();
        }
    }

    @Nested
    @DisplayName("grantedActions, isAllowed and explain")
    class Convenience {

        @Test
        @DisplayName("should report the union of granted actions")
        void shouldReportGrantedActions() {
            givenPolicies(
                    aUserPolicy("u1").onDocument("d1").granting(PermissionAction.READ).build(),
                    aRolePolicy("user").onAllDocuments().granting(PermissionAction.WRITE).build());

            StepVerifier.create(service.grantedActions(USER_U1, DOC_D1))
                    .assertNext(actions -> assertThat(actions)
                            .containsExactlyInAnyOrder(PermissionAction.READ, PermissionAction.WRITE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("isAllowed should emit false for an inactive actor")
        void shouldCollapsePreconditionToFalse() {
            givenPolicies(aUserPolicy("u1").onDocument("d1").build());

            StepVerifier.create(service.isAllowed(new ActorSnapshot("u1", ActorRole.USER, false), DOC_D1,
                            PermissionAction.READ))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("explain should name the deciding policy")
        void shouldExplain() {
            givenPolicies(aUserPolicy("u1").withId("grant-read").onDocument("d1").build());

            StepVerifier.create(service.explain(USER_U1, DOC_D1, PermissionAction.READ))
                    .assertNext(decision -> {
                        assertThat(decision.isAllowed()).isTrue();
                        assertThat(decision.policyId()).isEqualTo("grant-read");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("grantAccess and revokeAccess")
    class GrantAndRevoke {

        private final ActorSnapshot userU2 = ActorSnapshot.active("u2", ActorRole.USER);

        private InMemoryPolicySource store;
        private AccessAuthorizationService managed;

        @BeforeEach
        void setUp() {
            store = new InMemoryPolicySource(List.of(
                    aUserPolicy("u1").withId("u1-manage-d1").onDocument("d1").granting(PermissionAction.MANAGE).build(),
                    aRolePolicy("user").withId("role-docs").onAllDocuments().granting(PermissionAction.READ)
                            .withPriority(500).build()));
            managed = new AccessAuthorizationService(new PolicyEvaluator(), store, store, null, null);
        }

        @Test
        @DisplayName("should save a user-scoped policy on the resource when the actor can manage it")
        void shouldGrantWhenManager() {
            StepVerifier.create(managed.grantAccess(USER_U1, DOC_D1, "u2",
                            List.of(PermissionAction.WRITE, PermissionAction.DELETE), 50))
                    .assertNext(saved -> {
                        assertThat(saved.subjectKind()).isEqualTo(SubjectKind.USER);
                        assertThat(saved.subjectId()).isEqualTo("u2");
                        assertThat(saved.resourceKind()).isEqualTo(ResourceKind.DOCUMENT);
                        assertThat(saved.resourceId()).isEqualTo("d1");
                        assertThat(saved.actions())
                                .containsExactlyInAnyOrder(PermissionAction.WRITE, PermissionAction.DELETE);
                        assertThat(saved.priority()).isEqualTo(50);
                        assertThat(saved.active()).isTrue();
                    })
                    .verifyComplete();

            assertThat(store.size()).isEqualTo(3);
            StepVerifier.create(managed.isAllowed(userU2, DOC_D1, PermissionAction.WRITE))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to grant without MANAGE and save nothing")
        void shouldDenyGrantWithoutManage() {
            StepVerifier.create(managed.grantAccess(userU2, DOC_D1, "u3", List.of(PermissionAction.READ), 100))
                    .expectError(AccessDeniedException.class)
                    .verify();

            assertThat(store.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail validation for a grant without actions")
        void shouldRejectEmptyGrant() {
            StepVerifier.create(managed.grantAccess(USER_U1, DOC_D1, "u2", List.of(), 100))
                    .expectError(PolicyValidationException.class)
                    .verify();

            assertThat(store.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should remove only the grantee's grants on that resource")
        void shouldRevokeWhenManager() {
            store.save(aUserPolicy("u2").withId("u2-d1").onDocument("d1").granting(PermissionAction.WRITE).build())
                    .block();
            store.save(aUserPolicy("u2").withId("u2-d2").onDocument("d2").granting(PermissionAction.WRITE).build())
                    .block();

            StepVerifier.create(managed.revokeAccess(USER_U1, DOC_D1, "u2"))
                    .expectNext(1L)
                    .verifyComplete();

            StepVerifier.create(store.findById("u2-d2"))
                    .expectNextCount(1)
                    .verifyComplete();
            StepVerifier.create(managed.grantedActions(userU2, DOC_D1))
                    .assertNext(actions -> assertThat(actions).containsExactly(PermissionAction.READ))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to revoke without MANAGE and remove nothing")
        void shouldDenyRevokeWithoutManage() {
            store.save(aUserPolicy("u3").withId("u3-d1").onDocument("d1").build()).block();

            StepVerifier.create(managed.revokeAccess(userU2, DOC_D1, "u3"))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AccessDeniedException.class);
                        assertThat(((AccessDeniedException) error).getAction()).isEqualTo(PermissionAction.MANAGE);
                    })
                    .verify();

            assertThat(store.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("should error when no writable store is configured")
        void shouldErrorWithoutStore() {
            StepVerifier.create(service.revokeAccess(USER_U1, DOC_D1, "u2"))
                    .expectError(IllegalStateException.class)
                    .verify();
            verifyNoInteractions(policySource);
        }
    }
}
