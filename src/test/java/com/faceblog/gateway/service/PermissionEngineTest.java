package com.faceblog.gateway.service;

import com.faceblog.gateway.model.AuthContext;
import com.faceblog.gateway.model.CredentialType;
import com.faceblog.gateway.model.PermissionSet;
import com.faceblog.gateway.model.Tenant;
import com.faceblog.gateway.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PermissionEngineTest {

    @Mock
    private ResourceOwnershipLookup ownershipLookup;

    private PermissionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PermissionEngine(ownershipLookup);
    }

    @Test
    void authorize_UnrestrictedSetsPassEverything() {
        assertThat(engine.authorize(PermissionSet.of("admin"), "users:delete")).isTrue();
        assertThat(engine.authorize(PermissionSet.of("*"), "anything")).isTrue();
    }

    @Test
    void authorize_DirectMembership() {
        PermissionSet readOnly = PermissionSet.of("read");

        assertThat(engine.authorize(readOnly, "read")).isTrue();
        assertThat(engine.authorize(readOnly, "admin")).isFalse();
    }

    @Test
    void authorize_WriteDoesNotImplyRead() {
        assertThat(engine.authorize(PermissionSet.of("write"), "read")).isFalse();
    }

    @Test
    void authorize_VerbGrantCoversResourceCapability() {
        PermissionSet readWrite = PermissionSet.of("read", "write");

        assertThat(engine.authorize(readWrite, "articles:write")).isTrue();
        assertThat(engine.authorize(readWrite, "tags:read")).isTrue();
        assertThat(engine.authorize(PermissionSet.of("write"), "articles:read")).isFalse();
        assertThat(engine.authorize(readWrite, "articles:update")).isFalse();
        assertThat(engine.authorize(readWrite, "articles:update:own")).isFalse();
    }

    @Test
    void authorize_RoleDefaults() {
        PermissionSet none = PermissionSet.empty();

        assertThat(engine.authorize(none, "admin", "users:delete")).isTrue();
        assertThat(engine.authorize(none, "Editor", "articles:update")).isTrue();
        assertThat(engine.authorize(none, "editor", "admin")).isFalse();
        assertThat(engine.authorize(none, "author", "articles:update")).isFalse();
        assertThat(engine.authorize(none, "author", "articles:update:own")).isTrue();
        assertThat(engine.authorize(none, "subscriber", "articles:read")).isTrue();
        assertThat(engine.authorize(none, "subscriber", "write")).isFalse();
        assertThat(engine.authorize(none, "unknown-role", "read")).isFalse();
    }

    @Test
    void authorize_NoRequirementPasses() {
        assertThat(engine.authorize(PermissionSet.empty(), null)).isTrue();
    }

    @Test
    void capabilityFor_HttpVerbs() {
        assertThat(engine.capabilityFor(HttpMethod.GET)).isEqualTo("read");
        assertThat(engine.capabilityFor(HttpMethod.HEAD)).isEqualTo("read");
        assertThat(engine.capabilityFor(HttpMethod.POST)).isEqualTo("write");
        assertThat(engine.capabilityFor(HttpMethod.PATCH)).isEqualTo("write");
        assertThat(engine.capabilityFor(HttpMethod.DELETE)).isEqualTo("admin");
    }

    @Test
    void authorizeOwned_AuthorOnOwnArticle() {
        when(ownershipLookup.findOwner("acme", "article", "a1")).thenReturn(Mono.just("u1"));

        StepVerifier.create(engine.authorizeOwned(session("u1", "author"), "articles:update", "article", "a1"))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void authorizeOwned_AuthorOnSomeoneElsesArticle() {
        when(ownershipLookup.findOwner("acme", "article", "a2")).thenReturn(Mono.just("u9"));

        StepVerifier.create(engine.authorizeOwned(session("u1", "author"), "articles:update", "article", "a2"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void authorizeOwned_MissingResource() {
        when(ownershipLookup.findOwner("acme", "article", "gone")).thenReturn(Mono.empty());

        StepVerifier.create(engine.authorizeOwned(session("u1", "author"), "articles:update", "article", "gone"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void authorizeOwned_PlainCapabilitySkipsLookup() {
        StepVerifier.create(engine.authorizeOwned(session("u2", "editor"), "articles:update", "article", "a1"))
                .expectNext(true)
                .verifyComplete();

        verify(ownershipLookup, never()).findOwner(anyString(), anyString(), anyString());
    }

    @Test
    void authorizeOwned_SubscriberNeverOwns() {
        StepVerifier.create(engine.authorizeOwned(session("u3", "subscriber"), "articles:update", "article", "a1"))
                .expectNext(false)
                .verifyComplete();

        verify(ownershipLookup, never()).findOwner(anyString(), anyString(), anyString());
    }

    private AuthContext session(String userId, String role) {
        Tenant tenant = Tenant.fromEntity(Fixtures.tenant("acme", "active"));
        return new AuthContext(tenant, CredentialType.SESSION, null, userId, role,
                PermissionSet.empty(), null, null, null);
    }
}
