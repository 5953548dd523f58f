package com.faceblog.gateway.service;

import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.exception.InfrastructureException;
import com.faceblog.gateway.exception.TenantException;
import com.faceblog.gateway.model.Tenant;
import com.faceblog.gateway.model.TenantSignal;
import com.faceblog.gateway.model.TenantSignal.Source;
import com.faceblog.gateway.repository.TenantRepository;
import com.faceblog.gateway.testing.Fixtures;
import com.faceblog.gateway.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenantDirectoryTest {

    @Mock
    private TenantRepository tenantRepository;

    private MutableClock clock;
    private TenantDirectory directory;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        directory = new TenantDirectory(tenantRepository, clock, Fixtures.properties());
    }

    @Test
    void resolve_CachesForTenantTtl() {
        when(tenantRepository.findById("acme")).thenReturn(Mono.just(Fixtures.tenant("acme", "active")));

        directory.resolve(TenantSignal.credential("acme")).block();
        clock.advance(Duration.ofMinutes(59));
        Tenant cached = directory.resolve(TenantSignal.credential("acme")).block();

        assertThat(cached.id()).isEqualTo("acme");
        verify(tenantRepository, times(1)).findById("acme");

        clock.advance(Duration.ofMinutes(1));
        directory.resolve(TenantSignal.credential("acme")).block();
        verify(tenantRepository, times(2)).findById("acme");
    }

    @Test
    void resolve_UnknownTenant() {
        when(tenantRepository.findBySubdomain("ghost")).thenReturn(Mono.empty());

        StepVerifier.create(directory.resolve(new TenantSignal(Source.SUBDOMAIN, "ghost")))
                .expectErrorSatisfies(e -> assertThat(((TenantException) e).getCode())
                        .isEqualTo(ErrorCode.TENANT_NOT_FOUND))
                .verify();
    }

    @Test
    void resolve_StoreErrorFailsClosed() {
        when(tenantRepository.findById("acme")).thenReturn(Mono.error(new IllegalStateException("db down")));

        StepVerifier.create(directory.resolve(TenantSignal.credential("acme")))
                .expectError(InfrastructureException.class)
                .verify();
    }

    @Test
    void signals_CredentialOutranksHeaderAndHost() {
        assertThat(directory.signals("acme", "other", "blog.example.org"))
                .extracting(TenantSignal::source)
                .containsExactly(Source.CREDENTIAL, Source.HEADER, Source.CUSTOM_DOMAIN);
    }

    @Test
    void signals_HeaderOutranksHost() {
        assertThat(directory.signals(null, " acme ", "other.faceblog.com.br"))
                .containsExactly(
                        new TenantSignal(Source.HEADER, "acme"),
                        new TenantSignal(Source.SUBDOMAIN, "other"));
    }

    @Test
    void signals_NoneForSystemHost() {
        assertThat(directory.signals(null, null, "api.faceblog.com.br")).isEmpty();
    }

    @Test
    void resolveHint_HeaderOutranksHost() {
        when(tenantRepository.findById("acme")).thenReturn(Mono.just(Fixtures.tenant("acme", "active")));

        Tenant tenant = directory.resolveHint("acme", "blog.example.org").block();

        assertThat(tenant.id()).isEqualTo("acme");
        verify(tenantRepository, never()).findByCustomDomain(anyString());
    }

    @Test
    void resolveHint_EmptyWithoutHint() {
        StepVerifier.create(directory.resolveHint(null, "localhost:8080"))
                .verifyComplete();
    }

    @Test
    void hostSignal_ParsesHosts() {
        assertThat(directory.hostSignal("acme.faceblog.com.br:8443"))
                .contains(new TenantSignal(Source.SUBDOMAIN, "acme"));
        assertThat(directory.hostSignal("Blog.Example.org"))
                .contains(new TenantSignal(Source.CUSTOM_DOMAIN, "blog.example.org"));

        assertThat(directory.hostSignal("api.faceblog.com.br")).isEmpty();
        assertThat(directory.hostSignal("www.faceblog.com.br")).isEmpty();
        assertThat(directory.hostSignal("faceblog.com.br")).isEmpty();
        assertThat(directory.hostSignal("a.b.faceblog.com.br")).isEmpty();
        assertThat(directory.hostSignal("127.0.0.1:8080")).isEmpty();
        assertThat(directory.hostSignal(null)).isEmpty();
    }

    @Test
    void checkStatus_MapsEachState() {
        assertThat(directory.checkStatus(Tenant.fromEntity(Fixtures.tenant("a", "active"))).id()).isEqualTo("a");

        assertStatus("suspended", ErrorCode.TENANT_SUSPENDED, 403);
        assertStatus("expired", ErrorCode.TENANT_EXPIRED, 402);
        assertStatus("deleted", ErrorCode.TENANT_DELETED, 410);
    }

    @Test
    void invalidate_DropsEverySignalOfTenant() {
        when(tenantRepository.findById("acme")).thenReturn(Mono.just(Fixtures.tenant("acme", "active")));
        when(tenantRepository.findBySubdomain("acme")).thenReturn(Mono.just(Fixtures.tenant("acme", "active")));

        directory.resolve(TenantSignal.credential("acme")).block();
        directory.resolve(new TenantSignal(Source.SUBDOMAIN, "acme")).block();
        assertThat(directory.cachedEntries()).isEqualTo(2);

        directory.invalidate("acme");

        assertThat(directory.cachedEntries()).isZero();
    }

    @Test
    void evictExpired_SweepsStaleEntries() {
        when(tenantRepository.findById("acme")).thenReturn(Mono.just(Fixtures.tenant("acme", "active")));
        directory.resolve(TenantSignal.credential("acme")).block();

        clock.advance(Duration.ofHours(2));

        assertThat(directory.evictExpired()).isEqualTo(1);
    }

    private void assertStatus(String status, ErrorCode expected, int httpStatus) {
        Tenant tenant = Tenant.fromEntity(Fixtures.tenant("t-" + status, status));
        assertThatThrownBy(() -> directory.checkStatus(tenant))
                .isInstanceOf(TenantException.class)
                .satisfies(e -> {
                    TenantException te = (TenantException) e;
                    assertThat(te.getCode()).isEqualTo(expected);
                    assertThat(te.getCode().getStatus().value()).isEqualTo(httpStatus);
                });
    }
}
