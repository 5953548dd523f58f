package com.faceblog.gateway.service;

import com.faceblog.gateway.entity.ApiUsageLogEntity;
import com.faceblog.gateway.model.ApiKeyRecord;
import com.faceblog.gateway.model.AuthContext;
import com.faceblog.gateway.model.RateLimitDecision;
import com.faceblog.gateway.model.RequestSummary;
import com.faceblog.gateway.model.ResourceType;
import com.faceblog.gateway.model.RouteRequirement;
import com.faceblog.gateway.model.Tenant;
import com.faceblog.gateway.repository.ApiUsageLogRepository;
import com.faceblog.gateway.testing.Fixtures;
import com.faceblog.gateway.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UsageLogServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:00Z");

    @Mock
    private ApiUsageLogRepository usageLogRepository;

    @Mock
    private BillingQuotaGate billingQuotaGate;

    private UsageLogService usageLogService;

    @BeforeEach
    void setUp() {
        usageLogService = new UsageLogService(usageLogRepository, billingQuotaGate,
                new MutableClock(NOW), Fixtures.properties());
    }

    @Test
    void record_SuccessfulRequestWritesRow() {
        when(usageLogRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        RequestSummary request = new RequestSummary("GET", "/api/articles", 200, "10.0.0.1", "curl/8.0");

        StepVerifier.create(usageLogService.record(context(new RouteRequirement("read", null)), request))
                .verifyComplete();

        ArgumentCaptor<ApiUsageLogEntity> captor = ArgumentCaptor.forClass(ApiUsageLogEntity.class);
        verify(usageLogRepository).save(captor.capture());
        ApiUsageLogEntity row = captor.getValue();
        assertThat(row.getTenantId()).isEqualTo("acme");
        assertThat(row.getApiKeyId()).isEqualTo("key-1");
        assertThat(row.getUserId()).isNull();
        assertThat(row.getEndpoint()).isEqualTo("/api/articles");
        assertThat(row.getStatusCode()).isEqualTo(200);
        assertThat(row.getIpAddress()).isEqualTo("10.0.0.1");
        assertThat(row.getCreatedAt()).isEqualTo(NOW);
        verify(billingQuotaGate, never()).invalidate(anyString());
    }

    @Test
    void record_FailedRequestIsSkipped() {
        RequestSummary request = new RequestSummary("GET", "/api/articles", 404, "10.0.0.1", null);

        StepVerifier.create(usageLogService.record(context(new RouteRequirement("read", null)), request))
                .verifyComplete();

        verify(usageLogRepository, never()).save(any());
    }

    @Test
    void record_LongUserAgentIsTruncated() {
        when(usageLogRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        RequestSummary request = new RequestSummary("GET", "/api/articles", 200, "10.0.0.1", "x".repeat(2000));
        usageLogService.record(context(new RouteRequirement("read", null)), request).block();

        ArgumentCaptor<ApiUsageLogEntity> captor = ArgumentCaptor.forClass(ApiUsageLogEntity.class);
        verify(usageLogRepository).save(captor.capture());
        assertThat(captor.getValue().getUserAgent()).hasSize(512);
    }

    @Test
    void record_StoreFailureIsSwallowed() {
        when(usageLogRepository.save(any())).thenReturn(Mono.error(new IllegalStateException("db down")));

        RequestSummary request = new RequestSummary("GET", "/api/articles", 200, "10.0.0.1", null);

        StepVerifier.create(usageLogService.record(context(new RouteRequirement("read", null)), request))
                .verifyComplete();
    }

    @Test
    void record_MeteredWriteInvalidatesQuota() {
        when(usageLogRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(billingQuotaGate.invalidate("acme")).thenReturn(Mono.empty());

        RequestSummary request = new RequestSummary("POST", "/api/articles", 201, "10.0.0.1", null);

        StepVerifier.create(usageLogService.record(
                        context(new RouteRequirement("write", ResourceType.ARTICLES)), request))
                .verifyComplete();

        verify(billingQuotaGate).invalidate("acme");
    }

    @Test
    void recordAsync_WritesInBackground() {
        when(usageLogRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        usageLogService.recordAsync(context(new RouteRequirement("read", null)),
                new RequestSummary("GET", "/api/tags", 200, "10.0.0.1", null));

        verify(usageLogRepository, timeout(1000)).save(any());
    }

    private AuthContext context(RouteRequirement requirement) {
        Tenant tenant = Tenant.fromEntity(Fixtures.tenant("acme", "active"));
        ApiKeyRecord key = ApiKeyRecord.fromEntity(Fixtures.apiKey("key-1", "acme", "[\"read\"]", 1000));
        return AuthContext.forApiKey(tenant, key, requirement,
                new RateLimitDecision(true, 1000, 999, NOW.plusSeconds(2700)));
    }
}
