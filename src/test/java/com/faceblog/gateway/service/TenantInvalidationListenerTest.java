package com.faceblog.gateway.service;

import com.faceblog.gateway.testing.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenantInvalidationListenerTest {

    private static final String CHANNEL = "gw:tenant-invalidation";

    @Mock
    private ReactiveStringRedisTemplate redisTemplate;

    @Mock
    private TenantDirectory tenantDirectory;

    @Mock
    private BillingQuotaGate billingQuotaGate;

    private TenantInvalidationListener listener;

    @BeforeEach
    void setUp() {
        listener = new TenantInvalidationListener(redisTemplate, tenantDirectory, billingQuotaGate,
                Fixtures.properties());
    }

    @AfterEach
    void tearDown() {
        listener.stop();
    }

    @Test
    void start_PublishedTenantIdDropsCachedState() {
        doReturn(Flux.just(new ReactiveSubscription.ChannelMessage<>(CHANNEL, "acme")))
                .when(redisTemplate).listenToChannel(CHANNEL);
        when(billingQuotaGate.invalidate("acme")).thenReturn(Mono.empty());

        listener.start();

        verify(tenantDirectory, timeout(1000)).invalidate("acme");
        verify(billingQuotaGate, timeout(1000)).invalidate("acme");
    }

    @Test
    void onTenantChanged_TrimsTenantId() {
        when(billingQuotaGate.invalidate("acme")).thenReturn(Mono.empty());

        StepVerifier.create(listener.onTenantChanged(" acme\n")).verifyComplete();

        verify(tenantDirectory).invalidate("acme");
    }

    @Test
    void onTenantChanged_BlankMessageIgnored() {
        StepVerifier.create(listener.onTenantChanged("  ")).verifyComplete();

        verify(tenantDirectory, never()).invalidate(anyString());
        verifyNoInteractions(billingQuotaGate);
    }
}
