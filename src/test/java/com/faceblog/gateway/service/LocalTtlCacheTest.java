package com.faceblog.gateway.service;

import com.faceblog.gateway.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LocalTtlCacheTest {

    private MutableClock clock;
    private LocalTtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        cache = new LocalTtlCache<>(Duration.ofHours(1), clock);
    }

    @Test
    void get_ReturnsValueUntilTtlElapses() {
        cache.put("k", "v");

        clock.advance(Duration.ofMinutes(59));
        assertThat(cache.get("k")).isEqualTo("v");

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("k")).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictExpired_RemovesOnlyExpired() {
        cache.put("old", "1");
        clock.advance(Duration.ofMinutes(30));
        cache.put("new", "2");
        clock.advance(Duration.ofMinutes(31));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.get("old")).isNull();
        assertThat(cache.get("new")).isEqualTo("2");
    }

    @Test
    void invalidateIf_MatchesValues() {
        cache.put("SUBDOMAIN:acme", "acme");
        cache.put("CREDENTIAL:acme", "acme");
        cache.put("CREDENTIAL:other", "other");

        assertThat(cache.invalidateIf("acme"::equals)).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("CREDENTIAL:other")).isEqualTo("other");
    }
}
