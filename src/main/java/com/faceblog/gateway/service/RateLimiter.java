package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.model.RateLimitDecision;
import com.faceblog.gateway.repository.RateLimitWindowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-credential rate limiter using fixed, clock-aligned windows (hourly by default).
 *
 * <p>Counters live in process; the first request of a window seeds its counter from the
 * persistent store so that a restart does not hand out a fresh quota. Every admitted request
 * is mirrored to the store asynchronously. The store is never on the critical path for
 * correctness: when it is slow or down the counter starts at zero and the request is admitted.
 */
@Service
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<WindowKey, WindowCounter> windows = new ConcurrentHashMap<>();
    private final RateLimitWindowRepository windowRepository;
    private final Clock clock;
    private final Duration window;
    private final Duration storeTimeout;

    public RateLimiter(RateLimitWindowRepository windowRepository, Clock clock, GwProperties properties) {
        this.windowRepository = windowRepository;
        this.clock = clock;
        this.window = properties.getRateLimit().getWindow();
        this.storeTimeout = properties.getStore().getTimeout();
        log.info("RateLimiter initialized with window={}", window);
    }

    /**
     * Count one request against the credential's current window.
     *
     * @param credentialId API key id, or {@code user:<id>} for session callers
     * @param limit        requests allowed per window
     * @return the decision; never errors
     */
    public Mono<RateLimitDecision> check(String credentialId, int limit) {
        Instant windowStart = windowStart(clock.instant());
        WindowKey key = new WindowKey(credentialId, windowStart);
        Instant resetAt = windowStart.plus(window);

        WindowCounter existing = windows.get(key);
        Mono<WindowCounter> counter = existing != null ? Mono.just(existing) : loadCounter(key);
        return counter.map(c -> consume(key, c, limit, resetAt));
    }

    /**
     * Requests counted so far in the credential's current window.
     */
    long currentCount(String credentialId) {
        WindowCounter counter = windows.get(new WindowKey(credentialId, windowStart(clock.instant())));
        return counter != null ? counter.count.get() : 0;
    }

    /**
     * Drop counters older than the previous window.
     *
     * @return number of counters removed
     */
    public int evictStale() {
        Instant cutoff = windowStart(clock.instant()).minus(window);
        int removed = 0;
        for (Map.Entry<WindowKey, WindowCounter> e : windows.entrySet()) {
            if (e.getKey().windowStart().isBefore(cutoff) && windows.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} stale rate limit windows", removed);
        }
        return removed;
    }

    /**
     * Delete persisted windows older than the previous window.
     */
    public Mono<Integer> pruneStore() {
        Instant cutoff = windowStart(clock.instant()).minus(window);
        return windowRepository.deleteOlderThan(cutoff);
    }

    public int trackedWindows() {
        return windows.size();
    }

    Instant windowStart(Instant now) {
        long millis = now.toEpochMilli();
        return Instant.ofEpochMilli(millis - Math.floorMod(millis, window.toMillis()));
    }

    private Mono<WindowCounter> loadCounter(WindowKey key) {
        return windowRepository.findCount(key.storageKey())
                .timeout(storeTimeout)
                .defaultIfEmpty(0L)
                .onErrorResume(e -> {
                    log.warn("Rate limit store unavailable for {}, starting window at 0: {}",
                            key.credentialId(), e.getMessage());
                    return Mono.just(0L);
                })
                // Another request may have created the counter while the store was read
                .map(persisted -> windows.computeIfAbsent(key, k -> new WindowCounter(persisted)));
    }

    private RateLimitDecision consume(WindowKey key, WindowCounter counter, int limit, Instant resetAt) {
        long previous = counter.tryIncrement(limit);
        if (previous < 0) {
            log.debug("Rate limit exceeded for {} (limit={})", key.credentialId(), limit);
            return new RateLimitDecision(false, limit, 0, resetAt);
        }
        persistIncrement(key);
        int remaining = (int) Math.max(0, limit - previous - 1);
        return new RateLimitDecision(true, limit, remaining, resetAt);
    }

    private void persistIncrement(WindowKey key) {
        windowRepository.increment(key.storageKey(), key.credentialId(), key.windowStart())
                .timeout(storeTimeout)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        rows -> log.trace("Persisted rate limit increment for {}", key.credentialId()),
                        e -> log.warn("Failed to persist rate limit increment for {}: {}",
                                key.credentialId(), e.getMessage())
                );
    }

    private record WindowKey(String credentialId, Instant windowStart) {
        String storageKey() {
            return credentialId + ":" + windowStart.getEpochSecond();
        }
    }

    private static final class WindowCounter {
        private final AtomicLong count;

        private WindowCounter(long initial) {
            this.count = new AtomicLong(initial);
        }

        /**
         * Increment unless the limit is reached.
         *
         * @return the count before incrementing, or -1 when denied
         */
        private long tryIncrement(int limit) {
            while (true) {
                long current = count.get();
                if (current >= limit) {
                    return -1;
                }
                if (count.compareAndSet(current, current + 1)) {
                    return current;
                }
            }
        }
    }
}
