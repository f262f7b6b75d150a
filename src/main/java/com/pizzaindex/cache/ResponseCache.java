package com.pizzaindex.cache;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.cache.GuavaCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-wide time-boxed memo of computed response payloads, backed by a Guava cache
 * that expires entries a fixed TTL after they are written.
 *
 * Expired entries are dropped on access; there is no background sweep. Concurrent misses
 * for the same key may both compute, and the last {@code put} wins (no single-flight).
 */
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    static final String CACHE_NAME = "pizza.response";

    private final Cache<String, Object> entries;
    private final Duration ttl;
    private final Timer loadTimer;

    public ResponseCache(Duration ttl, Clock clock, MeterRegistry meterRegistry) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.entries = CacheBuilder.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(clockTicker(clock))
            .recordStats()
            .build();
        this.loadTimer = Timer.builder("pizza.cache.load")
            .description("Time spent computing payloads on cache misses")
            .register(meterRegistry);

        GuavaCacheMetrics.monitor(meterRegistry, entries, CACHE_NAME, Tags.empty());
    }

    /**
     * Builds the key for an endpoint and its parameters.
     * Parameters are sorted by name, so insertion order never changes the key.
     */
    public static String key(String endpoint, Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return endpoint;
        }
        return endpoint + "?" + new TreeMap<>(params).entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining("&"));
    }

    /**
     * Looks up a fresh entry. An expired entry counts as a miss.
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    public void put(String key, Object payload) {
        entries.put(key, payload);
    }

    /**
     * Returns the cached payload for {@code endpoint}/{@code params}, computing and storing it on a miss.
     * Exceptions from {@code loader} propagate and nothing is cached.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String endpoint, Map<String, ?> params, Supplier<T> loader) {
        String key = key(endpoint, params);
        Object cached = entries.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit: {}", key);
            return (T) cached;
        }

        T payload = loadTimer.record(loader);
        if (payload != null) {
            entries.put(key, payload);
        }
        log.debug("Cache miss, stored: {}", key);
        return payload;
    }

    /** Drops every entry; counters are kept. */
    public void clear() {
        entries.invalidateAll();
    }

    public Duration getTtl() {
        return ttl;
    }

    public CacheStats stats() {
        com.google.common.cache.CacheStats guavaStats = entries.stats();
        double avgLoadMs = loadTimer.mean(TimeUnit.MILLISECONDS);
        return new CacheStats(
            guavaStats.hitCount(),
            guavaStats.missCount(),
            guavaStats.evictionCount(),
            entries.size(),
            ttl.toSeconds(),
            Math.round(avgLoadMs * 100.0) / 100.0
        );
    }

    private static Ticker clockTicker(Clock clock) {
        return new Ticker() {
            @Override
            public long read() {
                Instant now = clock.instant();
                return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
            }
        };
    }

    /**
     * Snapshot of cache counters. The cache has no size bound, so every eviction is an expiry.
     *
     * @param avgMissLatencyMs mean time spent computing payloads on misses
     */
    public record CacheStats(
        long hits,
        long misses,
        long expirations,
        long size,
        long ttlSeconds,
        double avgMissLatencyMs
    ) {
        public double hitRatio() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0.0;
        }
    }
}
