package com.pizzaindex.api;

import com.pizzaindex.cache.ResponseCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Human-readable cache and store counters for ops and debugging.
 * The same values are exported on /actuator/prometheus.
 */
@RestController
@Tag(name = "Monitoring")
public class CacheMetricsController {

    private final ResponseCache cache;
    private final MeterRegistry meterRegistry;

    public CacheMetricsController(ResponseCache cache, MeterRegistry meterRegistry) {
        this.cache = cache;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Example:
     * <pre>
     * {
     *   "cache": {"hits": 12, "misses": 3, "expirations": 1, "size": 2, "hit_ratio": 0.8,
     *             "ttl_seconds": 60, "avg_miss_latency_ms": 41.5},
     *   "store_fetch": {"count": 7, "mean_ms": 38.2, "max_ms": 120.4}
     * }
     * </pre>
     */
    @Operation(summary = "Get response cache counters and store latency")
    @GetMapping("/metrics/cache")
    public Map<String, Object> getCacheMetrics() {
        ResponseCache.CacheStats stats = cache.stats();

        Map<String, Object> cacheMetrics = new LinkedHashMap<>();
        cacheMetrics.put("hits", stats.hits());
        cacheMetrics.put("misses", stats.misses());
        cacheMetrics.put("expirations", stats.expirations());
        cacheMetrics.put("size", stats.size());
        cacheMetrics.put("hit_ratio", Math.round(stats.hitRatio() * 1000.0) / 1000.0);
        cacheMetrics.put("ttl_seconds", stats.ttlSeconds());
        cacheMetrics.put("avg_miss_latency_ms", stats.avgMissLatencyMs());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("cache", cacheMetrics);
        addTimerMetrics(response, "store_fetch", "fetch");
        return response;
    }

    private void addTimerMetrics(Map<String, Object> response, String key, String operation) {
        Timer timer = meterRegistry.find("supabase.request.latency").tag("operation", operation).timer();
        if (timer == null) {
            return;
        }
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("count", timer.count());
        metrics.put("mean_ms", timer.mean(TimeUnit.MILLISECONDS));
        metrics.put("max_ms", timer.max(TimeUnit.MILLISECONDS));
        response.put(key, metrics);
    }
}
