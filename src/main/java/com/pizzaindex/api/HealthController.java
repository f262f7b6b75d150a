package com.pizzaindex.api;

import com.pizzaindex.domain.RestaurantRegistry;
import com.pizzaindex.storage.SampleStore;
import com.pizzaindex.util.TimestampNormalizer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Monitoring")
public class HealthController {

    static final String SERVICE_NAME = "Pentagon Pizza Index API";

    private final SampleStore store;
    private final RestaurantRegistry registry;
    private final Clock clock;

    public HealthController(SampleStore store, RestaurantRegistry registry, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Always 200; {@code status} is "degraded" when the store is unreachable.
     */
    @Operation(summary = "Service health with data store reachability")
    @GetMapping("/")
    public ResponseEntity<HealthResponse> getHealth() {
        boolean connected = store.isHealthy();
        return ResponseEntity.ok(new HealthResponse(
            connected ? "healthy" : "degraded",
            SERVICE_NAME,
            now(),
            connected,
            registry.size()
        ));
    }

    @Operation(summary = "Liveness check")
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> getLiveness() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", now());
        return ResponseEntity.ok(body);
    }

    private String now() {
        return TimestampNormalizer.format(OffsetDateTime.now(clock));
    }
}
