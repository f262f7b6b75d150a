package com.pizzaindex.storage.rest;

import com.pizzaindex.config.PizzaIndexProperties;
import com.pizzaindex.domain.AggregateRow;
import com.pizzaindex.domain.Sample;
import com.pizzaindex.storage.DataStoreException;
import com.pizzaindex.storage.PaginatedFetcher;
import com.pizzaindex.storage.SampleStore;
import com.pizzaindex.storage.StoreQuery;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Supabase (PostgREST) implementation of {@link SampleStore}.
 *
 * Every call goes through the "supabase" circuit breaker and is timed. The underlying
 * {@link RestClient} carries connect/read timeouts, so a hung upstream fails the request
 * instead of blocking it forever.
 */
@Repository
public class SupabaseSampleStore implements SampleStore {

    private static final Logger log = LoggerFactory.getLogger(SupabaseSampleStore.class);

    private static final String REST_ROOT = "/rest/v1/";
    private static final ParameterizedTypeReference<List<Sample>> SAMPLE_LIST = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final String samplesPath;
    private final String aggregatesPath;
    private final PaginatedFetcher fetcher;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    private final AtomicLong requestErrors = new AtomicLong(0);

    public SupabaseSampleStore(
            RestClient supabaseRestClient,
            PizzaIndexProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.restClient = supabaseRestClient;
        this.samplesPath = REST_ROOT + properties.getStore().getTable();
        this.aggregatesPath = REST_ROOT + properties.getStore().getAggregatesTable();
        this.fetcher = new PaginatedFetcher(properties.getStore().getPageSize());
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("supabase");
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("supabase.request.errors", requestErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Supabase circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Applies base URL and auth headers for the store.
     * Kept separate from request factory setup so tests can bind a mock server first.
     */
    public static RestClient.Builder configure(RestClient.Builder builder, PizzaIndexProperties.Store store) {
        String key = store.effectiveKey();
        return builder
            .baseUrl(store.getUrl())
            .defaultHeader("apikey", key)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + key)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    }

    @Override
    public List<Sample> fetchPage(StoreQuery query, int limit, int offset) {
        List<Sample> page = execute("fetch", () -> restClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path(samplesPath);
                query.toParams().forEach((name, value) -> uriBuilder.queryParam(name, value));
                uriBuilder.queryParam("limit", limit);
                uriBuilder.queryParam("offset", offset);
                return uriBuilder.build();
            })
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::raiseStoreError)
            .body(SAMPLE_LIST));

        if (page == null) {
            log.warn("Store returned empty body for query={}, offset={}", query, offset);
            return Collections.emptyList();
        }
        return page;
    }

    @Override
    public List<Sample> fetchAll(StoreQuery query) {
        return fetcher.fetchAll((offset, limit) -> fetchPage(query, limit, offset));
    }

    @Override
    public Optional<Sample> findLatest(String restaurantId) {
        List<Sample> rows = fetchPage(StoreQuery.forRestaurant(restaurantId).newestFirst().build(), 1, 0);
        return rows.stream().findFirst();
    }

    @Override
    public void upsertAggregate(AggregateRow row) {
        execute("upsert", () -> restClient.post()
            .uri(uriBuilder -> uriBuilder.path(aggregatesPath)
                .queryParam("on_conflict", "interval,timestamp")
                .build())
            .header("Prefer", "resolution=merge-duplicates")
            .contentType(MediaType.APPLICATION_JSON)
            .body(row)
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::raiseStoreError)
            .toBodilessEntity());

        if (log.isTraceEnabled()) {
            log.trace("Upserted aggregate: {}", row);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            return execute("health", () -> restClient.get()
                .uri(REST_ROOT)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::raiseStoreError)
                .toBodilessEntity()
                .getStatusCode()
                .is2xxSuccessful());
        } catch (DataStoreException e) {
            log.error("Supabase connection check failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return meterRegistry.timer("supabase.request.latency", "operation", operation)
                .record(() -> circuitBreaker.executeSupplier(call));

        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting {} request", operation);
            throw new DataStoreException("Data store circuit breaker is open", e);

        } catch (DataStoreException e) {
            requestErrors.incrementAndGet();
            throw e;

        } catch (RestClientException e) {
            requestErrors.incrementAndGet();
            log.error("Supabase {} request failed: {}", operation, e.getMessage());
            throw new DataStoreException("Data store request failed: " + operation, e);
        }
    }

    private void raiseStoreError(HttpRequest request, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
        log.error("Supabase API error: {} {} -> {} - {}", request.getMethod(), request.getURI().getPath(), status, body);
        throw new DataStoreException(status, body);
    }
}
