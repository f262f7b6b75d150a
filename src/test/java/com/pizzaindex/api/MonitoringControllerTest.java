package com.pizzaindex.api;

import com.pizzaindex.cache.ResponseCache;
import com.pizzaindex.storage.DataStoreException;
import com.pizzaindex.storage.SampleStore;
import com.pizzaindex.support.Samples;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Health, data and metrics endpoint Integration Tests")
class MonitoringControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ResponseCache cache;

    @MockBean
    private SampleStore store;

    @BeforeEach
    void setUp() {
        cache.clear();
    }

    @Test
    @DisplayName("Root health reports store reachability and restaurant count")
    void testHealth() throws Exception {
        when(store.isHealthy()).thenReturn(true);

        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.database_connected").value(true))
            .andExpect(jsonPath("$.restaurants_count").value(5));
    }

    @Test
    @DisplayName("Root health degrades when the store is unreachable")
    void testHealthDegraded() throws Exception {
        when(store.isHealthy()).thenReturn(false);

        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("degraded"))
            .andExpect(jsonPath("$.database_connected").value(false));
    }

    @Test
    @DisplayName("Liveness endpoint answers ok")
    void testLiveness() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Latest data marks failing restaurants instead of failing")
    void testLatestData() throws Exception {
        when(store.findLatest("extreme_pizza"))
            .thenReturn(Optional.of(Samples.sample("extreme_pizza", "2024-01-01T10:00:00Z", 42)));
        when(store.findLatest("colony_grill")).thenThrow(new DataStoreException(500, "boom"));

        mockMvc.perform(get("/data/latest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.restaurants.extreme_pizza.latest_data.current_popularity").value(42))
            .andExpect(jsonPath("$.restaurants.colony_grill.error").value("Failed to fetch data"))
            .andExpect(jsonPath("$.restaurants.wise_guy.latest_data").isEmpty())
            .andExpect(jsonPath("$.restaurants.wise_guy.error").doesNotExist());
    }

    @Test
    @DisplayName("Summary groups rows per restaurant")
    void testSummary() throws Exception {
        when(store.fetchAll(any())).thenReturn(List.of(
            Samples.sample("extreme_pizza", "2024-01-01T11:00:00Z", 50),
            Samples.sample("extreme_pizza", "2024-01-01T10:00:00Z", 30)
        ));

        mockMvc.perform(get("/data/summary").param("days", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period_days").value(1))
            .andExpect(jsonPath("$.total_data_points").value(2))
            .andExpect(jsonPath("$.restaurants.extreme_pizza.current_popularity.average").value(40.0))
            .andExpect(jsonPath("$.restaurants.extreme_pizza.current_popularity.max").value(50));
    }

    @Test
    @DisplayName("Summary window defaults to the configured number of days")
    void testSummaryDefaultDays() throws Exception {
        when(store.fetchAll(any())).thenReturn(List.of());

        mockMvc.perform(get("/data/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period_days").value(3))
            .andExpect(jsonPath("$.total_data_points").value(0));
    }

    @Test
    @DisplayName("Cache metrics expose counters and TTL")
    void testCacheMetrics() throws Exception {
        when(store.fetchAll(any())).thenReturn(List.of());
        mockMvc.perform(get("/pizza-index/live")).andExpect(status().isOk());

        mockMvc.perform(get("/metrics/cache"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cache.ttl_seconds").value(60))
            .andExpect(jsonPath("$.cache.size").value(1))
            .andExpect(jsonPath("$.cache.misses").exists());
    }

    @Test
    @DisplayName("CORS allows any origin for GET")
    void testCors() throws Exception {
        mockMvc.perform(options("/restaurants")
                .header("Origin", "https://dashboard.example.com")
                .header("Access-Control-Request-Method", "GET"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "https://dashboard.example.com"));
    }
}
