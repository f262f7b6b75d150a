package com.pizzaindex.api;

import com.pizzaindex.cache.ResponseCache;
import com.pizzaindex.domain.Sample;
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

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("RestaurantController Integration Tests")
class RestaurantControllerTest {

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
    @DisplayName("Should list the configured restaurants")
    void testRestaurants() throws Exception {
        mockMvc.perform(get("/restaurants"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(5))
            .andExpect(jsonPath("$.restaurants.extreme_pizza.name").value("Extreme Pizza"))
            .andExpect(jsonPath("$.restaurants.district_pizza.name").value("District Pizza Palace"));
    }

    @Test
    @DisplayName("Unknown restaurant returns 404")
    void testUnknownRestaurant() throws Exception {
        mockMvc.perform(get("/restaurant/foo/latest"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404))
            .andExpect(jsonPath("$.error").value("NOT_FOUND"))
            .andExpect(jsonPath("$.path").value("/restaurant/foo/latest"));

        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Should return the latest row with its extra columns")
    void testLatest() throws Exception {
        Sample row = Samples.sample("extreme_pizza", "2024-01-01T10:00:00Z", 42, 4.5);
        row.setAdditionalProperty("popular_times", List.of(1, 2, 3));
        when(store.findLatest("extreme_pizza")).thenReturn(Optional.of(row));

        mockMvc.perform(get("/restaurant/extreme_pizza/latest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.restaurant_id").value("extreme_pizza"))
            .andExpect(jsonPath("$.current_popularity").value(42))
            .andExpect(jsonPath("$.rating").value(4.5))
            .andExpect(jsonPath("$.popular_times", hasSize(3)));
    }

    @Test
    @DisplayName("Restaurant without rows returns 404")
    void testLatestNoRows() throws Exception {
        when(store.findLatest("colony_grill")).thenReturn(Optional.empty());

        mockMvc.perform(get("/restaurant/colony_grill/latest"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should read one page when a limit is given")
    void testDataWithLimit() throws Exception {
        when(store.fetchPage(any(), eq(2), eq(0))).thenReturn(List.of(
            Samples.sample("extreme_pizza", "2024-01-01T11:00:00Z", 40),
            Samples.sample("extreme_pizza", "2024-01-01T10:00:00Z", 30)
        ));

        mockMvc.perform(get("/restaurant/extreme_pizza/data").param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].current_popularity").value(40));
    }

    @Test
    @DisplayName("Should reject a non-numeric limit")
    void testDataTypeMismatch() throws Exception {
        mockMvc.perform(get("/restaurant/extreme_pizza/data").param("limit", "abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("TYPE_MISMATCH"));
    }

    @Test
    @DisplayName("Should reject a negative hours window")
    void testDataNegativeHours() throws Exception {
        mockMvc.perform(get("/restaurant/extreme_pizza/data").param("hours", "-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should return stats with a message when the window is empty")
    void testStatsEmpty() throws Exception {
        when(store.fetchAll(any())).thenReturn(List.of());

        mockMvc.perform(get("/restaurant/wise_guy/stats").param("days", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.restaurant_name").value("Wise Guy Pizza"))
            .andExpect(jsonPath("$.data_points").value(0))
            .andExpect(jsonPath("$.message").value("No data available for the specified period"))
            .andExpect(jsonPath("$.latest_data").doesNotExist());
    }

    @Test
    @DisplayName("Stats and chart windows default to the configured number of days")
    void testDefaultDays() throws Exception {
        when(store.fetchAll(any())).thenReturn(List.of());

        mockMvc.perform(get("/restaurant/wise_guy/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period_days").value(3));
        mockMvc.perform(get("/restaurant/wise_guy/chart-data"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period_days").value(3));
    }

    @Test
    @DisplayName("Per-restaurant chart rejects minute buckets")
    void testChartMinuteRejected() throws Exception {
        mockMvc.perform(get("/restaurant/extreme_pizza/chart-data").param("interval", "minute"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Per-restaurant chart includes no-data buckets")
    void testChartData() throws Exception {
        when(store.fetchAll(any())).thenReturn(List.of(
            Samples.sample("night_hawk", "2024-01-01T10:05:00Z", 20),
            Samples.sample("night_hawk", "2024-01-02T10:05:00Z", null)
        ));

        mockMvc.perform(get("/restaurant/night_hawk/chart-data").param("interval", "day"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.chart_data", hasSize(2)))
            .andExpect(jsonPath("$.chart_data[0].has_data").value(true))
            .andExpect(jsonPath("$.chart_data[0].value").value(116.0))
            .andExpect(jsonPath("$.chart_data[1].has_data").value(false))
            .andExpect(jsonPath("$.chart_data[1].message").value("No data"));
    }

    @Test
    @DisplayName("Legacy Extreme Pizza routes map to the restaurant endpoints")
    void testLegacyRoutes() throws Exception {
        when(store.findLatest("extreme_pizza"))
            .thenReturn(Optional.of(Samples.sample("extreme_pizza", "2024-01-01T10:00:00Z", 42)));
        when(store.fetchAll(any())).thenReturn(List.of());

        mockMvc.perform(get("/extreme-pizza/live"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.current_popularity").value(42));
        mockMvc.perform(get("/extreme-pizza/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(0)));
    }
}
