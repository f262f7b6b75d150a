package com.pizzaindex.service;

import com.pizzaindex.api.RestaurantChartResponse;
import com.pizzaindex.api.RestaurantStatsResponse;
import com.pizzaindex.domain.Granularity;
import com.pizzaindex.domain.Sample;
import com.pizzaindex.storage.SampleStore;
import com.pizzaindex.storage.StoreQuery;
import com.pizzaindex.support.MutableClock;
import com.pizzaindex.support.Samples;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("RestaurantService Tests")
class RestaurantServiceTest {

    private SampleStore store;
    private RestaurantService service;

    @BeforeEach
    void setUp() {
        store = mock(SampleStore.class);
        MutableClock clock = MutableClock.at("2024-01-08T12:00:00Z");
        service = new RestaurantService(store, Samples.pipeline(clock, new SimpleMeterRegistry()), Samples.registry(), clock);
    }

    @Test
    @DisplayName("Unknown restaurants are rejected before the store is queried")
    void testUnknownRestaurant() {
        assertThatThrownBy(() -> service.latest("foo"))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Restaurant not found: foo");
        assertThatThrownBy(() -> service.stats("foo", 7)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.data("foo", null, null, null)).isInstanceOf(NotFoundException.class);

        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Latest returns the newest row or 404 when there is none")
    void testLatest() {
        Sample row = Samples.sample("extreme_pizza", "2024-01-08T11:55:00Z", 35);
        when(store.findLatest("extreme_pizza")).thenReturn(Optional.of(row));
        when(store.findLatest("colony_grill")).thenReturn(Optional.empty());

        assertThat(service.latest("extreme_pizza")).isSameAs(row);
        assertThatThrownBy(() -> service.latest("colony_grill")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("With a limit only one page is read")
    void testDataWithLimit() {
        ArgumentCaptor<StoreQuery> query = ArgumentCaptor.forClass(StoreQuery.class);
        when(store.fetchPage(any(), eq(5), eq(0))).thenReturn(List.of());

        service.data("extreme_pizza", 5, null, null);

        verify(store).fetchPage(query.capture(), eq(5), eq(0));
        verify(store, never()).fetchAll(any());
        assertThat(query.getValue().toParams())
            .containsEntry("restaurant_id", "eq.extreme_pizza")
            .containsEntry("order", "timestamp.desc")
            .doesNotContainKey("timestamp");
    }

    @Test
    @DisplayName("days takes precedence over hours")
    void testDaysOverHours() {
        ArgumentCaptor<StoreQuery> query = ArgumentCaptor.forClass(StoreQuery.class);
        when(store.fetchAll(any())).thenReturn(List.of());

        service.data("extreme_pizza", null, 2, 3);

        verify(store).fetchAll(query.capture());
        assertThat(query.getValue().toParams()).containsEntry("timestamp", "gte.2024-01-06T12:00:00.000000Z");
    }

    @Test
    @DisplayName("hours applies when days is absent")
    void testHoursWindow() {
        ArgumentCaptor<StoreQuery> query = ArgumentCaptor.forClass(StoreQuery.class);
        when(store.fetchAll(any())).thenReturn(List.of());

        service.data("extreme_pizza", null, null, 3);

        verify(store).fetchAll(query.capture());
        assertThat(query.getValue().toParams()).containsEntry("timestamp", "gte.2024-01-08T09:00:00.000000Z");
    }

    @Test
    @DisplayName("Stats summarize the window with the newest row as latest_data")
    void testStats() {
        Sample newest = Samples.sample("extreme_pizza", "2024-01-08T11:00:00Z", 60, 4.6);
        when(store.fetchAll(any())).thenReturn(List.of(
            newest,
            Samples.sample("extreme_pizza", "2024-01-08T10:00:00Z", null, 4.4),
            Samples.sample("extreme_pizza", "2024-01-08T09:00:00Z", 20)
        ));

        RestaurantStatsResponse stats = service.stats("extreme_pizza", 7);

        assertThat(stats.restaurantName()).isEqualTo("Extreme Pizza");
        assertThat(stats.dataPoints()).isEqualTo(3);
        assertThat(stats.latestData()).isSameAs(newest);
        assertThat(stats.currentPopularity().latest()).isEqualTo(60);
        assertThat(stats.currentPopularity().average()).isEqualTo(40.0);
        assertThat(stats.currentPopularity().min()).isEqualTo(20);
        assertThat(stats.currentPopularity().max()).isEqualTo(60);
        assertThat(stats.rating().average()).isEqualTo(4.5);
        assertThat(stats.message()).isNull();
    }

    @Test
    @DisplayName("Stats without rows carry only a message")
    void testStatsEmpty() {
        when(store.fetchAll(any())).thenReturn(List.of());

        RestaurantStatsResponse stats = service.stats("extreme_pizza", 3);

        assertThat(stats.dataPoints()).isZero();
        assertThat(stats.periodDays()).isEqualTo(3);
        assertThat(stats.message()).isEqualTo(RestaurantStatsResponse.NO_DATA_MESSAGE);
        assertThat(stats.currentPopularity()).isNull();
    }

    @Test
    @DisplayName("Chart data reports buckets without popularity as explicit no-data entries")
    void testChartData() {
        when(store.fetchAll(any())).thenReturn(List.of(
            Samples.sample("extreme_pizza", "2024-01-08T09:10:00Z", 20),
            Samples.sample("extreme_pizza", "2024-01-08T09:50:00Z", 40, 4.5),
            Samples.sample("extreme_pizza", "2024-01-08T10:15:00Z", null)
        ));

        RestaurantChartResponse response = service.chartData("extreme_pizza", 1, Granularity.HOUR);

        assertThat(response.totalDataPoints()).isEqualTo(2);
        RestaurantChartResponse.BucketSummary first = response.chartData().get(0);
        assertThat(first.timestamp()).isEqualTo("2024-01-08T09:00:00Z");
        assertThat(first.hasData()).isTrue();
        assertThat(first.currentPopularity()).isEqualTo(40);
        assertThat(first.avgPopularity()).isEqualTo(30.0);
        assertThat(first.value()).isEqualTo(124.0);
        assertThat(first.rating()).isEqualTo(4.5);
        assertThat(first.latestTimestamp()).isEqualTo("2024-01-08T09:50:00Z");

        RestaurantChartResponse.BucketSummary second = response.chartData().get(1);
        assertThat(second.hasData()).isFalse();
        assertThat(second.value()).isNull();
        assertThat(second.dataPoints()).isEqualTo(1);
        assertThat(second.message()).isEqualTo(RestaurantChartResponse.NO_DATA);
    }

    @Test
    @DisplayName("Per-restaurant chart rejects minute buckets")
    void testChartRejectsMinute() {
        assertThatThrownBy(() -> service.chartData("extreme_pizza", 1, Granularity.MINUTE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("hour, day");
        verifyNoInteractions(store);
    }
}
