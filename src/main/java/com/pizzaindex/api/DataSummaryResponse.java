package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pizzaindex.domain.PopularityStats;
import com.pizzaindex.domain.Restaurant;
import com.pizzaindex.domain.Sample;

import java.util.Map;

/**
 * Per-restaurant statistics over a window, for every restaurant that has rows in it.
 */
public record DataSummaryResponse(
    @JsonProperty("period_days") int periodDays,
    @JsonProperty("total_data_points") int totalDataPoints,
    Map<String, RestaurantSummary> restaurants
) {

    public record RestaurantSummary(
        Restaurant restaurant,
        @JsonProperty("data_points") int dataPoints,
        @JsonProperty("latest_data") Sample latestData,
        @JsonProperty("current_popularity") PopularityStats.Popularity currentPopularity,
        PopularityStats.Rating rating
    ) {}
}
