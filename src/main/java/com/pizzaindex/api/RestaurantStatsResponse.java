package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pizzaindex.domain.PopularityStats;
import com.pizzaindex.domain.Sample;

/**
 * Window statistics for one restaurant. Without rows only the message is filled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RestaurantStatsResponse(
    @JsonProperty("restaurant_id") String restaurantId,
    @JsonProperty("restaurant_name") String restaurantName,
    @JsonProperty("period_days") int periodDays,
    @JsonProperty("data_points") int dataPoints,
    @JsonProperty("latest_data") Sample latestData,
    @JsonProperty("current_popularity") PopularityStats.Popularity currentPopularity,
    PopularityStats.Rating rating,
    String message
) {

    public static final String NO_DATA_MESSAGE = "No data available for the specified period";

    public static RestaurantStatsResponse empty(String restaurantId, String restaurantName, int days) {
        return new RestaurantStatsResponse(restaurantId, restaurantName, days, 0, null, null, null, NO_DATA_MESSAGE);
    }
}
