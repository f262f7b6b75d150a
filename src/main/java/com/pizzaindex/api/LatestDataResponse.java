package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pizzaindex.domain.Restaurant;
import com.pizzaindex.domain.Sample;

import java.util.Map;

/**
 * Most recent row of every registered restaurant.
 */
public record LatestDataResponse(
    String timestamp,
    Map<String, RestaurantLatest> restaurants
) {

    public static final String FETCH_FAILED = "Failed to fetch data";

    /** {@code latestData} is null when the restaurant has no rows or its lookup failed. */
    public record RestaurantLatest(
        Restaurant restaurant,
        @JsonProperty("latest_data") Sample latestData,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error
    ) {}
}
