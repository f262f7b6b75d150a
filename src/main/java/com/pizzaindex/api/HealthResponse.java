package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
    String status,
    String service,
    String timestamp,
    @JsonProperty("database_connected") boolean databaseConnected,
    @JsonProperty("restaurants_count") int restaurantsCount
) {}
