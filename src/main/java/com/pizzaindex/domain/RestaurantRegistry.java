package com.pizzaindex.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only map of tracked restaurants, fixed at startup.
 * Only used to validate ids and decorate responses.
 */
public class RestaurantRegistry {

    private final Map<String, Restaurant> restaurants;

    public RestaurantRegistry(Map<String, Restaurant> restaurants) {
        this.restaurants = Collections.unmodifiableMap(new LinkedHashMap<>(restaurants));
    }

    public boolean contains(String restaurantId) {
        return restaurantId != null && restaurants.containsKey(restaurantId);
    }

    public Optional<Restaurant> find(String restaurantId) {
        return Optional.ofNullable(restaurantId).map(restaurants::get);
    }

    /** Returns all restaurants in configuration order. */
    public Map<String, Restaurant> all() {
        return restaurants;
    }

    public Set<String> ids() {
        return restaurants.keySet();
    }

    public int size() {
        return restaurants.size();
    }
}
