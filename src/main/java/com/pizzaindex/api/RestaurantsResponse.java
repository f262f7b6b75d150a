package com.pizzaindex.api;

import com.pizzaindex.domain.Restaurant;

import java.util.Map;

public record RestaurantsResponse(Map<String, Restaurant> restaurants, int count) {}
