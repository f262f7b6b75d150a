package com.pizzaindex.domain;

/**
 * Registry entry for a tracked restaurant.
 */
public record Restaurant(String name, String address) {}
