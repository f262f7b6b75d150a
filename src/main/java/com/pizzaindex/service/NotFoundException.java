package com.pizzaindex.service;

/**
 * Unknown restaurant, or a lookup that found no rows.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException restaurant(String restaurantId) {
        return new NotFoundException("Restaurant not found: " + restaurantId);
    }
}
