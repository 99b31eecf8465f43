package com.dinnerplans.restaurants.domain.exception;

public class VenueNotFoundException extends RuntimeException {

    private final String restaurantId;

    public VenueNotFoundException(String restaurantId) {
        super("Restaurant not found: " + restaurantId);
        this.restaurantId = restaurantId;
    }

    public String getRestaurantId() {
        return restaurantId;
    }
}
