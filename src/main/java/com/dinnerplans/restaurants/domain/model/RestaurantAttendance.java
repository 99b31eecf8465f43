package com.dinnerplans.restaurants.domain.model;

/**
 * Attendee count of one restaurant's dinner group.
 */
public interface RestaurantAttendance {

    String getRestaurantId();

    long getAttendeeCount();
}
