package com.dinnerplans.restaurants.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Restaurants split for presentation: those with a dinner group ordered by attendance,
 * and the filtered, ranked restaurants nobody has joined yet.
 */
@Getter
@EqualsAndHashCode
@ToString
public class RestaurantListing {
    private final List<AggregatedVenue> attending;
    private final List<AggregatedVenue> candidates;

    public RestaurantListing(List<AggregatedVenue> attending, List<AggregatedVenue> candidates) {
        this.attending = List.copyOf(attending);
        this.candidates = List.copyOf(candidates);
    }

    public static RestaurantListing empty() {
        return new RestaurantListing(List.of(), List.of());
    }
}
