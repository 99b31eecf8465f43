package com.dinnerplans.restaurants.application.port.in;

import com.dinnerplans.restaurants.domain.model.RestaurantListing;
import com.dinnerplans.restaurants.domain.model.VenueFilters;

/**
 * Input port for listing restaurants around the configured search center.
 */
public interface FindRestaurantsUseCase {

  /**
   * List restaurants for a user.
   * Never fails because of the provider: an unavailable provider with no usable
   * cached data yields an empty listing.
   *
   * @param userId Requesting user, used to flag the restaurant they are attending
   * @param filters Filters applied to restaurants without a dinner group
   * @return Restaurants with attendees, and ranked candidates
   */
  RestaurantListing findRestaurants(String userId, VenueFilters filters);
}
