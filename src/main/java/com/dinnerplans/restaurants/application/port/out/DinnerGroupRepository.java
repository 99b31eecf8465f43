package com.dinnerplans.restaurants.application.port.out;

import com.dinnerplans.restaurants.domain.model.DinnerGroup;

import java.util.Optional;

/**
 * Output port for dinner groups. The store enforces one group per restaurant.
 */
public interface DinnerGroupRepository {

  Optional<DinnerGroup> findByRestaurantId(String restaurantId);

  /**
   * Persist and flush so a duplicate restaurant surfaces immediately as a constraint violation.
   */
  DinnerGroup saveAndFlush(DinnerGroup dinnerGroup);
}
