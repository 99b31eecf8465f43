package com.dinnerplans.restaurants.application.port.in;

import com.dinnerplans.restaurants.domain.model.AttendanceAction;

import java.util.Optional;

/**
 * Input port for joining and leaving dinner groups.
 */
public interface ManageAttendanceUseCase {

  /**
   * Apply a join or leave for the user. Both are idempotent.
   *
   * @throws com.dinnerplans.restaurants.domain.exception.AttendanceConflictException
   *         if the change still conflicts after one retry
   * @throws com.dinnerplans.restaurants.domain.exception.VenueNotFoundException
   *         if the restaurant to join is not in the catalog
   */
  void apply(String userId, AttendanceAction action);

  /**
   * Restaurant whose dinner group the user currently belongs to.
   */
  Optional<String> currentRestaurant(String userId);
}
