package com.dinnerplans.restaurants.application.port.out;

import com.dinnerplans.restaurants.domain.model.Attendee;
import com.dinnerplans.restaurants.domain.model.RestaurantAttendance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Output port for dinner group memberships. The store enforces one row per user.
 */
public interface AttendeeRepository {

  /**
   * Restaurant of the dinner group the user belongs to, if any.
   */
  Optional<String> findRestaurantIdByUserId(String userId);

  /**
   * Delete the user's membership.
   *
   * @return number of rows removed (0 or 1)
   */
  int deleteByUserId(String userId);

  /**
   * Persist and flush so a second membership for the same user surfaces immediately.
   */
  Attendee saveAndFlush(Attendee attendee);

  long countByUserId(String userId);

  /**
   * Attendee counts for every dinner group that has at least one member.
   */
  List<RestaurantAttendance> countAttendeesByRestaurant();

  default Map<String, Long> attendeeCountsByRestaurant() {
    return countAttendeesByRestaurant().stream()
        .collect(Collectors.toMap(
            RestaurantAttendance::getRestaurantId,
            RestaurantAttendance::getAttendeeCount,
            Long::sum));
  }
}
