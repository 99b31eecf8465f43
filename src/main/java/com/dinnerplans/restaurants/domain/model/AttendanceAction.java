package com.dinnerplans.restaurants.domain.model;

/**
 * A requested change to a user's dinner group membership.
 */
public sealed interface AttendanceAction permits AttendanceAction.Join, AttendanceAction.Leave {

    record Join(String restaurantId) implements AttendanceAction {
        public Join {
            if (restaurantId == null || restaurantId.isBlank()) {
                throw new IllegalArgumentException("restaurantId is required to join a dinner group");
            }
        }
    }

    record Leave() implements AttendanceAction {
    }

    static AttendanceAction join(String restaurantId) {
        return new Join(restaurantId);
    }

    static AttendanceAction leave() {
        return new Leave();
    }
}
