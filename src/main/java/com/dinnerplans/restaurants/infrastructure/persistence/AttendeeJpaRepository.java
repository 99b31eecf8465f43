package com.dinnerplans.restaurants.infrastructure.persistence;

import com.dinnerplans.restaurants.application.port.out.AttendeeRepository;
import com.dinnerplans.restaurants.domain.model.Attendee;
import com.dinnerplans.restaurants.domain.model.RestaurantAttendance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA implementation of AttendeeRepository output port.
 */
@Repository
public interface AttendeeJpaRepository extends JpaRepository<Attendee, UUID>, AttendeeRepository {

    @Override
    @Query("SELECT a.dinnerGroup.restaurantId FROM Attendee a WHERE a.userId = :userId")
    Optional<String> findRestaurantIdByUserId(@Param("userId") String userId);

    /**
     * Bulk delete; runs inside the caller's transaction.
     */
    @Override
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Attendee a WHERE a.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);

    @Override
    long countByUserId(String userId);

    @Override
    @Query("SELECT g.restaurantId AS restaurantId, COUNT(a) AS attendeeCount "
            + "FROM Attendee a JOIN a.dinnerGroup g GROUP BY g.restaurantId")
    List<RestaurantAttendance> countAttendeesByRestaurant();
}
