package com.dinnerplans.restaurants.infrastructure.persistence;

import com.dinnerplans.restaurants.application.port.out.DinnerGroupRepository;
import com.dinnerplans.restaurants.domain.model.DinnerGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * JPA implementation of DinnerGroupRepository output port.
 */
@Repository
public interface DinnerGroupJpaRepository extends JpaRepository<DinnerGroup, UUID>, DinnerGroupRepository {

    @Override
    Optional<DinnerGroup> findByRestaurantId(String restaurantId);
}
