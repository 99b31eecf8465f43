package com.dinnerplans.restaurants.infrastructure.persistence;

import com.dinnerplans.restaurants.application.port.out.AttendeeRepository;
import com.dinnerplans.restaurants.application.port.out.DinnerGroupRepository;
import com.dinnerplans.restaurants.application.port.out.VenueCatalogRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for wiring JPA repositories to application ports.
 * This adapter layer bridges infrastructure (JPA) with application ports.
 */
@Configuration
public class PersistenceAdapterConfig {

    @Bean
    public VenueCatalogRepository venueCatalogRepository(VenueJpaRepository jpaRepository) {
        return jpaRepository;
    }

    @Bean
    public DinnerGroupRepository dinnerGroupRepository(DinnerGroupJpaRepository jpaRepository) {
        return jpaRepository;
    }

    @Bean
    public AttendeeRepository attendeeRepository(AttendeeJpaRepository jpaRepository) {
        return jpaRepository;
    }
}
