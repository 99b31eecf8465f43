package com.dinnerplans.restaurants.infrastructure.persistence;

import com.dinnerplans.restaurants.application.port.out.VenueCatalogRepository;
import com.dinnerplans.restaurants.domain.model.Venue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA implementation of VenueCatalogRepository output port.
 */
@Repository
public interface VenueJpaRepository extends JpaRepository<Venue, String>, VenueCatalogRepository {

    /**
     * Single-statement upsert so concurrent refreshes of the same place never collide
     * on the primary key. Last write wins.
     */
    @Override
    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO restaurant (id, name, price_level, rating, lat, lng, photo_ref, maps_url, created_at, updated_at)
            VALUES (:#{#venue.id}, :#{#venue.name}, :#{#venue.priceLevel}, :#{#venue.rating},
                    :#{#venue.lat}, :#{#venue.lng}, :#{#venue.photoRef}, :#{#venue.mapsUrl},
                    CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                price_level = EXCLUDED.price_level,
                rating = EXCLUDED.rating,
                lat = EXCLUDED.lat,
                lng = EXCLUDED.lng,
                photo_ref = EXCLUDED.photo_ref,
                maps_url = EXCLUDED.maps_url,
                updated_at = CURRENT_TIMESTAMP
            """, nativeQuery = true)
    int upsert(@Param("venue") Venue venue);
}
