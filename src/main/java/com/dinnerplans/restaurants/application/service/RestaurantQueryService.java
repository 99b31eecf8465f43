package com.dinnerplans.restaurants.application.service;

import com.dinnerplans.restaurants.application.port.in.FindRestaurantsUseCase;
import com.dinnerplans.restaurants.domain.exception.ProviderException;
import com.dinnerplans.restaurants.domain.model.AggregatedVenue;
import com.dinnerplans.restaurants.domain.model.Coordinates;
import com.dinnerplans.restaurants.domain.model.RestaurantListing;
import com.dinnerplans.restaurants.domain.model.VenueFilters;
import com.dinnerplans.restaurants.domain.service.VenueFilterEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Application service listing restaurants around the configured search center.
 *
 * The provider is searched over five times the displayed distance so that loosening
 * the distance filter rarely needs a new provider query.
 */
@Service
public class RestaurantQueryService implements FindRestaurantsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RestaurantQueryService.class);

    static final double METERS_PER_MILE = 1609.34;
    static final int SEARCH_RADIUS_MULTIPLIER = 5;

    private final RestaurantAggregator restaurantAggregator;
    private final VenueFilterEngine venueFilterEngine;
    private final Coordinates searchCenter;

    public RestaurantQueryService(
            RestaurantAggregator restaurantAggregator,
            VenueFilterEngine venueFilterEngine,
            @Value("${app.search.center-lat:40.7596}") BigDecimal centerLat,
            @Value("${app.search.center-lng:-111.8867}") BigDecimal centerLng) {
        this.restaurantAggregator = restaurantAggregator;
        this.venueFilterEngine = venueFilterEngine;
        this.searchCenter = new Coordinates(centerLat, centerLng);
    }

    @Override
    public RestaurantListing findRestaurants(String userId, VenueFilters filters) {
        VenueFilters effective = filters != null ? filters : VenueFilters.none();
        double radiusMeters = searchRadiusMeters(effective);

        logger.debug("Finding restaurants for user {} around {} within {}m, filters {}",
                userId, searchCenter, radiusMeters, effective);

        List<AggregatedVenue> venues;
        try {
            venues = restaurantAggregator.aggregate(searchCenter, radiusMeters, userId);
        } catch (ProviderException e) {
            logger.error("Places provider failed (status {}), returning empty listing", e.getStatus(), e);
            return RestaurantListing.empty();
        } catch (RuntimeException e) {
            logger.error("Failed to aggregate restaurants, returning empty listing", e);
            return RestaurantListing.empty();
        }

        RestaurantListing listing = venueFilterEngine.apply(venues, effective);
        logger.debug("Found {} attended and {} candidate restaurants",
                listing.getAttending().size(), listing.getCandidates().size());
        return listing;
    }

    public Coordinates getSearchCenter() {
        return searchCenter;
    }

    static double searchRadiusMeters(VenueFilters filters) {
        double miles = filters.distanceMiles().orElse(VenueFilterEngine.DEFAULT_MAX_DISTANCE_MILES);
        return miles * METERS_PER_MILE * SEARCH_RADIUS_MULTIPLIER;
    }
}
