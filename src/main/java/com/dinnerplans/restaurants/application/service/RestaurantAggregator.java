package com.dinnerplans.restaurants.application.service;

import com.dinnerplans.restaurants.application.port.out.AttendeeRepository;
import com.dinnerplans.restaurants.application.port.out.VenueCatalogRepository;
import com.dinnerplans.restaurants.application.port.out.VenueProvider;
import com.dinnerplans.restaurants.domain.model.AggregatedVenue;
import com.dinnerplans.restaurants.domain.model.Coordinates;
import com.dinnerplans.restaurants.domain.model.Venue;
import com.dinnerplans.restaurants.domain.service.DistanceCalculator;
import com.dinnerplans.restaurants.infrastructure.cache.StaleWhileRevalidateCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges provider search results with the local catalog and attaches per-user data.
 *
 * Strategy:
 * 1. Provider results through the provider cache (a load also upserts them into the catalog)
 * 2. Catalog snapshot through the catalog cache
 * 3. Attendee counts and the user's membership straight from the store, never cached
 * 4. Provider list first, catalog list second, deduplicated by id: the catalog copy wins
 * 5. Distance from the search center, attendee count and attending flag per venue
 */
@Service
public class RestaurantAggregator {

    private static final Logger logger = LoggerFactory.getLogger(RestaurantAggregator.class);

    static final String ALL_RESTAURANTS_KEY = "restaurants:all";

    private final VenueProvider venueProvider;
    private final VenueCatalogRepository venueCatalogRepository;
    private final AttendeeRepository attendeeRepository;
    private final DistanceCalculator distanceCalculator;
    private final StaleWhileRevalidateCache<List<Venue>> providerRestaurantCache;
    private final StaleWhileRevalidateCache<List<Venue>> catalogRestaurantCache;

    public RestaurantAggregator(
            VenueProvider venueProvider,
            VenueCatalogRepository venueCatalogRepository,
            AttendeeRepository attendeeRepository,
            DistanceCalculator distanceCalculator,
            @Qualifier("providerRestaurantCache") StaleWhileRevalidateCache<List<Venue>> providerRestaurantCache,
            @Qualifier("catalogRestaurantCache") StaleWhileRevalidateCache<List<Venue>> catalogRestaurantCache) {
        this.venueProvider = venueProvider;
        this.venueCatalogRepository = venueCatalogRepository;
        this.attendeeRepository = attendeeRepository;
        this.distanceCalculator = distanceCalculator;
        this.providerRestaurantCache = providerRestaurantCache;
        this.catalogRestaurantCache = catalogRestaurantCache;
    }

    /**
     * Aggregate restaurants around a center for one user.
     *
     * @param center Search center
     * @param radiusMeters Provider search radius in meters
     * @param userId Requesting user
     * @return One entry per restaurant id, in order of first appearance
     * @throws com.dinnerplans.restaurants.domain.exception.ProviderException if the provider fails
     *         and no servable cached result exists
     */
    public List<AggregatedVenue> aggregate(Coordinates center, double radiusMeters, String userId) {
        List<Venue> providerVenues = providerRestaurantCache.get(
                buildProviderKey(center, radiusMeters),
                () -> fetchAndStore(center, radiusMeters));

        List<Venue> catalogVenues = catalogRestaurantCache.get(
                ALL_RESTAURANTS_KEY,
                () -> new ArrayList<>(venueCatalogRepository.findAll()));

        Map<String, Long> attendeeCounts = attendeeRepository.attendeeCountsByRestaurant();
        Optional<String> attendingRestaurantId = attendeeRepository.findRestaurantIdByUserId(userId);

        Map<String, Venue> unique = new LinkedHashMap<>();
        providerVenues.forEach(venue -> unique.put(venue.getId(), venue));
        catalogVenues.forEach(venue -> unique.put(venue.getId(), venue));

        logger.debug("Aggregating {} provider and {} catalog restaurants into {} unique",
                providerVenues.size(), catalogVenues.size(), unique.size());

        return unique.values().stream()
                .map(venue -> new AggregatedVenue(
                        venue,
                        distanceCalculator.distanceMiles(center, new Coordinates(venue.getLat(), venue.getLng())),
                        attendeeCounts.getOrDefault(venue.getId(), 0L),
                        attendingRestaurantId.map(venue.getId()::equals).orElse(false)))
                .toList();
    }

    /**
     * Provider cache loader: search, then upsert every result into the catalog.
     */
    private List<Venue> fetchAndStore(Coordinates center, double radiusMeters) {
        List<Venue> venues = venueProvider.search(center.getLat(), center.getLng(), radiusMeters);
        venues.forEach(venueCatalogRepository::upsert);
        logger.info("Stored {} restaurants from provider for {}", venues.size(), center);
        return new ArrayList<>(venues);
    }

    /**
     * Exact lat/lng/radius key; nearby queries do not share entries.
     */
    static String buildProviderKey(Coordinates center, double radiusMeters) {
        return "restaurants:" + center.getLat().toPlainString() + ":" + center.getLng().toPlainString()
                + ":" + radiusMeters;
    }
}
