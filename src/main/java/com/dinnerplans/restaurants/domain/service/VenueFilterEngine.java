package com.dinnerplans.restaurants.domain.service;

import com.dinnerplans.restaurants.domain.model.AggregatedVenue;
import com.dinnerplans.restaurants.domain.model.RestaurantListing;
import com.dinnerplans.restaurants.domain.model.VenueFilters;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Splits aggregated restaurants into the ones with a dinner group and the ones without,
 * then filters and ranks the latter.
 *
 * Restaurants with attendees are never filtered or capped: they are ordered by attendee
 * count only. The rest must lie within the requested distance (1 mile by default), meet
 * the minimum rating and match the price level exactly, and are ranked by rating
 * (unrated counts as 0) with distance as tie-break.
 */
@Service
public class VenueFilterEngine {

    public static final double DEFAULT_MAX_DISTANCE_MILES = 1.0;
    public static final int MAX_CANDIDATES = 15;

    private static final Comparator<AggregatedVenue> BY_ATTENDANCE =
            Comparator.comparingLong(AggregatedVenue::getAttendeeCount).reversed();

    private static final Comparator<AggregatedVenue> BY_RATING_THEN_DISTANCE =
            Comparator.comparingDouble(AggregatedVenue::effectiveRating).reversed()
                    .thenComparingDouble(AggregatedVenue::getDistanceMiles);

    public RestaurantListing apply(List<AggregatedVenue> venues, VenueFilters filters) {
        VenueFilters effective = filters != null ? filters : VenueFilters.none();

        List<AggregatedVenue> attending = venues.stream()
                .filter(venue -> venue.getAttendeeCount() > 0)
                .sorted(BY_ATTENDANCE)
                .toList();

        double maxDistance = effective.distanceMiles().orElse(DEFAULT_MAX_DISTANCE_MILES);

        List<AggregatedVenue> candidates = venues.stream()
                .filter(venue -> venue.getAttendeeCount() == 0)
                .filter(venue -> venue.getDistanceMiles() <= maxDistance)
                .filter(venue -> effective.minRating()
                        .map(minRating -> venue.effectiveRating() >= minRating)
                        .orElse(true))
                .filter(venue -> effective.priceLevel()
                        .map(priceLevel -> Objects.equals(venue.getPriceLevel(), priceLevel))
                        .orElse(true))
                .sorted(BY_RATING_THEN_DISTANCE)
                .limit(MAX_CANDIDATES)
                .toList();

        return new RestaurantListing(attending, candidates);
    }
}
