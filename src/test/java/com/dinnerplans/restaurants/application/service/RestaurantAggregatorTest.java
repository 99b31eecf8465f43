package com.dinnerplans.restaurants.application.service;

import com.dinnerplans.restaurants.application.port.out.AttendeeRepository;
import com.dinnerplans.restaurants.application.port.out.VenueCatalogRepository;
import com.dinnerplans.restaurants.application.port.out.VenueProvider;
import com.dinnerplans.restaurants.domain.exception.ProviderException;
import com.dinnerplans.restaurants.domain.model.AggregatedVenue;
import com.dinnerplans.restaurants.domain.model.Coordinates;
import com.dinnerplans.restaurants.domain.model.Venue;
import com.dinnerplans.restaurants.domain.service.DistanceCalculator;
import com.dinnerplans.restaurants.infrastructure.cache.CachePolicy;
import com.dinnerplans.restaurants.infrastructure.cache.StaleWhileRevalidateCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.concurrent.ConcurrentMapCache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dinnerplans.restaurants.module.test.support.TestFixtures.Common.ALICE;
import static com.dinnerplans.restaurants.module.test.support.TestFixtures.Coordinates.*;
import static com.dinnerplans.restaurants.module.test.support.TestFixtures.venue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestaurantAggregatorTest {

    private static final double RADIUS_METERS = 8046.7;

    @Mock
    private VenueProvider venueProvider;

    @Mock
    private VenueCatalogRepository venueCatalogRepository;

    @Mock
    private AttendeeRepository attendeeRepository;

    private RestaurantAggregator aggregator;
    private Coordinates center;

    @BeforeEach
    void setUp() {
        StaleWhileRevalidateCache<List<Venue>> providerCache = new StaleWhileRevalidateCache<>(
                new ConcurrentMapCache("providerRestaurants"),
                new CachePolicy("providerRestaurants", Duration.ofMinutes(30), Duration.ofHours(24)),
                Runnable::run, Clock.systemUTC());
        StaleWhileRevalidateCache<List<Venue>> catalogCache = new StaleWhileRevalidateCache<>(
                new ConcurrentMapCache("catalogRestaurants"),
                new CachePolicy("catalogRestaurants", Duration.ofMinutes(5), Duration.ofMinutes(30)),
                Runnable::run, Clock.systemUTC());
        aggregator = new RestaurantAggregator(venueProvider, venueCatalogRepository, attendeeRepository,
                new DistanceCalculator(), providerCache, catalogCache);
        center = new Coordinates(CENTER_LAT, CENTER_LNG);
    }

    @Test
    void catalogCopyWinsOnDuplicateIds() {
        Venue fromProvider = venue("shared", "Provider Name", NEARBY_LAT, NEARBY_LNG);
        Venue providerOnly = venue("provider-only", "Only Provider", NEARBY_LAT, NEARBY_LNG);
        Venue fromCatalog = venue("shared", "Catalog Name", NEARBY_LAT, NEARBY_LNG);
        fromCatalog.setRating(4.2);
        Venue catalogOnly = venue("catalog-only", "Only Catalog", CENTER_LAT, CENTER_LNG);
        when(venueProvider.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS)).thenReturn(List.of(fromProvider, providerOnly));
        when(venueCatalogRepository.findAll()).thenReturn(List.of(fromCatalog, catalogOnly));

        List<AggregatedVenue> result = aggregator.aggregate(center, RADIUS_METERS, ALICE);

        assertThat(result).extracting(AggregatedVenue::getId)
                .containsExactly("shared", "provider-only", "catalog-only");
        assertThat(result.get(0).getName()).isEqualTo("Catalog Name");
        assertThat(result.get(0).getRating()).isEqualTo(4.2);
    }

    @Test
    void attachesDistanceCountsAndMembership() {
        when(venueProvider.search(any(), any(), anyDouble())).thenReturn(List.of());
        when(venueCatalogRepository.findAll()).thenReturn(List.of(
                venue("joined", "Joined", NEARBY_LAT, NEARBY_LNG),
                venue("busy", "Busy", CENTER_LAT, CENTER_LNG),
                venue("quiet", "Quiet", CENTER_LAT, CENTER_LNG)));
        when(attendeeRepository.attendeeCountsByRestaurant()).thenReturn(Map.of("joined", 1L, "busy", 4L));
        when(attendeeRepository.findRestaurantIdByUserId(ALICE)).thenReturn(Optional.of("joined"));

        List<AggregatedVenue> result = aggregator.aggregate(center, RADIUS_METERS, ALICE);

        assertThat(result).extracting(AggregatedVenue::getId, AggregatedVenue::getAttendeeCount,
                        AggregatedVenue::isUserAttending, AggregatedVenue::getDistanceMiles)
                .containsExactly(
                        tuple("joined", 1L, true, 0.4),
                        tuple("busy", 4L, false, 0.0),
                        tuple("quiet", 0L, false, 0.0));
    }

    @Test
    void providerResultsAreStoredAndCached() {
        Venue found = venue("found", "Found", NEARBY_LAT, NEARBY_LNG);
        when(venueProvider.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS)).thenReturn(List.of(found));
        when(venueCatalogRepository.findAll()).thenReturn(List.of());

        aggregator.aggregate(center, RADIUS_METERS, ALICE);
        aggregator.aggregate(center, RADIUS_METERS, ALICE);

        verify(venueProvider, times(1)).search(CENTER_LAT, CENTER_LNG, RADIUS_METERS);
        verify(venueCatalogRepository, times(1)).upsert(found);
        verify(venueCatalogRepository, times(1)).findAll();
    }

    @Test
    void differentRadiusIsADifferentProviderKey() {
        when(venueProvider.search(any(), any(), anyDouble())).thenReturn(List.of());
        when(venueCatalogRepository.findAll()).thenReturn(List.of());

        aggregator.aggregate(center, RADIUS_METERS, ALICE);
        aggregator.aggregate(center, RADIUS_METERS * 2, ALICE);

        verify(venueProvider).search(CENTER_LAT, CENTER_LNG, RADIUS_METERS);
        verify(venueProvider).search(CENTER_LAT, CENTER_LNG, RADIUS_METERS * 2);
    }

    @Test
    void attendanceIsNeverCached() {
        when(venueProvider.search(any(), any(), anyDouble())).thenReturn(List.of());
        when(venueCatalogRepository.findAll()).thenReturn(List.of(venue("r1", "R1", CENTER_LAT, CENTER_LNG)));
        when(attendeeRepository.attendeeCountsByRestaurant()).thenReturn(Map.of(), Map.of("r1", 2L));

        assertThat(aggregator.aggregate(center, RADIUS_METERS, ALICE).get(0).getAttendeeCount()).isZero();
        assertThat(aggregator.aggregate(center, RADIUS_METERS, ALICE).get(0).getAttendeeCount()).isEqualTo(2L);
    }

    @Test
    void providerFailureWithoutCacheEntryPropagates() {
        when(venueProvider.search(any(), any(), anyDouble())).thenThrow(new ProviderException("down", "UNKNOWN_ERROR"));

        assertThatThrownBy(() -> aggregator.aggregate(center, RADIUS_METERS, ALICE))
                .isInstanceOf(ProviderException.class);
        verify(venueCatalogRepository, never()).upsert(any());
    }

    @Test
    void providerKeyUsesExactCoordinates() {
        assertThat(RestaurantAggregator.buildProviderKey(Coordinates.of("40.7596", "-111.8867"), 8046.7))
                .isEqualTo("restaurants:40.7596:-111.8867:8046.7");
        assertThat(RestaurantAggregator.buildProviderKey(Coordinates.of("40.7597", "-111.8867"), 8046.7))
                .isNotEqualTo(RestaurantAggregator.buildProviderKey(Coordinates.of("40.7596", "-111.8867"), 8046.7));
    }

    @Test
    void emptySourcesYieldEmptyResult() {
        when(venueProvider.search(any(), any(), anyDouble())).thenReturn(List.of());
        when(venueCatalogRepository.findAll()).thenReturn(List.of());

        assertThat(aggregator.aggregate(center, RADIUS_METERS, ALICE)).isEmpty();
    }

    @Test
    void noMembershipMeansNoFlags() {
        when(venueProvider.search(any(), any(), anyDouble())).thenReturn(List.of(
                venue("a", "A", CENTER_LAT, CENTER_LNG)));
        when(venueCatalogRepository.findAll()).thenReturn(List.of());

        assertThat(aggregator.aggregate(center, RADIUS_METERS, ALICE))
                .noneMatch(AggregatedVenue::isUserAttending);
    }
}
