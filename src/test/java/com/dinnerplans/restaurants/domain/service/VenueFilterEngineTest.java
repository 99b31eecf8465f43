package com.dinnerplans.restaurants.domain.service;

import com.dinnerplans.restaurants.domain.model.AggregatedVenue;
import com.dinnerplans.restaurants.domain.model.RestaurantListing;
import com.dinnerplans.restaurants.domain.model.VenueFilters;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static com.dinnerplans.restaurants.module.test.support.TestFixtures.aggregated;
import static org.assertj.core.api.Assertions.assertThat;

class VenueFilterEngineTest {

    private final VenueFilterEngine engine = new VenueFilterEngine();

    @Test
    void ranksByRatingThenDistance() {
        List<AggregatedVenue> venues = List.of(
                aggregated("a", 4.5, 2, 0.5, 0),
                aggregated("b", 4.5, 2, 0.2, 0),
                aggregated("c", 3.0, 2, 0.1, 0));

        RestaurantListing listing = engine.apply(venues, VenueFilters.none());

        assertThat(listing.getAttending()).isEmpty();
        assertThat(listing.getCandidates())
                .extracting(AggregatedVenue::getDistanceMiles)
                .containsExactly(0.2, 0.5, 0.1);
    }

    @Test
    void attendedVenuesAreSortedByCountAndNeverFiltered() {
        List<AggregatedVenue> venues = List.of(
                aggregated("far", 1.0, 4, 12.0, 1),
                aggregated("popular", null, null, 0.3, 5),
                aggregated("empty", 4.0, 1, 0.3, 0));

        RestaurantListing listing = engine.apply(venues, new VenueFilters(0.5, 4.5, 2));

        assertThat(listing.getAttending())
                .extracting(AggregatedVenue::getId)
                .containsExactly("popular", "far");
        assertThat(listing.getCandidates()).isEmpty();
    }

    @Test
    void defaultsToOneMile() {
        List<AggregatedVenue> venues = List.of(
                aggregated("inside", 4.0, 1, 1.0, 0),
                aggregated("outside", 5.0, 1, 1.1, 0));

        assertThat(engine.apply(venues, VenueFilters.none()).getCandidates())
                .extracting(AggregatedVenue::getId)
                .containsExactly("inside");
    }

    @Test
    void distanceFilterWidensTheRange() {
        List<AggregatedVenue> venues = List.of(
                aggregated("near", 4.0, 1, 0.4, 0),
                aggregated("far", 5.0, 1, 2.9, 0),
                aggregated("too-far", 5.0, 1, 3.1, 0));

        assertThat(engine.apply(venues, new VenueFilters(3.0, null, null)).getCandidates())
                .extracting(AggregatedVenue::getId)
                .containsExactly("far", "near");
    }

    @Test
    void unratedVenuesCountAsZero() {
        List<AggregatedVenue> venues = List.of(
                aggregated("unrated", null, 1, 0.1, 0),
                aggregated("rated", 2.0, 1, 0.9, 0));

        assertThat(engine.apply(venues, VenueFilters.none()).getCandidates())
                .extracting(AggregatedVenue::getId)
                .containsExactly("rated", "unrated");
        assertThat(engine.apply(venues, new VenueFilters(null, 1.0, null)).getCandidates())
                .extracting(AggregatedVenue::getId)
                .containsExactly("rated");
    }

    @Test
    void priceMustMatchExactly() {
        List<AggregatedVenue> venues = List.of(
                aggregated("cheap", 4.0, 1, 0.1, 0),
                aggregated("mid", 4.0, 2, 0.2, 0),
                aggregated("unknown", 4.0, null, 0.3, 0));

        assertThat(engine.apply(venues, new VenueFilters(null, null, 2)).getCandidates())
                .extracting(AggregatedVenue::getId)
                .containsExactly("mid");
    }

    @Test
    void minimumRatingIsInclusive() {
        List<AggregatedVenue> venues = List.of(
                aggregated("exact", 4.0, 1, 0.1, 0),
                aggregated("below", 3.9, 1, 0.1, 0));

        assertThat(engine.apply(venues, new VenueFilters(null, 4.0, null)).getCandidates())
                .extracting(AggregatedVenue::getId)
                .containsExactly("exact");
    }

    @Test
    void capsCandidatesAtFifteen() {
        List<AggregatedVenue> venues = new ArrayList<>();
        IntStream.range(0, 20).forEach(i -> venues.add(aggregated("v" + i, 1.0 + i * 0.1, 1, 0.5, 0)));
        venues.add(aggregated("attended", 1.0, 1, 0.5, 2));

        RestaurantListing listing = engine.apply(venues, VenueFilters.none());

        assertThat(listing.getCandidates()).hasSize(VenueFilterEngine.MAX_CANDIDATES);
        assertThat(listing.getCandidates().get(0).getId()).isEqualTo("v19");
        assertThat(listing.getAttending()).extracting(AggregatedVenue::getId).containsExactly("attended");
    }

    @Test
    void nullFiltersBehaveLikeNone() {
        List<AggregatedVenue> venues = List.of(aggregated("a", 4.0, 1, 0.5, 0));

        assertThat(engine.apply(venues, null)).isEqualTo(engine.apply(venues, VenueFilters.none()));
    }
}
