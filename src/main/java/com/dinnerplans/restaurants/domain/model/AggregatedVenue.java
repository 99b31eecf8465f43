package com.dinnerplans.restaurants.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * A venue as seen by one user from one search center: catalog fields plus
 * distance, live attendee count and whether the user is in its dinner group.
 */
@Getter
@EqualsAndHashCode
@ToString
public class AggregatedVenue {
    private final String id;
    private final String name;
    private final Integer priceLevel;
    private final Double rating;
    private final BigDecimal lat;
    private final BigDecimal lng;
    private final String photoRef;
    private final String mapsUrl;
    private final double distanceMiles;
    private final long attendeeCount;
    private final boolean userAttending;

    public AggregatedVenue(Venue venue, double distanceMiles, long attendeeCount, boolean userAttending) {
        this.id = venue.getId();
        this.name = venue.getName();
        this.priceLevel = venue.getPriceLevel();
        this.rating = venue.getRating();
        this.lat = venue.getLat();
        this.lng = venue.getLng();
        this.photoRef = venue.getPhotoRef();
        this.mapsUrl = venue.getMapsUrl();
        this.distanceMiles = distanceMiles;
        this.attendeeCount = attendeeCount;
        this.userAttending = userAttending;
    }

    /**
     * Rating used for comparisons; an unrated venue counts as 0.
     */
    public double effectiveRating() {
        return rating != null ? rating : 0.0;
    }
}
