package com.dinnerplans.restaurants.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Optional filters applied to restaurants nobody has joined yet.
 * Absent values mean "no filter". Malformed or non-positive raw values are treated as absent.
 */
@Getter
@EqualsAndHashCode
@ToString
public class VenueFilters {

    private static final VenueFilters NONE = new VenueFilters(null, null, null);

    private final Double distanceMiles;
    private final Double minRating;
    private final Integer priceLevel;

    public VenueFilters(Double distanceMiles, Double minRating, Integer priceLevel) {
        this.distanceMiles = distanceMiles;
        this.minRating = minRating;
        this.priceLevel = priceLevel;
    }

    public static VenueFilters none() {
        return NONE;
    }

    public static VenueFilters parse(String distance, String rating, String price) {
        return new VenueFilters(
                parsePositiveDouble(distance).orElse(null),
                parsePositiveDouble(rating).orElse(null),
                parsePositiveInteger(price).orElse(null));
    }

    public Optional<Double> distanceMiles() {
        return Optional.ofNullable(distanceMiles);
    }

    public Optional<Double> minRating() {
        return Optional.ofNullable(minRating);
    }

    public Optional<Integer> priceLevel() {
        return Optional.ofNullable(priceLevel);
    }

    private static Optional<Double> parsePositiveDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) && value > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Integer> parsePositiveInteger(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
