package com.dinnerplans.restaurants.domain.service;

import com.dinnerplans.restaurants.domain.model.Coordinates;
import org.springframework.stereotype.Service;

/**
 * Domain service computing great-circle distances.
 *
 * Haversine formula on a sphere of radius 3958.8 miles, rounded to one decimal place
 * by {@link Math#round(double)} on tenths of a mile.
 */
@Service
public class DistanceCalculator {

    static final double EARTH_RADIUS_MILES = 3958.8;

    public double distanceMiles(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return roundToTenth(EARTH_RADIUS_MILES * c);
    }

    static double roundToTenth(double miles) {
        return Math.round(miles * 10) / 10.0;
    }

    public double distanceMiles(Coordinates from, Coordinates to) {
        return distanceMiles(
                from.getLat().doubleValue(), from.getLng().doubleValue(),
                to.getLat().doubleValue(), to.getLng().doubleValue());
    }
}
