package com.dinnerplans.restaurants.application.port.out;

import com.dinnerplans.restaurants.domain.model.Venue;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output port for the external places provider.
 */
public interface VenueProvider {

  /**
   * Search restaurants around a point.
   *
   * @param lat Latitude of the search center
   * @param lng Longitude of the search center
   * @param radiusMeters Search radius in meters
   * @return Venues found, empty when the provider reports zero results
   * @throws com.dinnerplans.restaurants.domain.exception.ProviderException on any other provider status
   */
  List<Venue> search(BigDecimal lat, BigDecimal lng, double radiusMeters);
}
