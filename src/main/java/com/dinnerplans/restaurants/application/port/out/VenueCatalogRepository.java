package com.dinnerplans.restaurants.application.port.out;

import com.dinnerplans.restaurants.domain.model.Venue;

import java.util.List;

/**
 * Output port for the local restaurant catalog.
 */
public interface VenueCatalogRepository {

  /**
   * Insert the venue or overwrite the mutable fields of the existing row with the same id.
   */
  int upsert(Venue venue);

  List<Venue> findAll();

  boolean existsById(String id);
}
