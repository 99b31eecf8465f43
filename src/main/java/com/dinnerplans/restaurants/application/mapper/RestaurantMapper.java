package com.dinnerplans.restaurants.application.mapper;

import com.dinnerplans.restaurants.api.dto.RestaurantListResponseDto;
import com.dinnerplans.restaurants.api.dto.RestaurantResponseDto;
import com.dinnerplans.restaurants.domain.model.AggregatedVenue;
import com.dinnerplans.restaurants.domain.model.RestaurantListing;
import com.dinnerplans.restaurants.domain.model.VenueFilters;
import org.springframework.stereotype.Component;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class RestaurantMapper {

  public RestaurantResponseDto toDto(AggregatedVenue venue) {
    return new RestaurantResponseDto(
        venue.getId(),
        venue.getName(),
        venue.getPriceLevel(),
        venue.getRating(),
        venue.getLat(),
        venue.getLng(),
        venue.getPhotoRef(),
        venue.getMapsUrl(),
        venue.getDistanceMiles(),
        venue.getAttendeeCount(),
        venue.isUserAttending());
  }

  public RestaurantListResponseDto toDto(RestaurantListing listing, VenueFilters filters) {
    return new RestaurantListResponseDto(
        listing.getAttending().stream().map(this::toDto).toList(),
        listing.getCandidates().stream().map(this::toDto).toList(),
        new RestaurantListResponseDto.FiltersDto(
            filters.getDistanceMiles(),
            filters.getMinRating(),
            filters.getPriceLevel()));
  }
}
