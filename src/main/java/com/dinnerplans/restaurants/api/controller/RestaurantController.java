package com.dinnerplans.restaurants.api.controller;

import com.dinnerplans.restaurants.api.dto.RestaurantListResponseDto;
import com.dinnerplans.restaurants.application.mapper.RestaurantMapper;
import com.dinnerplans.restaurants.application.port.in.FindRestaurantsUseCase;
import com.dinnerplans.restaurants.domain.model.RestaurantListing;
import com.dinnerplans.restaurants.domain.model.VenueFilters;
import com.dinnerplans.restaurants.infrastructure.security.UserIdentityFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for the restaurant listing.
 * Attendance is always read live; restaurant data comes through the restaurant caches.
 */
@RestController
@RequestMapping("/restaurants")
public class RestaurantController {

    private static final Logger logger = LoggerFactory.getLogger(RestaurantController.class);

    private final FindRestaurantsUseCase findRestaurantsUseCase;
    private final RestaurantMapper restaurantMapper;

    public RestaurantController(FindRestaurantsUseCase findRestaurantsUseCase, RestaurantMapper restaurantMapper) {
        this.findRestaurantsUseCase = findRestaurantsUseCase;
        this.restaurantMapper = restaurantMapper;
    }

    /**
     * GET /restaurants?distance=X&rating=Y&price=Z
     *
     * Filters are optional and lenient: values that do not parse are ignored.
     *
     * @param userId Caller, resolved by {@link UserIdentityFilter}
     * @return Restaurants with dinner groups, and ranked candidates
     */
    @GetMapping
    public ResponseEntity<RestaurantListResponseDto> getRestaurants(
            @RequestAttribute(UserIdentityFilter.USER_ID_ATTRIBUTE) String userId,
            @RequestParam(name = "distance", required = false) String distance,
            @RequestParam(name = "rating", required = false) String rating,
            @RequestParam(name = "price", required = false) String price) {
        logger.info("Listing restaurants: user={}, distance={}, rating={}, price={}", userId, distance, rating, price);

        VenueFilters filters = VenueFilters.parse(distance, rating, price);
        RestaurantListing listing = findRestaurantsUseCase.findRestaurants(userId, filters);
        return ResponseEntity.ok(restaurantMapper.toDto(listing, filters));
    }
}
