package com.dinnerplans.restaurants.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantListResponseDto {

    @JsonProperty("attending")
    private List<RestaurantResponseDto> attending;

    @JsonProperty("candidates")
    private List<RestaurantResponseDto> candidates;

    @JsonProperty("filters")
    private FiltersDto filters;

    /**
     * Filters as they were applied; unparseable request values show up as absent.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FiltersDto {
        @JsonProperty("distance")
        private Double distance;

        @JsonProperty("rating")
        private Double rating;

        @JsonProperty("price")
        private Integer price;
    }
}
