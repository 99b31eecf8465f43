package com.dinnerplans.restaurants.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantResponseDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("priceLevel")
    private Integer priceLevel;

    @JsonProperty("rating")
    private Double rating;

    @JsonProperty("lat")
    private BigDecimal lat;

    @JsonProperty("lng")
    private BigDecimal lng;

    @JsonProperty("photoRef")
    private String photoRef;

    @JsonProperty("mapsUrl")
    private String mapsUrl;

    @JsonProperty("distance")
    private double distance;

    @JsonProperty("attendeeCount")
    private long attendeeCount;

    @JsonProperty("isUserAttending")
    private boolean userAttending;
}
