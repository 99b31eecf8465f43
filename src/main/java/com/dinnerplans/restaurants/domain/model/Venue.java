package com.dinnerplans.restaurants.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Restaurant record sourced from the places provider and kept in the local catalog.
 * Identity is the provider's place id.
 */
@Entity
@Table(name = "restaurant")
@Getter
@Setter
@NoArgsConstructor
public class Venue {

    @Id
    @Column(name = "id", nullable = false, length = 255)
    private String id;

    @Column(name = "name", nullable = false, length = 500)
    private String name;

    @Column(name = "price_level")
    private Integer priceLevel;

    @Column(name = "rating")
    private Double rating;

    @Column(name = "lat", nullable = false, precision = 9, scale = 6)
    private BigDecimal lat;

    @Column(name = "lng", nullable = false, precision = 9, scale = 6)
    private BigDecimal lng;

    @Column(name = "photo_ref", length = 1000)
    private String photoRef;

    @Column(name = "maps_url", length = 1000)
    private String mapsUrl;

    @JsonIgnore
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @JsonIgnore
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public Venue(String id, String name, BigDecimal lat, BigDecimal lng) {
        this.id = id;
        this.name = name;
        this.lat = lat;
        this.lng = lng;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = OffsetDateTime.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
