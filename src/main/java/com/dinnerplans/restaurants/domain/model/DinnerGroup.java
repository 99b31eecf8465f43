package com.dinnerplans.restaurants.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * The group of users having dinner at one restaurant. At most one exists per restaurant.
 * Groups are created on first join and are not removed when they empty out.
 */
@Entity
@Table(name = "dinner_group", uniqueConstraints = {
        @UniqueConstraint(name = "uq_dinner_group_restaurant", columnNames = "restaurant_id")
})
@Getter
@Setter
@NoArgsConstructor
public class DinnerGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "restaurant_id", nullable = false, length = 255)
    private String restaurantId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public DinnerGroup(String restaurantId) {
        this.restaurantId = restaurantId;
        this.createdAt = OffsetDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }
}
