package com.dinnerplans.restaurants.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Membership of a user in a dinner group. A user has at most one row.
 */
@Entity
@Table(name = "attendee", uniqueConstraints = {
        @UniqueConstraint(name = "uq_attendee_user", columnNames = "user_id")
}, indexes = {
        @Index(name = "idx_attendee_dinner_group", columnList = "dinner_group_id")
})
@Getter
@Setter
@NoArgsConstructor
public class Attendee {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 255)
    private String userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "dinner_group_id", nullable = false)
    private DinnerGroup dinnerGroup;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public Attendee(String userId, DinnerGroup dinnerGroup) {
        this.userId = userId;
        this.dinnerGroup = dinnerGroup;
        this.createdAt = OffsetDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }
}
