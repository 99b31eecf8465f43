package com.dinnerplans.restaurants.infrastructure.cache;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Freshness policy of one cache: entries are fresh for {@code ttl}, then may still be
 * served for {@code staleWhileRevalidate} while a refresh runs in the background.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CachePolicy {
    private final String cacheName;
    private final Duration ttl;
    private final Duration staleWhileRevalidate;

    public CachePolicy(String cacheName, Duration ttl, Duration staleWhileRevalidate) {
        if (ttl.isNegative() || staleWhileRevalidate.isNegative()) {
            throw new IllegalArgumentException("Cache durations must not be negative");
        }
        this.cacheName = cacheName;
        this.ttl = ttl;
        this.staleWhileRevalidate = staleWhileRevalidate;
    }

    /**
     * Age after which an entry can no longer be served at all.
     */
    public Duration maxAge() {
        return ttl.plus(staleWhileRevalidate);
    }
}
