package com.dinnerplans.restaurants.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Cached value with its creation time. Mutable bean so the Redis JSON serializer can read it back.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry<V> {

    private V value;

    private long createdAtEpochMillis;

    public Instant createdAt() {
        return Instant.ofEpochMilli(createdAtEpochMillis);
    }
}
