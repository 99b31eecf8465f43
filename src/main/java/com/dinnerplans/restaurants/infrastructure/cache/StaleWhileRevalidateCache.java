package com.dinnerplans.restaurants.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Cached fetch with stale-while-revalidate semantics on top of a Spring {@link Cache}.
 *
 * <ul>
 *   <li>fresh entry: returned as is</li>
 *   <li>stale entry still inside the stale window: returned immediately, refreshed in the background</li>
 *   <li>no entry, or too old: the caller blocks on a fresh load</li>
 * </ul>
 *
 * Loads are single-flighted per key: concurrent callers share one in-flight load.
 * A failed load never touches the stored entry, so a stale value stays servable.
 * Failures of the cache backend itself are treated as misses.
 */
public class StaleWhileRevalidateCache<V> {

    private static final Logger logger = LoggerFactory.getLogger(StaleWhileRevalidateCache.class);

    private final Cache cache;
    private final CachePolicy policy;
    private final Executor revalidationExecutor;
    private final Clock clock;
    private final ConcurrentMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public StaleWhileRevalidateCache(Cache cache, CachePolicy policy, Executor revalidationExecutor, Clock clock) {
        this.cache = cache;
        this.policy = policy;
        this.revalidationExecutor = revalidationExecutor;
        this.clock = clock;
    }

    /**
     * Get the value for a key, loading it with {@code loader} when needed.
     *
     * @throws RuntimeException whatever the loader threw, when a blocking load fails
     */
    public V get(String key, Supplier<V> loader) {
        Optional<CacheEntry<V>> cached = read(key);

        if (cached.isPresent()) {
            CacheEntry<V> entry = cached.get();
            Duration age = ageOf(entry);

            if (age.compareTo(policy.getTtl()) <= 0) {
                logger.debug("Cache hit for {}:{}", policy.getCacheName(), key);
                return entry.getValue();
            }
            if (age.compareTo(policy.maxAge()) <= 0) {
                logger.debug("Serving stale entry for {}:{} (age {}), revalidating", policy.getCacheName(), key, age);
                revalidateInBackground(key, loader);
                return entry.getValue();
            }
            logger.debug("Cache entry for {}:{} expired (age {})", policy.getCacheName(), key, age);
        } else {
            logger.debug("Cache miss for {}:{}", policy.getCacheName(), key);
        }

        return await(load(key, loader, Runnable::run));
    }

    /**
     * Number of loads currently running.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private void revalidateInBackground(String key, Supplier<V> loader) {
        load(key, loader, revalidationExecutor).whenComplete((value, error) -> {
            if (error != null) {
                logger.warn("Background refresh of {}:{} failed, keeping stale entry: {}",
                        policy.getCacheName(), key, unwrap(error).getMessage());
            }
        });
    }

    /**
     * Start a load for the key unless one is already running, in which case that one is returned.
     */
    private CompletableFuture<V> load(String key, Supplier<V> loader, Executor executor) {
        CompletableFuture<V> created = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            logger.debug("Joining in-flight load for {}:{}", policy.getCacheName(), key);
            return existing;
        }

        Runnable task = () -> {
            try {
                // A load that finished between our read and registering this one leaves a fresh entry
                Optional<CacheEntry<V>> current = read(key);
                if (current.isPresent() && ageOf(current.get()).compareTo(policy.getTtl()) <= 0) {
                    logger.debug("Entry for {}:{} refreshed concurrently, skipping load", policy.getCacheName(), key);
                    created.complete(current.get().getValue());
                    return;
                }
                V value = loader.get();
                write(key, value);
                created.complete(value);
            } catch (Throwable e) {
                created.completeExceptionally(e);
            } finally {
                inFlight.remove(key, created);
            }
        };

        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, created);
            created.completeExceptionally(e);
        }
        return created;
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Cache load failed for " + policy.getCacheName(), cause);
        }
    }

    private Duration ageOf(CacheEntry<V> entry) {
        return Duration.between(entry.createdAt(), clock.instant());
    }

    private Optional<CacheEntry<V>> read(String key) {
        try {
            Cache.ValueWrapper wrapper = cache.get(key);
            if (wrapper != null && wrapper.get() instanceof CacheEntry<?> entry) {
                @SuppressWarnings("unchecked")
                CacheEntry<V> typed = (CacheEntry<V>) entry;
                return Optional.of(typed);
            }
        } catch (Exception e) {
            logger.warn("Failed to read {} cache, continuing without cache: {}", policy.getCacheName(), e.getMessage());
        }
        return Optional.empty();
    }

    private void write(String key, V value) {
        try {
            cache.put(key, new CacheEntry<>(value, clock.millis()));
            logger.debug("Cache populated for {}:{}", policy.getCacheName(), key);
        } catch (Exception e) {
            logger.warn("Failed to populate {} cache, continuing without cache: {}", policy.getCacheName(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
