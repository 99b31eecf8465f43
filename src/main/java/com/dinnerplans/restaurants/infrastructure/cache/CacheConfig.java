package com.dinnerplans.restaurants.infrastructure.cache;

import com.dinnerplans.restaurants.domain.model.Venue;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Cache configuration using Redis (distributed cache).
 *
 * Two restaurant caches with their own freshness policies:
 * - providerRestaurants: places provider search results, keyed by exact lat/lng/radius
 * - catalogRestaurants: snapshot of the whole local catalog
 *
 * Redis only evicts an entry once it is past its stale window; freshness itself is
 * decided by {@link StaleWhileRevalidateCache}.
 */
@Configuration
public class CacheConfig {

    public static final String PROVIDER_RESTAURANTS = "providerRestaurants";
    public static final String CATALOG_RESTAURANTS = "catalogRestaurants";

    @Value("${app.cache.provider-restaurants.ttl:30m}")
    private Duration providerTtl;

    @Value("${app.cache.provider-restaurants.stale-while-revalidate:24h}")
    private Duration providerStaleWindow;

    @Value("${app.cache.catalog-restaurants.ttl:5m}")
    private Duration catalogTtl;

    @Value("${app.cache.catalog-restaurants.stale-while-revalidate:30m}")
    private Duration catalogStaleWindow;

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory redisConnectionFactory) {
        RedisCacheConfiguration cacheConfig = RedisCacheConfiguration.defaultCacheConfig()
            .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(new GenericJackson2JsonRedisSerializer()))
            .disableCachingNullValues();

        return RedisCacheManager.builder(redisConnectionFactory)
            .cacheDefaults(cacheConfig)
            .withCacheConfiguration(PROVIDER_RESTAURANTS, cacheConfig.entryTtl(providerPolicy().maxAge()))
            .withCacheConfiguration(CATALOG_RESTAURANTS, cacheConfig.entryTtl(catalogPolicy().maxAge()))
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StaleWhileRevalidateCache<List<Venue>> providerRestaurantCache(
            CacheManager cacheManager,
            @Qualifier("cacheRevalidationExecutor") Executor executor,
            Clock clock) {
        return new StaleWhileRevalidateCache<>(requireCache(cacheManager, PROVIDER_RESTAURANTS), providerPolicy(), executor, clock);
    }

    @Bean
    public StaleWhileRevalidateCache<List<Venue>> catalogRestaurantCache(
            CacheManager cacheManager,
            @Qualifier("cacheRevalidationExecutor") Executor executor,
            Clock clock) {
        return new StaleWhileRevalidateCache<>(requireCache(cacheManager, CATALOG_RESTAURANTS), catalogPolicy(), executor, clock);
    }

    private CachePolicy providerPolicy() {
        return new CachePolicy(PROVIDER_RESTAURANTS, providerTtl, providerStaleWindow);
    }

    private CachePolicy catalogPolicy() {
        return new CachePolicy(CATALOG_RESTAURANTS, catalogTtl, catalogStaleWindow);
    }

    private static Cache requireCache(CacheManager cacheManager, String name) {
        Cache cache = cacheManager.getCache(name);
        if (cache == null) {
            throw new IllegalStateException("Cache not configured: " + name);
        }
        return cache;
    }
}
