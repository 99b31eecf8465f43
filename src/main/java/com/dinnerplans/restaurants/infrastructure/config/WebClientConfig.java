package com.dinnerplans.restaurants.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the places provider.
 *
 * Nearby search responses with full result pages exceed the default 256KB buffer.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE_BYTES = 2 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE_BYTES));
    }
}
