package com.dinnerplans.restaurants.infrastructure.external;

import com.dinnerplans.restaurants.application.port.out.VenueProvider;
import com.dinnerplans.restaurants.domain.exception.ProviderConfigurationException;
import com.dinnerplans.restaurants.domain.exception.ProviderException;
import com.dinnerplans.restaurants.domain.model.Venue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the Google Places API.
 * Runs a nearby restaurant search, then a details lookup per result to backfill
 * the maps URL and a fallback photo reference.
 */
@Service
public class GooglePlacesClient implements VenueProvider {

    private static final Logger logger = LoggerFactory.getLogger(GooglePlacesClient.class);

    static final String STATUS_OK = "OK";
    static final String STATUS_ZERO_RESULTS = "ZERO_RESULTS";
    private static final int DETAILS_CONCURRENCY = 8;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final int timeoutSeconds;
    private final Duration retryDelay;

    public GooglePlacesClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        @Value("${app.google-places.api-url:https://maps.googleapis.com/maps/api/place}") String apiUrl,
        @Value("${app.google-places.api-key:}") String apiKey,
        @Value("${app.google-places.timeout-seconds:10}") int timeoutSeconds,
        @Value("${app.google-places.retry-delay:1s}") Duration retryDelay
    ) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderConfigurationException(
                "app.google-places.api-key is required (set GOOGLE_PLACES_API_KEY)");
        }
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.timeoutSeconds = timeoutSeconds;
        this.retryDelay = retryDelay;
        this.webClient = webClientBuilder
            .baseUrl(apiUrl)
            .build();
    }

    /**
     * Search restaurants near the given coordinates.
     *
     * @param lat Latitude
     * @param lng Longitude
     * @param radiusMeters Search radius in meters
     * @return Restaurants found, empty on ZERO_RESULTS
     * @throws ProviderException if the call fails or the API reports an error status
     */
    @Override
    public List<Venue> search(BigDecimal lat, BigDecimal lng, double radiusMeters) {
        String location = lat.toPlainString() + "," + lng.toPlainString();
        String radius = BigDecimal.valueOf(radiusMeters).stripTrailingZeros().toPlainString();
        logger.debug("Searching Google Places: location={}, radius={}", location, radius);

        String responseBody = get(webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/nearbysearch/json")
                .queryParam("location", location)
                .queryParam("radius", radius)
                .queryParam("type", "restaurant")
                .queryParam("key", apiKey)
                .build()));

        List<JsonNode> places = parseSearchResponse(responseBody);
        if (places.isEmpty()) {
            return List.of();
        }

        List<Venue> venues = Flux.fromIterable(places)
            .flatMapSequential(place -> fetchDetails(place.path("place_id").asText())
                .map(details -> toVenue(place, details)), DETAILS_CONCURRENCY)
            .collectList()
            .block();

        logger.info("Fetched {} restaurants from Google Places", venues != null ? venues.size() : 0);
        return venues != null ? venues : List.of();
    }

    private String get(WebClient.RequestHeadersSpec<?> request) {
        try {
            return request
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .retryWhen(Retry.fixedDelay(2, retryDelay)
                    .filter(throwable -> throwable instanceof WebClientException)
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
        } catch (WebClientResponseException e) {
            logger.error("Google Places API returned error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ProviderException("Google Places API returned " + e.getStatusCode(), e);
        } catch (WebClientException e) {
            logger.error("Failed to connect to Google Places API", e);
            throw new ProviderException("Failed to connect to Google Places API", e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error querying Google Places API", e);
            throw new ProviderException("Unexpected error querying Google Places API", e);
        }
    }

    /**
     * Parse the nearby search response and return its result elements.
     */
    private List<JsonNode> parseSearchResponse(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (Exception e) {
            logger.error("Failed to parse Google Places response", e);
            throw new ProviderException("Failed to parse Google Places response", e);
        }

        String status = root.path("status").asText("");
        if (STATUS_ZERO_RESULTS.equals(status)) {
            logger.info("Google Places returned no results");
            return List.of();
        }
        if (!STATUS_OK.equals(status)) {
            logger.error("Google Places API error status: {} ({})", status, root.path("error_message").asText(""));
            throw new ProviderException("Google Places API error: " + status, status);
        }

        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            logger.warn("Google Places response missing results array");
            return List.of();
        }

        List<JsonNode> places = new ArrayList<>();
        for (JsonNode result : results) {
            if (isUsable(result)) {
                places.add(result);
            } else {
                logger.warn("Skipping malformed place: {}", result);
            }
        }
        return places;
    }

    private boolean isUsable(JsonNode place) {
        JsonNode location = place.path("geometry").path("location");
        return place.hasNonNull("place_id")
            && place.hasNonNull("name")
            && location.path("lat").isNumber()
            && location.path("lng").isNumber();
    }

    /**
     * Look up maps URL and photos for one place. Failures are tolerated: the place is
     * kept without the backfilled fields.
     */
    private Mono<PlaceDetails> fetchDetails(String placeId) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/details/json")
                .queryParam("place_id", placeId)
                .queryParam("fields", "url,photos")
                .queryParam("key", apiKey)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .map(this::parseDetails)
            .defaultIfEmpty(PlaceDetails.EMPTY)
            .onErrorResume(e -> {
                logger.warn("Details lookup failed for place {}: {}", placeId, e.getMessage());
                return Mono.just(PlaceDetails.EMPTY);
            });
    }

    private PlaceDetails parseDetails(String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            String status = root.path("status").asText("");
            if (!STATUS_OK.equals(status)) {
                logger.debug("Details lookup returned status {}", status);
                return PlaceDetails.EMPTY;
            }
            JsonNode result = root.path("result");
            return new PlaceDetails(textOrNull(result.get("url")), firstPhotoReference(result));
        } catch (Exception e) {
            logger.warn("Failed to parse details response: {}", e.getMessage());
            return PlaceDetails.EMPTY;
        }
    }

    private Venue toVenue(JsonNode place, PlaceDetails details) {
        JsonNode location = place.path("geometry").path("location");
        Venue venue = new Venue(
            place.get("place_id").asText(),
            place.get("name").asText(),
            BigDecimal.valueOf(location.get("lat").asDouble()),
            BigDecimal.valueOf(location.get("lng").asDouble()));

        JsonNode priceLevel = place.get("price_level");
        venue.setPriceLevel(priceLevel != null && priceLevel.isNumber() ? priceLevel.asInt() : null);
        JsonNode rating = place.get("rating");
        venue.setRating(rating != null && rating.isNumber() ? rating.asDouble() : null);

        String photoRef = firstPhotoReference(place);
        venue.setPhotoRef(photoRef != null ? photoRef : details.getPhotoRef());
        venue.setMapsUrl(details.getMapsUrl());
        return venue;
    }

    private static String firstPhotoReference(JsonNode node) {
        JsonNode photos = node.get("photos");
        if (photos == null || !photos.isArray() || photos.isEmpty()) {
            return null;
        }
        return textOrNull(photos.get(0).get("photo_reference"));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }

    /**
     * Fields backfilled from the details endpoint.
     */
    @lombok.Getter
    @lombok.AllArgsConstructor
    static class PlaceDetails {
        static final PlaceDetails EMPTY = new PlaceDetails(null, null);

        private final String mapsUrl;
        private final String photoRef;
    }
}
