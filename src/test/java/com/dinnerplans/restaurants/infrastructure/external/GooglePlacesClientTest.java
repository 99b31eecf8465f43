package com.dinnerplans.restaurants.infrastructure.external;

import com.dinnerplans.restaurants.domain.exception.ProviderConfigurationException;
import com.dinnerplans.restaurants.domain.exception.ProviderException;
import com.dinnerplans.restaurants.domain.model.Venue;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.dinnerplans.restaurants.module.test.support.TestFixtures.Coordinates.CENTER_LAT;
import static com.dinnerplans.restaurants.module.test.support.TestFixtures.Coordinates.CENTER_LNG;
import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GooglePlacesClientTest {

    private static final String API_KEY = "test-api-key";
    private static final double RADIUS_METERS = 8046.7;

    private WireMockServer wireMockServer;
    private GooglePlacesClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        client = newClient(API_KEY);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    private GooglePlacesClient newClient(String apiKey) {
        return new GooglePlacesClient(
                WebClient.builder(),
                new ObjectMapper(),
                wireMockServer.baseUrl(),
                apiKey,
                2,
                Duration.ofMillis(10));
    }

    @Test
    void searchMapsResultsAndBackfillsDetails() {
        wireMockServer.stubFor(get(urlPathEqualTo("/nearbysearch/json"))
                .withQueryParam("location", equalTo("40.7596,-111.8867"))
                .withQueryParam("radius", equalTo("8046.7"))
                .withQueryParam("type", equalTo("restaurant"))
                .withQueryParam("key", equalTo(API_KEY))
                .willReturn(okJson("""
                        {
                          "status": "OK",
                          "results": [
                            {
                              "place_id": "place-1",
                              "name": "Red Iguana",
                              "rating": 4.6,
                              "price_level": 2,
                              "geometry": {"location": {"lat": 40.7718, "lng": -111.9124}},
                              "photos": [{"photo_reference": "search-photo-1"}]
                            },
                            {
                              "place_id": "place-2",
                              "name": "Takashi",
                              "geometry": {"location": {"lat": 40.7626, "lng": -111.8910}}
                            }
                          ]
                        }
                        """)));
        stubDetails("place-1", """
                {"status": "OK", "result": {"url": "https://maps.google.com/?cid=1",
                  "photos": [{"photo_reference": "details-photo-1"}]}}
                """);
        stubDetails("place-2", """
                {"status": "OK", "result": {"url": "https://maps.google.com/?cid=2",
                  "photos": [{"photo_reference": "details-photo-2"}]}}
                """);

        List<Venue> venues = client.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS);

        assertThat(venues).extracting(Venue::getId).containsExactly("place-1", "place-2");

        Venue first = venues.get(0);
        assertThat(first.getName()).isEqualTo("Red Iguana");
        assertThat(first.getRating()).isEqualTo(4.6);
        assertThat(first.getPriceLevel()).isEqualTo(2);
        assertThat(first.getLat()).isEqualByComparingTo(new BigDecimal("40.7718"));
        assertThat(first.getLng()).isEqualByComparingTo(new BigDecimal("-111.9124"));
        assertThat(first.getPhotoRef()).isEqualTo("search-photo-1");
        assertThat(first.getMapsUrl()).isEqualTo("https://maps.google.com/?cid=1");

        Venue second = venues.get(1);
        assertThat(second.getRating()).isNull();
        assertThat(second.getPriceLevel()).isNull();
        assertThat(second.getPhotoRef()).isEqualTo("details-photo-2");
    }

    @Test
    void zeroResultsIsAnEmptyList() {
        stubSearch("""
                {"status": "ZERO_RESULTS", "results": []}
                """);

        assertThat(client.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS)).isEmpty();
        wireMockServer.verify(0, getRequestedFor(urlPathEqualTo("/details/json")));
    }

    @Test
    void errorStatusRaisesProviderException() {
        stubSearch("""
                {"status": "REQUEST_DENIED", "error_message": "The provided API key is invalid.", "results": []}
                """);

        assertThatThrownBy(() -> client.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS))
                .isInstanceOf(ProviderException.class)
                .hasFieldOrPropertyWithValue("status", "REQUEST_DENIED");
    }

    @Test
    void serverErrorsAreRetriedTwiceThenFail() {
        wireMockServer.stubFor(get(urlPathEqualTo("/nearbysearch/json"))
                .willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS))
                .isInstanceOf(ProviderException.class);
        wireMockServer.verify(3, getRequestedFor(urlPathEqualTo("/nearbysearch/json")));
    }

    @Test
    void failedDetailsLookupKeepsThePlace() {
        stubSearch("""
                {"status": "OK", "results": [
                  {"place_id": "place-1", "name": "Lone Star Taqueria",
                   "geometry": {"location": {"lat": 40.7, "lng": -111.8}}}
                ]}
                """);
        wireMockServer.stubFor(get(urlPathEqualTo("/details/json"))
                .willReturn(aResponse().withStatus(500)));

        List<Venue> venues = client.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS);

        assertThat(venues).hasSize(1);
        assertThat(venues.get(0).getMapsUrl()).isNull();
        assertThat(venues.get(0).getPhotoRef()).isNull();
    }

    @Test
    void malformedResultsAreSkipped() {
        stubSearch("""
                {"status": "OK", "results": [
                  {"name": "No Id", "geometry": {"location": {"lat": 40.7, "lng": -111.8}}},
                  {"place_id": "no-location", "name": "Nowhere"},
                  {"place_id": "place-ok", "name": "Valid", "geometry": {"location": {"lat": 40.7, "lng": -111.8}}}
                ]}
                """);
        stubDetails("place-ok", """
                {"status": "NOT_FOUND"}
                """);

        assertThat(client.search(CENTER_LAT, CENTER_LNG, RADIUS_METERS))
                .extracting(Venue::getId)
                .containsExactly("place-ok");
    }

    @Test
    void missingApiKeyFailsAtConstruction() {
        assertThatThrownBy(() -> newClient(""))
                .isInstanceOf(ProviderConfigurationException.class);
        assertThatThrownBy(() -> newClient(null))
                .isInstanceOf(ProviderConfigurationException.class);
    }

    private void stubSearch(String body) {
        wireMockServer.stubFor(get(urlPathEqualTo("/nearbysearch/json")).willReturn(okJson(body)));
    }

    private void stubDetails(String placeId, String body) {
        wireMockServer.stubFor(get(urlPathEqualTo("/details/json"))
                .withQueryParam("place_id", equalTo(placeId))
                .withQueryParam("fields", equalTo("url,photos"))
                .willReturn(okJson(body)));
    }
}
