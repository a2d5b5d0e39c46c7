package com.example.bookingcom.client;

import com.example.bookingcom.config.BookingcomClientConfig;
import com.example.bookingcom.exception.HttpStatusException;
import com.example.bookingcom.model.ApiRecord;
import com.example.bookingcom.server.FakeBookingServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the REMOTE strategy against a local {@link FakeBookingServer}.
 *
 * <h2>Test Server</h2>
 * <p>A real HTTP server built with JDK's {@code com.sun.net.httpserver.HttpServer}.
 * No mocking frameworks needed.</p>
 */
class BookingcomClientIntegrationTest {

    private FakeBookingServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private BookingcomClient remoteClient() {
        return new BookingcomClient(BookingcomClientConfig.builder()
                .fetcherStrategy(FetcherStrategy.REMOTE)
                .baseUrl(server.getBaseUrl())
                .username("user")
                .password("secret")
                .build());
    }

    @Test
    @DisplayName("Should fetch 5 countries in 2 requests with 3 rows per page")
    void shouldFetchAllCountries() {
        // Given
        server = FakeBookingServer.create(5);
        server.start();

        // When
        List<String> codes = remoteClient().getCountries(3).stream()
                .map(country -> country.getString("countrycode"))
                .collect(Collectors.toList());

        // Then
        assertThat(codes).isEqualTo(server.getCountryCodes());
        assertThat(server.getRequests()).extracting(request -> request.params().get("offset"))
                .containsExactly("0", "3");
    }

    @Test
    @DisplayName("Should stop after one empty request when pages are full")
    void shouldStopAfterEmptyPage() {
        server = FakeBookingServer.create(3);
        server.start();

        List<ApiRecord> countries = new ArrayList<>();
        remoteClient().getCountries(3).forEach(countries::add);

        assertThat(countries).hasSize(3);
        assertThat(server.getRequests()).hasSize(2);
    }

    @Test
    @DisplayName("Should page through many rows with the configured default")
    void shouldUseDefaultPageSize() {
        server = FakeBookingServer.create(2500);
        server.start();

        long count = remoteClient().getCountries().stream().count();

        assertThat(count).isEqualTo(2500);
        assertThat(server.getRequests()).extracting(request -> request.params().get("rows"))
                .containsOnly("1000");
        assertThat(server.getRequests()).hasSize(3);
    }

    @Test
    @DisplayName("Should abort iteration on an HTTP error")
    void shouldAbortOnHttpError() {
        server = FakeBookingServer.create(5);
        server.start();
        Iterator<ApiRecord> countries = remoteClient().getCountries(3).iterator();

        // Given: the first page was served
        countries.next();
        countries.next();

        // When: the look-ahead for the second page fails
        server.failWith(500);

        // Then
        assertThatThrownBy(countries::next)
                .isInstanceOf(HttpStatusException.class)
                .satisfies(e -> assertThat(((HttpStatusException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    @DisplayName("Should report unknown server paths as HTTP errors")
    void shouldFailForEndpointMissingOnServer() {
        server = FakeBookingServer.create(5);
        server.start();

        assertThatThrownBy(() -> remoteClient().getHotels().iterator().hasNext())
                .isInstanceOf(HttpStatusException.class)
                .hasMessageContaining("404");
    }
}
