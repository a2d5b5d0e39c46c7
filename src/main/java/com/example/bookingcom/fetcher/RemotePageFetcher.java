package com.example.bookingcom.fetcher;

import com.example.bookingcom.exception.HttpStatusException;
import com.example.bookingcom.exception.PageFetchException;
import com.example.bookingcom.model.ApiRecord;
import com.example.bookingcom.model.Page;
import com.example.bookingcom.parser.XmlPageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Fetches pages from the live booking.com XML API.
 *
 * <p>Each page is one authenticated POST to {@code <baseUrl>bookings.<endpoint>}
 * carrying {@code offset} and {@code rows} query parameters. Any non-2xx
 * response fails the fetch; there is no retry.
 *
 * <p>Example usage:
 * <pre>{@code
 * RemotePageFetcher fetcher = new RemotePageFetcher(
 *     RemotePageFetcher.DEFAULT_BASE_URL, "user", "secret"
 * );
 * Page<ApiRecord> countries = fetcher.fetch("getCountries", 0, 1000);
 * }</pre>
 */
public class RemotePageFetcher implements PageFetcher<ApiRecord> {

    private static final Logger log = LoggerFactory.getLogger(RemotePageFetcher.class);

    public static final String DEFAULT_BASE_URL = "http://distribution-xml.booking.com/xml/";

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final XmlPageParser parser;
    private final String baseUrl;
    private final String authorization;
    private final Duration requestTimeout;

    /**
     * Creates a fetcher with default timeouts.
     *
     * @param baseUrl API base URL ending with a slash; {@code null} for {@link #DEFAULT_BASE_URL}
     * @param username API user, or {@code null} to send no credentials
     * @param password API password
     */
    public RemotePageFetcher(String baseUrl, String username, String password) {
        this(baseUrl, username, password, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    public RemotePageFetcher(
            String baseUrl,
            String username,
            String password,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        this(
                HttpClient.newBuilder().connectTimeout(connectTimeout).build(),
                new XmlPageParser(),
                baseUrl,
                username,
                password,
                requestTimeout
        );
    }

    /**
     * Creates a fetcher with a pre-configured HttpClient and parser.
     */
    public RemotePageFetcher(
            HttpClient httpClient,
            XmlPageParser parser,
            String baseUrl,
            String username,
            String password,
            Duration requestTimeout
    ) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.baseUrl = baseUrl != null ? baseUrl : DEFAULT_BASE_URL;
        this.authorization = username != null ? basicAuth(username, password) : null;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Builds the request URL of an endpoint, without query parameters.
     *
     * @param baseUrl API base URL ending with a slash
     * @param endpoint API name of the endpoint
     * @return e.g. {@code http://distribution-xml.booking.com/xml/bookings.getCountries}
     */
    public static String createUrl(String baseUrl, String endpoint) {
        return baseUrl + "bookings." + endpoint;
    }

    @Override
    public Page<ApiRecord> fetch(String endpoint, long offset, int pageSize) {
        URI uri = URI.create(createUrl(baseUrl, endpoint) + "?offset=" + offset + "&rows=" + pageSize);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/xml")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.noBody());
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }

        log.debug("POST {}", uri);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new PageFetchException(endpoint, offset, "Failed to fetch " + endpoint + " at offset " + offset, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(endpoint, offset, "Interrupted fetching " + endpoint + " at offset " + offset, e);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            throw new HttpStatusException(endpoint, offset, statusCode);
        }

        return Page.of(parser.parse(endpoint, response.body()));
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private static String basicAuth(String username, String password) {
        String credentials = username + ":" + (password != null ? password : "");
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
