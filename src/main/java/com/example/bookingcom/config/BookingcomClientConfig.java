package com.example.bookingcom.config;

import com.example.bookingcom.client.FetcherStrategy;
import com.example.bookingcom.fetcher.RemotePageFetcher;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Settings shared by every endpoint of a {@link com.example.bookingcom.client.BookingcomClient}.
 *
 * <p>Only the settings of the chosen {@link FetcherStrategy} are used: the data
 * directory for {@code FILESYSTEM}; base URL, credentials and timeouts for
 * {@code REMOTE}.
 *
 * <p>Example usage:
 * <pre>{@code
 * BookingcomClientConfig config = BookingcomClientConfig.builder()
 *     .fetcherStrategy(FetcherStrategy.REMOTE)
 *     .username("user")
 *     .password("secret")
 *     .defaultPageSize(500)
 *     .build();
 * }</pre>
 *
 * @param fetcherStrategy where pages come from
 * @param dataDirectory root of the pre-fetched page files
 * @param baseUrl API base URL, ending with a slash
 * @param username API user, or {@code null}
 * @param password API password, or {@code null}
 * @param defaultPageSize rows per page when an accessor is called without one
 * @param connectTimeout HTTP connect timeout
 * @param requestTimeout HTTP request timeout
 */
public record BookingcomClientConfig(
        FetcherStrategy fetcherStrategy,
        Path dataDirectory,
        String baseUrl,
        String username,
        String password,
        int defaultPageSize,
        Duration connectTimeout,
        Duration requestTimeout
) {

    public static final int DEFAULT_PAGE_SIZE = 1000;

    public static final Path DEFAULT_DATA_DIRECTORY = Path.of(System.getProperty("java.io.tmpdir"), "bookingcom");

    public static final String FETCHER_KEY = "bookingcom.fetcher";
    public static final String DATA_DIR_KEY = "bookingcom.dataDir";
    public static final String BASE_URL_KEY = "bookingcom.baseUrl";
    public static final String USERNAME_KEY = "bookingcom.username";
    public static final String PASSWORD_KEY = "bookingcom.password";
    public static final String ROWS_KEY = "bookingcom.rows";
    public static final String CONNECT_TIMEOUT_KEY = "bookingcom.connectTimeoutSeconds";
    public static final String REQUEST_TIMEOUT_KEY = "bookingcom.requestTimeoutSeconds";

    public BookingcomClientConfig {
        Objects.requireNonNull(fetcherStrategy, "fetcherStrategy");
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (defaultPageSize <= 0) {
            throw new IllegalArgumentException("defaultPageSize must be positive: " + defaultPageSize);
        }
    }

    /**
     * Returns the default configuration: filesystem pages under
     * {@link #DEFAULT_DATA_DIRECTORY}, 1000 rows per page.
     */
    public static BookingcomClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from key/value settings. Missing keys keep their defaults.
     *
     * @param source settings source
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be interpreted
     */
    public static BookingcomClientConfig from(ClientConfiguration source) {
        Builder builder = builder();
        if (source.has(FETCHER_KEY)) {
            builder.fetcherStrategy(parseStrategy(source.get(FETCHER_KEY)));
        }
        if (source.has(DATA_DIR_KEY)) {
            builder.dataDirectory(Path.of(source.get(DATA_DIR_KEY)));
        }
        builder.baseUrl(source.get(BASE_URL_KEY, RemotePageFetcher.DEFAULT_BASE_URL));
        builder.username(source.get(USERNAME_KEY));
        builder.password(source.get(PASSWORD_KEY));
        if (source.has(ROWS_KEY)) {
            builder.defaultPageSize(parseInt(ROWS_KEY, source.get(ROWS_KEY)));
        }
        if (source.has(CONNECT_TIMEOUT_KEY)) {
            builder.connectTimeout(Duration.ofSeconds(parseInt(CONNECT_TIMEOUT_KEY, source.get(CONNECT_TIMEOUT_KEY))));
        }
        if (source.has(REQUEST_TIMEOUT_KEY)) {
            builder.requestTimeout(Duration.ofSeconds(parseInt(REQUEST_TIMEOUT_KEY, source.get(REQUEST_TIMEOUT_KEY))));
        }
        return builder.build();
    }

    private static FetcherStrategy parseStrategy(String value) {
        try {
            return FetcherStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + FETCHER_KEY + ": " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "BookingcomClientConfig[fetcherStrategy=" + fetcherStrategy
                + ", dataDirectory=" + dataDirectory
                + ", baseUrl=" + baseUrl
                + ", username=" + username
                + ", password=" + (password != null ? "****" : null)
                + ", defaultPageSize=" + defaultPageSize
                + ", connectTimeout=" + connectTimeout
                + ", requestTimeout=" + requestTimeout + "]";
    }

    /**
     * Builder for {@link BookingcomClientConfig}.
     */
    public static final class Builder {

        private FetcherStrategy fetcherStrategy = FetcherStrategy.FILESYSTEM;
        private Path dataDirectory = DEFAULT_DATA_DIRECTORY;
        private String baseUrl = RemotePageFetcher.DEFAULT_BASE_URL;
        private String username;
        private String password;
        private int defaultPageSize = DEFAULT_PAGE_SIZE;
        private Duration connectTimeout = RemotePageFetcher.DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = RemotePageFetcher.DEFAULT_REQUEST_TIMEOUT;

        private Builder() {
        }

        public Builder fetcherStrategy(FetcherStrategy fetcherStrategy) {
            this.fetcherStrategy = fetcherStrategy;
            return this;
        }

        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder defaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public BookingcomClientConfig build() {
            return new BookingcomClientConfig(
                    fetcherStrategy,
                    dataDirectory,
                    baseUrl,
                    username,
                    password,
                    defaultPageSize,
                    connectTimeout,
                    requestTimeout
            );
        }
    }
}
