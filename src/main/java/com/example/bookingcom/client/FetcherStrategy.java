package com.example.bookingcom.client;

import com.example.bookingcom.config.BookingcomClientConfig;
import com.example.bookingcom.fetcher.FilesystemPageFetcher;
import com.example.bookingcom.fetcher.PageFetcher;
import com.example.bookingcom.fetcher.RemotePageFetcher;
import com.example.bookingcom.model.ApiRecord;

/**
 * Where a {@link BookingcomClient} reads its pages from.
 */
public enum FetcherStrategy {

    /**
     * Pre-fetched page files under {@link BookingcomClientConfig#dataDirectory()}.
     */
    FILESYSTEM {
        @Override
        public PageFetcher<ApiRecord> createFetcher(BookingcomClientConfig config) {
            return new FilesystemPageFetcher(config.dataDirectory());
        }
    },

    /**
     * The live API at {@link BookingcomClientConfig#baseUrl()}.
     */
    REMOTE {
        @Override
        public PageFetcher<ApiRecord> createFetcher(BookingcomClientConfig config) {
            return new RemotePageFetcher(
                    config.baseUrl(),
                    config.username(),
                    config.password(),
                    config.connectTimeout(),
                    config.requestTimeout()
            );
        }
    };

    /**
     * Builds the fetcher this strategy stands for.
     *
     * @param config client settings; only those relevant to the strategy are read
     * @return a fetcher that can be shared by all endpoints
     */
    public abstract PageFetcher<ApiRecord> createFetcher(BookingcomClientConfig config);
}
