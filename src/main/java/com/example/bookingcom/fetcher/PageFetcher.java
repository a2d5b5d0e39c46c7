package com.example.bookingcom.fetcher;

import com.example.bookingcom.model.Page;

/**
 * Fetches one page of an endpoint from a data source.
 *
 * <p>Implementations hold only static configuration, so one instance can serve
 * any number of independent cursors.
 *
 * @param <T> the type of items in each page
 */
@FunctionalInterface
public interface PageFetcher<T> {

    /**
     * Fetches the page starting at {@code offset}.
     *
     * @param endpoint the API name of the endpoint, e.g. {@code getCountries}
     * @param offset zero-based position of the first item of the page
     * @param pageSize maximum number of items in the page
     * @return the page; empty (or {@code null}) when there is no more data
     */
    Page<T> fetch(String endpoint, long offset, int pageSize);
}
