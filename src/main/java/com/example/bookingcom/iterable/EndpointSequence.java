package com.example.bookingcom.iterable;

import com.example.bookingcom.fetcher.PageFetcher;
import reactor.core.publisher.Flux;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The lazy sequence of all items of one endpoint.
 *
 * <p>This class only holds configuration (endpoint, page size, fetcher). Each
 * call to {@link #iterator()}, {@link #cursor()}, {@link #stream()} or
 * {@link #flux()} starts an independent traversal from the first page, so the
 * same sequence can be iterated any number of times and from several threads.
 *
 * <p><b>Side effects:</b> Be aware that every traversal fetches its pages
 * again from the data source.
 *
 * <p>Example usage:
 * <pre>{@code
 * EndpointSequence<ApiRecord> countries = client.getCountries();
 *
 * for (ApiRecord country : countries) {
 *     process(country);
 * }
 *
 * List<String> codes = countries.stream()
 *     .map(country -> country.getString("countrycode"))
 *     .toList();
 * }</pre>
 *
 * @param <T> the type of items in each page
 */
public class EndpointSequence<T> implements Iterable<T> {

    private final String endpoint;
    private final int pageSize;
    private final PageFetcher<T> pageFetcher;

    /**
     * Creates a new EndpointSequence.
     *
     * @param endpoint API name of the endpoint
     * @param pageSize number of items requested per page, positive
     * @param pageFetcher source of pages
     */
    public EndpointSequence(String endpoint, int pageSize, PageFetcher<T> pageFetcher) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.endpoint = endpoint;
        this.pageSize = pageSize;
        this.pageFetcher = pageFetcher;
    }

    /**
     * Returns a fresh cursor positioned before the first item.
     */
    public PageCursor<T> cursor() {
        return new PageCursor<>(endpoint, pageSize, pageFetcher);
    }

    /**
     * Returns a fresh iterator that starts from the first page.
     */
    @Override
    public Iterator<T> iterator() {
        return new PaginatedIterator<>(cursor());
    }

    /**
     * Returns a sequential, ordered stream of the items. Splitting is not
     * supported, so a parallel stream gains nothing.
     */
    public Stream<T> stream() {
        Spliterator<T> spliterator = Spliterators.spliteratorUnknownSize(
                iterator(),
                Spliterator.ORDERED | Spliterator.NONNULL
        );
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Returns a Flux of the items.
     *
     * <p>Uses {@link Flux#generate} with a cursor per subscription, so pages
     * are fetched on the subscribing thread as downstream requests items.
     * Nothing is fetched ahead of demand.
     *
     * @return Flux of items
     */
    public Flux<T> flux() {
        return Flux.generate(
                this::cursor,
                (cursor, sink) -> {
                    cursor.advance().ifPresentOrElse(sink::next, sink::complete);
                    return cursor;
                }
        );
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getPageSize() {
        return pageSize;
    }
}
