package com.example.bookingcom.iterable;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * An Iterator over the items of a {@link PageCursor}.
 *
 * <p>Pages are fetched lazily: {@link #hasNext()} advances the cursor only
 * when no item is pending. Once the sequence has ended, or a fetch has failed,
 * the iterator stays finished even though the underlying cursor could start
 * over.
 *
 * <p>Example usage:
 * <pre>{@code
 * Iterator<ApiRecord> iterator = new PaginatedIterator<>(
 *     new PageCursor<>("getCountries", 1000, fetcher)
 * );
 *
 * while (iterator.hasNext()) {
 *     ApiRecord country = iterator.next();
 *     // Process country
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 *
 * @param <T> the type of items in each page
 */
public class PaginatedIterator<T> implements Iterator<T> {

    private final PageCursor<T> cursor;

    private T pending;
    private boolean finished = false;

    public PaginatedIterator(PageCursor<T> cursor) {
        this.cursor = cursor;
    }

    /**
     * Returns {@code true} if there are more items to iterate.
     *
     * <p>This method may trigger a page fetch.
     *
     * @return {@code true} if there are more items
     * @throws com.example.bookingcom.exception.BookingcomException if a page could not be fetched
     */
    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }

        Optional<T> next;
        try {
            next = cursor.advance();
        } catch (RuntimeException e) {
            finished = true;
            throw e;
        }

        if (next.isEmpty()) {
            finished = true;
            return false;
        }
        pending = next.get();
        return true;
    }

    /**
     * Returns the next item in the iteration.
     *
     * @return the next item
     * @throws NoSuchElementException if no more items are available
     */
    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items available");
        }
        T item = pending;
        pending = null;
        return item;
    }
}
