package com.example.bookingcom.iterable;

import com.example.bookingcom.exception.BookingcomException;
import com.example.bookingcom.exception.PageFetchException;
import com.example.bookingcom.fetcher.PageFetcher;
import com.example.bookingcom.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Stateful cursor over one endpoint, pulling fixed-size pages on demand.
 *
 * <p>The cursor holds the current page, a position inside it and the offset
 * of that page. Pages are fetched at offsets {@code 0, pageSize, 2 * pageSize, ...}:
 * <ul>
 *   <li>the first page is fetched by the first {@link #advance()}</li>
 *   <li>returning the last item of a <em>full</em> page fetches the next page
 *       in the same call</li>
 *   <li>a short or empty page ends the sequence without another fetch</li>
 * </ul>
 *
 * <p>So 5 items with a page size of 3 cost 2 fetches ({@code [3][2]}), and
 * exactly 3 items also cost 2 fetches ({@code [3][]}).
 *
 * <p>When the sequence ends the cursor returns to its initial state, and the
 * next {@link #advance()} starts over from offset 0. A cursor abandoned half
 * way keeps its position; call {@link #reset()} to start over explicitly.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 *
 * @param <T> the type of items in each page
 */
public class PageCursor<T> {

    private static final Logger log = LoggerFactory.getLogger(PageCursor.class);

    private final String endpoint;
    private final int pageSize;
    private final PageFetcher<T> pageFetcher;

    private Page<T> buffer;
    private int position;
    private long offset;

    /**
     * Creates a cursor positioned before the first item.
     *
     * @param endpoint API name of the endpoint
     * @param pageSize number of items requested per page, positive
     * @param pageFetcher source of pages
     */
    public PageCursor(String endpoint, int pageSize, PageFetcher<T> pageFetcher) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.endpoint = endpoint;
        this.pageSize = pageSize;
        this.pageFetcher = pageFetcher;
    }

    /**
     * Returns the next item, fetching pages as needed.
     *
     * @return the next item, or empty at the end of the sequence
     * @throws BookingcomException if a page could not be fetched or parsed
     */
    public Optional<T> advance() {
        if (buffer == null) {
            buffer = fetch(offset);
        } else if (atFullPageBoundary()) {
            // a previous look-ahead failed; try it again
            loadNextPage();
        }

        if (position < buffer.size()) {
            T current = buffer.items().get(position);
            position++;
            if (atFullPageBoundary()) {
                loadNextPage();
            }
            return Optional.of(current);
        }

        log.debug("End of {} after offset {}", endpoint, offset);
        reset();
        return Optional.empty();
    }

    /**
     * Returns the cursor to its initial state; the next {@link #advance()}
     * fetches the first page again.
     */
    public void reset() {
        buffer = null;
        position = 0;
        offset = 0;
    }

    public String endpoint() {
        return endpoint;
    }

    public int pageSize() {
        return pageSize;
    }

    /**
     * Returns the offset of the page currently held.
     */
    public long offset() {
        return offset;
    }

    /**
     * Returns the index of the next item within the current page.
     */
    public int position() {
        return position;
    }

    /**
     * Checks if a page is currently held, i.e. iteration has started and not yet ended.
     */
    public boolean isPrimed() {
        return buffer != null;
    }

    private boolean atFullPageBoundary() {
        return position == buffer.size() && buffer.isFull(pageSize);
    }

    private void loadNextPage() {
        long nextOffset = offset + pageSize;
        Page<T> next = fetch(nextOffset);
        buffer = next;
        position = 0;
        offset = nextOffset;
    }

    private Page<T> fetch(long pageOffset) {
        log.debug("Fetching {} offset={} rows={}", endpoint, pageOffset, pageSize);
        Page<T> page;
        try {
            page = pageFetcher.fetch(endpoint, pageOffset, pageSize);
        } catch (BookingcomException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PageFetchException(endpoint, pageOffset,
                    "Failed to fetch " + endpoint + " at offset " + pageOffset, e);
        }
        return page != null ? page : Page.empty();
    }
}
