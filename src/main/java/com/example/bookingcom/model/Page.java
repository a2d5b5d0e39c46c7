package com.example.bookingcom.model;

import java.util.List;

/**
 * One batch of items returned by a single fetch at a given offset.
 *
 * <p>A page holding fewer items than the requested page size is the last
 * page of its endpoint. An empty page means there is no data at that offset.
 *
 * @param <T> the type of items in the page
 */
public record Page<T>(List<T> items) {

    public Page(List<T> items) {
        this.items = items != null ? List.copyOf(items) : List.of();
    }

    /**
     * Creates an empty page, the "no more data" signal.
     */
    public static <T> Page<T> empty() {
        return new Page<>(List.of());
    }

    /**
     * Creates a page holding the given items in order.
     */
    public static <T> Page<T> of(List<T> items) {
        return new Page<>(items);
    }

    /**
     * Returns the number of items in this page.
     */
    public int size() {
        return items.size();
    }

    /**
     * Checks if this page is empty.
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Checks if this page holds exactly {@code pageSize} items, meaning more
     * data may follow at the next offset.
     */
    public boolean isFull(int pageSize) {
        return items.size() == pageSize;
    }
}
