package com.example.bookingcom.exception;

/**
 * Thrown when a page could not be fetched from its data source.
 */
public class PageFetchException extends BookingcomException {

    private final String endpoint;
    private final long offset;

    public PageFetchException(String endpoint, long offset, String message) {
        super(message);
        this.endpoint = endpoint;
        this.offset = offset;
    }

    public PageFetchException(String endpoint, long offset, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.offset = offset;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public long getOffset() {
        return offset;
    }
}
