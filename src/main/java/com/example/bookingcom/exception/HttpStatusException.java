package com.example.bookingcom.exception;

/**
 * Thrown when the API answers a page request with a non-2xx status.
 */
public class HttpStatusException extends PageFetchException {

    private final int statusCode;

    public HttpStatusException(String endpoint, long offset, int statusCode) {
        super(endpoint, offset, "HTTP error " + statusCode + " fetching " + endpoint + " at offset " + offset);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
