package com.example.bookingcom.exception;

/**
 * Base class for all errors raised by the booking.com client.
 *
 * <p>Unchecked so that failures can surface from {@link java.util.Iterator}
 * and {@link java.util.stream.Stream} methods while iterating an endpoint.
 */
public class BookingcomException extends RuntimeException {

    public BookingcomException(String message) {
        super(message);
    }

    public BookingcomException(String message, Throwable cause) {
        super(message, cause);
    }
}
