package com.example.bookingcom.exception;

/**
 * Thrown when a page payload is not well-formed XML.
 */
public class PageParseException extends BookingcomException {

    public PageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
