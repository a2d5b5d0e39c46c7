package com.example.bookingcom.exception;

/**
 * Thrown when an endpoint name outside the fixed catalog is requested.
 */
public class UnknownEndpointException extends BookingcomException {

    private final String name;

    public UnknownEndpointException(String name) {
        super("Unknown endpoint: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
