package com.example.presence.shared.exception;

/**
 * The distributed channel bus could not be reached for a publish or subscribe call.
 */
public class BusUnavailableException extends RuntimeException {

    public BusUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
