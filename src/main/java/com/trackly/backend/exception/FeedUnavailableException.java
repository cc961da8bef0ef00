package com.trackly.backend.exception;

/**
 * A request that needs a live feed fetch could not get a usable payload.
 */
public class FeedUnavailableException extends RuntimeException {

    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
