package com.trackly.backend.exception;

/**
 * The caller sent a request that cannot be answered (e.g. a blank destination).
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
