package com.edgeresponder.api.util;

/**
 * Thrown from routes or the handler to answer with a specific HTTP status.
 */
public class ApiException extends RuntimeException {
    private final int status;

    public ApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
