package com.catdb.service;

/**
 * Raised when the text-generation endpoint cannot be reached or returns an unusable response.
 */
public class AiClientException extends RuntimeException {

    /**
     * Create an exception.
     *
     * @param message message
     */
    public AiClientException(String message) {
        super(message);
    }

    /**
     * Create an exception with a cause.
     *
     * @param message message
     * @param cause cause
     */
    public AiClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
