package com.catdb.util;

/**
 * Thrown when a connection descriptor cannot be parsed.
 */
public class DescriptorParseException extends RuntimeException {

    /**
     * Create a new exception.
     *
     * @param message message
     */
    public DescriptorParseException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message message
     * @param cause cause
     */
    public DescriptorParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
