package com.catdb.registry;

/**
 * Thrown when registry or mutation input is malformed: unsupported kind, bad port, missing field.
 */
public class ConnectionValidationException extends RuntimeException {

    /**
     * Create a new exception.
     *
     * @param message message
     */
    public ConnectionValidationException(String message) {
        super(message);
    }
}
