package com.catdb.registry;

/**
 * Thrown when a named connection has no live handle and could not be reconstructed.
 * The cause, when present, is the last underlying error.
 */
public class ConnectionUnavailableException extends RuntimeException {

    private final String connectionName;

    /**
     * Create a new exception.
     *
     * @param connectionName connection name
     * @param reason short reason
     * @param cause last underlying error (may be null)
     */
    public ConnectionUnavailableException(String connectionName, String reason, Throwable cause) {
        super("Connection '" + connectionName + "' is not available: " + reason, cause);
        this.connectionName = connectionName;
    }

    public String getConnectionName() {
        return connectionName;
    }
}
