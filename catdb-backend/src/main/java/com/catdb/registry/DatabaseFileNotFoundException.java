package com.catdb.registry;

/**
 * Thrown when a file-based database does not exist.
 */
public class DatabaseFileNotFoundException extends RuntimeException {

    private final String path;

    /**
     * Create a new exception.
     *
     * @param path missing path
     */
    public DatabaseFileNotFoundException(String path) {
        super("Database file not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
